package org.sn.realtime.util.concurrent;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;


public class MoreExecutors {
    private MoreExecutors() {
    }

    /**
     * Create a scheduled executor service for testing.
     * Similar to {@link java.util.concurrent.Executors#newScheduledThreadPool}
     * except that scheduled tasks don't run until advanceTime is called.
     *
     * @param corePoolSize the number of threads in the real executor used to actually run jobs
     * @param startTime the initial time. Will typically be System.currentTimeMillis(), but can set to something else for unit tests.
     */
    public static VirtualTimeScheduledExecutor newVirtualTimeScheduledThreadPool(int corePoolSize, long startTime) {
        return new VirtualTimeScheduledExecutor(corePoolSize, Executors.defaultThreadFactory(), startTime);
    }

    /**
     * Create a scheduled executor service for testing.
     *
     * @param corePoolSize the number of threads in the real executor used to actually run jobs
     * @param threadFactory the thread factory
     * @param startTime the initial time
     */
    public static VirtualTimeScheduledExecutor newVirtualTimeScheduledThreadPool(int corePoolSize, ThreadFactory threadFactory, long startTime) {
        return new VirtualTimeScheduledExecutor(corePoolSize, threadFactory, startTime);
    }

    /**
     * Advance the time to the given time, executing all runnables up till the given time.
     *
     * <p>Calls the real advanceTime if service is a VirtualTimeScheduledExecutor,
     * and waits for the desired time if service is a java.util.concurrent.ScheduledThreadPoolExecutor.
     *
     * @throws CompletionException if this thread is interrupted with the cause as the InterruptedException
     * @see VirtualTimeScheduledExecutor#advanceTime(long, TimeUnit)
     */
    public static void advanceTime(ScheduledExecutorService service, long time, TimeUnit unit) {
        if (service instanceof VirtualTimeScheduledExecutor virtualService) {
            virtualService.advanceTime(time, unit);
        } else {
            try {
                unit.sleep(time);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CompletionException(e);
            }
        }
    }

    /**
     * Return the current time as seen by tasks of the given service.
     * For a VirtualTimeScheduledExecutor this is the virtual time (the scheduled time of the task if called from a task).
     * For any other executor this is System.currentTimeMillis().
     */
    public static long currentTimeMillis(ScheduledExecutorService service) {
        if (service instanceof VirtualTimeScheduledExecutor virtualService) {
            return virtualService.currentTimeMillis();
        } else {
            return System.currentTimeMillis();
        }
    }

    /**
     * Shut down an executor and wait a short time for running tasks to finish.
     * Errors are ignored.
     */
    public static void closeExecutorQuietly(ExecutorService executor) {
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        try {
            //noinspection ResultOfMethodCallIgnored
            executor.awaitTermination(100, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
