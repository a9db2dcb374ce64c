package org.sn.realtime.util.concurrent;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Delayed;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RunnableScheduledFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import org.sn.realtime.util.MultimapUtils;


/**
 * A scheduled executor service for testing.
 * In a real scheduled executor, scheduled tasks run when the system clock advances to the time when the task is scheduled to run.
 * In this executor, scheduled tasks never run on their own, but they run once advanceTime is called.
 * This allows unit tests to fast-forward through minutes of timers in milliseconds.
 *
 * <p>Tasks may schedule further tasks while they run (for example a retry scheduled from a failed attempt).
 * Those tasks run within the same call to advanceTime if their time falls before the end of the advance.
 *
 * <p>Tasks see the time at which they were scheduled to run through {@link #currentTimeMillis()}.
 * Callers outside of tasks see the current virtual time.
 */
public class VirtualTimeScheduledExecutor implements ScheduledExecutorService {
    private final ThreadPoolExecutor realExecutor;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition taskFinished = lock.newCondition();
    @GuardedBy("lock") private final SortedMap<Long /*millis*/, Collection<VirtualFutureTask<?>>> scheduledTasks = new TreeMap<>();
    @GuardedBy("lock") private long nowMillis;
    @GuardedBy("lock") private boolean shutdown;
    private final ThreadLocal<Long> taskTimeMillis = new ThreadLocal<>();

    /**
     * Create a scheduled executor service for testing.
     *
     * @param corePoolSize the number of threads in the real executor used to actually run jobs
     * @param threadFactory the thread factory
     * @param startTime the initial time
     */
    public VirtualTimeScheduledExecutor(int corePoolSize, ThreadFactory threadFactory, long startTime) {
        this.realExecutor = (ThreadPoolExecutor) Executors.newFixedThreadPool(corePoolSize, threadFactory);
        this.nowMillis = startTime;
    }

    // Lifecycle:

    /**
     * {@inheritDoc}
     *
     * <p>Cancels periodic tasks that have not started. Non periodic tasks will run at the next call to advanceTime.
     */
    @Override
    public void shutdown() {
        lock.lock();
        try {
            for (var timeIter = scheduledTasks.entrySet().iterator(); timeIter.hasNext(); ) {
                var tasks = timeIter.next().getValue();
                tasks.removeIf(VirtualFutureTask::isPeriodic);
                if (tasks.isEmpty()) {
                    timeIter.remove();
                }
            }
            shutdown = true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public @Nonnull List<Runnable> shutdownNow() {
        lock.lock();
        try {
            List<Runnable> notStarted = scheduledTasks.values().stream()
                                                      .flatMap(Collection::stream)
                                                      .collect(Collectors.toList());
            scheduledTasks.clear();
            shutdown = true;
            notStarted.addAll(realExecutor.shutdownNow());
            return notStarted;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isShutdown() {
        lock.lock();
        try {
            return shutdown;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isTerminated() {
        lock.lock();
        try {
            return shutdown && scheduledTasks.isEmpty() && realExecutor.isTerminated();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean awaitTermination(long timeout, @Nonnull TimeUnit unit) throws InterruptedException {
        boolean finishedAllTasks;
        lock.lock();
        try {
            finishedAllTasks = scheduledTasks.isEmpty();
        } finally {
            lock.unlock();
        }
        realExecutor.shutdown();
        return realExecutor.awaitTermination(timeout, unit) && finishedAllTasks;
    }

    // Overrides that forward to realExecutor:

    @Override
    public @Nonnull Future<?> submit(@Nonnull Runnable task) {
        return realExecutor.submit(task);
    }

    @Override
    public @Nonnull <T> Future<T> submit(@Nonnull Runnable task, T result) {
        return realExecutor.submit(task, result);
    }

    @Override
    public @Nonnull <T> Future<T> submit(@Nonnull Callable<T> task) {
        return realExecutor.submit(task);
    }

    @Override
    public @Nonnull <T> List<Future<T>> invokeAll(@Nonnull Collection<? extends Callable<T>> tasks) throws InterruptedException {
        return realExecutor.invokeAll(tasks);
    }

    @Override
    public @Nonnull <T> List<Future<T>> invokeAll(@Nonnull Collection<? extends Callable<T>> tasks, long timeout, @Nonnull TimeUnit unit)
            throws InterruptedException {
        return realExecutor.invokeAll(tasks, timeout, unit);
    }

    @Override
    public @Nonnull <T> T invokeAny(@Nonnull Collection<? extends Callable<T>> tasks) throws InterruptedException, ExecutionException {
        return realExecutor.invokeAny(tasks);
    }

    @Override
    public <T> T invokeAny(@Nonnull Collection<? extends Callable<T>> tasks, long timeout, @Nonnull TimeUnit unit)
            throws InterruptedException, ExecutionException, TimeoutException {
        return realExecutor.invokeAny(tasks, timeout, unit);
    }

    @Override
    public void execute(@Nonnull Runnable command) {
        realExecutor.execute(command);
    }

    // Schedule functions:

    @Override
    public @Nonnull ScheduledFuture<?> schedule(@Nonnull Runnable command, long delay, @Nonnull TimeUnit unit) {
        return enqueue(new VirtualFutureTask<Void>(this, command, unit.toMillis(delay), 0));
    }

    @Override
    public @Nonnull <V> ScheduledFuture<V> schedule(@Nonnull Callable<V> callable, long delay, @Nonnull TimeUnit unit) {
        return enqueue(new VirtualFutureTask<>(this, callable, unit.toMillis(delay)));
    }

    @Override
    public @Nonnull ScheduledFuture<?> scheduleAtFixedRate(@Nonnull Runnable command, long initialDelay, long period, @Nonnull TimeUnit unit) {
        checkPeriod(period);
        return enqueue(new VirtualFutureTask<Void>(this, command, unit.toMillis(initialDelay), unit.toMillis(period)));
    }

    @Override
    public @Nonnull ScheduledFuture<?> scheduleWithFixedDelay(@Nonnull Runnable command, long initialDelay, long delay, @Nonnull TimeUnit unit) {
        checkPeriod(delay);
        // a task takes no virtual time, so fixed delay and fixed rate are the same thing here
        return enqueue(new VirtualFutureTask<Void>(this, command, unit.toMillis(initialDelay), unit.toMillis(delay)));
    }

    private static void checkPeriod(long period) {
        if (period <= 0) {
            throw new IllegalArgumentException("period must be positive: " + period);
        }
    }

    private <T> VirtualFutureTask<T> enqueue(VirtualFutureTask<T> task) {
        lock.lock();
        try {
            if (shutdown) {
                throw new RejectedExecutionException("executor is shut down");
            }
            multimap().put(task.timeMillis, task);
            return task;
        } finally {
            lock.unlock();
        }
    }

    private MultimapUtils<Long, VirtualFutureTask<?>> multimap() {
        return new MultimapUtils<>(scheduledTasks, ArrayList::new);
    }

    private static class VirtualFutureTask<T> extends FutureTask<T> implements RunnableScheduledFuture<T> {
        private final VirtualTimeScheduledExecutor executor;
        private final long periodMillis; // zero means non recurring
        private volatile long timeMillis;

        private VirtualFutureTask(VirtualTimeScheduledExecutor executor, Runnable runnable, long delayMillis, long periodMillis) {
            super(runnable, null);
            this.executor = executor;
            this.periodMillis = periodMillis;
            this.timeMillis = executor.currentTimeMillis() + Math.max(delayMillis, 0);
        }

        private VirtualFutureTask(VirtualTimeScheduledExecutor executor, Callable<T> callable, long delayMillis) {
            super(callable);
            this.executor = executor;
            this.periodMillis = 0;
            this.timeMillis = executor.currentTimeMillis() + Math.max(delayMillis, 0);
        }

        @Override
        public long getDelay(@Nonnull TimeUnit unit) {
            return unit.convert(timeMillis - executor.currentTimeMillis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(@Nonnull Delayed that) {
            return Long.compare(this.getDelay(TimeUnit.MILLISECONDS), that.getDelay(TimeUnit.MILLISECONDS));
        }

        @Override
        public boolean isPeriodic() {
            return periodMillis != 0;
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            boolean cancelled = super.cancel(mayInterruptIfRunning);
            executor.remove(this);
            return cancelled;
        }

        @Override
        public void run() {
            executor.taskTimeMillis.set(timeMillis);
            try {
                if (!isPeriodic()) {
                    super.run();
                } else if (super.runAndReset()) {
                    executor.reschedule(this, timeMillis + periodMillis);
                }
            } finally {
                executor.taskTimeMillis.remove();
            }
        }
    }

    /**
     * Advance the time by the given amount, executing all tasks scheduled up till the new time in time order.
     * Blocks until all of those tasks finish because that's what unit tests want.
     *
     * @throws CompletionException if this thread is interrupted with the cause as the InterruptedException
     */
    public synchronized void advanceTime(long time, @Nonnull TimeUnit unit) {
        long targetMillis;
        lock.lock();
        try {
            targetMillis = nowMillis + unit.toMillis(time);
        } finally {
            lock.unlock();
        }
        try {
            doAdvanceTime(targetMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException(e);
        }
    }

    private void doAdvanceTime(long targetMillis) throws InterruptedException {
        int corePoolSize = realExecutor.getCorePoolSize();
        List<Future<?>> running = new ArrayList<>();
        while (true) {
            Collection<VirtualFutureTask<?>> tasksToRun = extractTasksToRun(targetMillis, corePoolSize - running.size());
            if (tasksToRun.isEmpty() && running.isEmpty()) {
                break;
            }
            for (var task : tasksToRun) {
                CompletableFuture<Void> future = CompletableFuture.runAsync(task, realExecutor);
                future.whenComplete((unused, error) -> signalTaskFinished());
                running.add(future);
            }
            waitForAnyDone(running);
            running.removeIf(Future::isDone);
        }
        lock.lock();
        try {
            nowMillis = Math.max(nowMillis, targetMillis);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Return the earliest tasks scheduled at or before targetMillis, and move the clock to the time of those tasks.
     *
     * @param numTasks maximum number of tasks to retrieve
     */
    private @Nonnull Collection<VirtualFutureTask<?>> extractTasksToRun(long targetMillis, int numTasks) {
        lock.lock();
        try {
            Collection<VirtualFutureTask<?>> tasksToRun = new ArrayList<>();
            if (numTasks <= 0 || scheduledTasks.isEmpty()) {
                return tasksToRun;
            }
            long firstTime = scheduledTasks.firstKey();
            if (firstTime > targetMillis) {
                return tasksToRun;
            }
            // only run tasks of the same time together so that a later task never runs before an earlier one
            Collection<VirtualFutureTask<?>> tasks = scheduledTasks.get(firstTime);
            for (var iter = tasks.iterator(); iter.hasNext() && tasksToRun.size() < numTasks; ) {
                tasksToRun.add(iter.next());
                iter.remove();
            }
            if (tasks.isEmpty()) {
                scheduledTasks.remove(firstTime);
            }
            nowMillis = Math.max(nowMillis, firstTime);
            return tasksToRun;
        } finally {
            lock.unlock();
        }
    }

    private void waitForAnyDone(List<Future<?>> futures) throws InterruptedException {
        lock.lock();
        try {
            while (!futures.isEmpty() && futures.stream().noneMatch(Future::isDone)) {
                taskFinished.await();
            }
        } finally {
            lock.unlock();
        }
    }

    private void remove(VirtualFutureTask<?> task) {
        lock.lock();
        try {
            multimap().remove(task.timeMillis, task);
        } finally {
            lock.unlock();
        }
    }

    private void reschedule(VirtualFutureTask<?> task, long nextTimeMillis) {
        lock.lock();
        try {
            if (!shutdown && !task.isCancelled()) {
                task.timeMillis = nextTimeMillis;
                multimap().put(nextTimeMillis, task);
            }
        } finally {
            lock.unlock();
        }
    }

    private void signalTaskFinished() {
        lock.lock();
        try {
            taskFinished.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Return the number of tasks waiting for their time to come.
     */
    public int getScheduledTaskCount() {
        lock.lock();
        try {
            return scheduledTasks.values().stream().mapToInt(Collection::size).sum();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Return the time at which the current task is scheduled to run if called from a task, else the current virtual time.
     */
    public long currentTimeMillis() {
        @Nullable Long result = taskTimeMillis.get();
        if (result != null) {
            return result;
        }
        lock.lock();
        try {
            return nowMillis;
        } finally {
            lock.unlock();
        }
    }
}
