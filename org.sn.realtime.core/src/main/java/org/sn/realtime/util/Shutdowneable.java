package org.sn.realtime.util;

import java.lang.ref.Cleaner;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;


/**
 * Represents that a class has a shutdown method.
 * The shutdown action runs at most once, either when shutdown() is called or,
 * if registerCleanable() was called, when the object becomes phantom reachable.
 */
public abstract class Shutdowneable {
    private static final System.Logger LOGGER = System.getLogger(Shutdowneable.class.getName());
    private static final Cleaner cleaner = Cleaner.create();

    private final AtomicReference<Cleaner.Cleanable> cleanable = new AtomicReference<>();
    private final AtomicBoolean shutdown = new AtomicBoolean();

    protected Shutdowneable() {
    }

    /**
     * After constructing an object that inherits from Shutdowneable, users
     * should call registerCleanable to have the cleaner close this object
     * properly if it is garbage collected without a call to shutdown.
     *
     * <p>If you explicitly call shutdown(), then the cleaner will do nothing.
     *
     * @throws IllegalStateException if already registered
     */
    public final void registerCleanable() {
        Cleaner.Cleanable newCleanable = cleaner.register(this, new ShutdownRunner(getClass(), shutdownAction()));
        if (!cleanable.compareAndSet(null, newCleanable)) {
            newCleanable.clean();
            throw new IllegalStateException("registerCleanable already called");
        }
    }

    /**
     * Override this function to return the action to shut down the object.
     * The runnable must not hold a reference to this object, otherwise the cleaner will never run.
     */
    protected abstract Runnable shutdownAction();

    public final void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        Cleaner.Cleanable registered = cleanable.get();
        if (registered != null) {
            registered.clean();
        } else {
            new ShutdownRunner(getClass(), shutdownAction()).run();
        }
    }

    public final boolean isShutdown() {
        return shutdown.get();
    }

    /**
     * Runs the shutdown action and logs a few lines of the call stack at which the object was created,
     * so that objects cleaned up by the cleaner can be traced back to their owner.
     */
    private static class ShutdownRunner implements Runnable {
        private final Class<?> clazz;
        private final Runnable action;
        private final StackTraceElement[] stackTrace;

        ShutdownRunner(Class<?> clazz, Runnable action) {
            this.clazz = clazz;
            this.action = action;
            this.stackTrace = Arrays.stream(Thread.currentThread().getStackTrace()).skip(3).limit(7).toArray(StackTraceElement[]::new);
        }

        @Override
        public void run() {
            LOGGER.log(System.Logger.Level.INFO, "Shutting down {0}", clazz.getSimpleName());
            if (LOGGER.isLoggable(System.Logger.Level.TRACE)) {
                StringBuilder builder = new StringBuilder("Call stack at creation:");
                for (var element : stackTrace) {
                    builder.append("\n\tat ").append(element);
                }
                LOGGER.log(System.Logger.Level.TRACE, builder.toString());
            }
            action.run();
        }
    }
}
