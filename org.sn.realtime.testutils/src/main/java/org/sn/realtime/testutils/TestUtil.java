package org.sn.realtime.testutils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.fail;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;
import org.junit.jupiter.params.ParameterizedTest;


public final class TestUtil {
    private TestUtil() {
    }

    public static final String PARAMETRIZED_TEST_DISPLAY_NAME =
            ParameterizedTest.DISPLAY_NAME_PLACEHOLDER + " [" + ParameterizedTest.INDEX_PLACEHOLDER + "]";

    /**
     * Code under test that may throw a checked exception, such as a call to {@code CompletableFuture.get}.
     */
    @FunctionalInterface
    public interface ThrowingRunnable {
        void run() throws Exception;
    }

    /**
     * Thread factory naming its threads threadA, threadB, and so on, so that log lines show which worker ran.
     */
    public static ThreadFactory myThreadFactory() {
        AtomicInteger count = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, "thread" + (char) ('A' + count.getAndIncrement()));
            thread.setDaemon(true);
            return thread;
        };
    }

    public static <U extends Throwable> void assertException(ThrowingRunnable code, Class<U> expected) {
        assertException(code, expected, ignored -> { });
    }

    public static <U extends Throwable> void assertException(ThrowingRunnable code, Class<U> expected, String expectedMessage) {
        assertException(code, expected, exception -> assertEquals(expectedMessage, exception.getMessage()));
    }

    /**
     * Run {@code code} and assert that it throws {@code expected} or a subclass of it.
     *
     * @param checker further checks on the thrown exception, for example its message or cause
     * @throws AssertionError if nothing is thrown or the wrong type is thrown
     */
    public static <U extends Throwable> void assertException(ThrowingRunnable code, Class<U> expected, Consumer<U> checker) {
        Throwable thrown = null;
        try {
            code.run();
        } catch (Exception | Error e) {
            thrown = e;
        }
        if (thrown == null) {
            fail("Expected " + expected.getSimpleName() + " but nothing was thrown");
        }
        if (!expected.isInstance(thrown)) {
            fail("Expected " + expected.getSimpleName() + " but got " + thrown.getClass().getSimpleName()
                    + ": " + thrown.getMessage());
        }
        checker.accept(expected.cast(thrown));
    }

    /**
     * Matcher for a value within [low, high], used for timings that carry jitter.
     */
    public static <T extends Comparable<T>> Matcher<T> between(T low, T high) {
        if (low.compareTo(high) > 0) {
            throw new IllegalArgumentException("low " + low + " is greater than high " + high);
        }
        return new TypeSafeMatcher<>() {
            @Override
            protected boolean matchesSafely(T actual) {
                return low.compareTo(actual) <= 0 && actual.compareTo(high) <= 0;
            }

            @Override
            public void describeTo(Description description) {
                description.appendText("a value from ").appendValue(low).appendText(" to ").appendValue(high);
            }
        };
    }
}
