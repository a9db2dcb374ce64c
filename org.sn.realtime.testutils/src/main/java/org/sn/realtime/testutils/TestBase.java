package org.sn.realtime.testutils;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.junit.jupiter.api.extension.ExtendWith;


/**
 * Base class for tests of the realtime modules.
 * Prints a banner line around each test class and each test, with wall clock elapsed time,
 * so that the log lines written by the code under test can be told apart in the console output.
 * Failed tests also get a shortened stack trace through {@link LogFailureToConsoleTestWatcher}.
 */
@ExtendWith(LogFailureToConsoleTestWatcher.class)
public abstract class TestBase {
    private static final String SEPARATOR = "=".repeat(100);

    private static Instant classStarted;
    private Instant testStarted;

    @BeforeAll
    static void announceClass(TestInfo testInfo) {
        classStarted = Instant.now();
        System.out.println(SEPARATOR);
        System.out.println("begin " + testInfo.getDisplayName());
    }

    @AfterAll
    static void summarizeClass(TestInfo testInfo) {
        System.out.println(SEPARATOR);
        System.out.println("end " + testInfo.getDisplayName() + " after " + elapsedSince(classStarted));
    }

    @BeforeEach
    void announceTest(TestInfo testInfo) {
        testStarted = Instant.now();
        System.out.println(SEPARATOR);
        System.out.println(">> " + testInfo.getDisplayName());
    }

    @AfterEach
    void summarizeTest(TestInfo testInfo) {
        System.out.println("<< " + testInfo.getDisplayName() + " after " + elapsedSince(testStarted));
    }

    private static String elapsedSince(Instant start) {
        return Duration.between(start, Instant.now()).toMillis() + "ms";
    }
}
