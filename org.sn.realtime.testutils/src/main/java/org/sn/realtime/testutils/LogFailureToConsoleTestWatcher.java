package org.sn.realtime.testutils;

import java.util.Arrays;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.TestWatcher;


/**
 * Print the stack of a failed test to stderr as soon as the test finishes, cut after the deepest
 * org.sn.realtime frame so that the JUnit and reflection frames beneath it are left out.
 */
public final class LogFailureToConsoleTestWatcher implements TestWatcher {
    private static final String OWN_PACKAGE_PREFIX = "org.sn.realtime.";

    @Override
    public void testAborted(ExtensionContext context, Throwable cause) {
        System.err.println(describe(context) + " aborted: " + cause.getMessage());
    }

    @Override
    public void testFailed(ExtensionContext context, Throwable cause) {
        System.err.println(describe(context) + " failed");
        cause.setStackTrace(withoutFrameworkFrames(cause.getStackTrace()));
        cause.printStackTrace();
    }

    private static String describe(ExtensionContext context) {
        return context.getRequiredTestClass().getSimpleName() + " > " + context.getDisplayName();
    }

    private static StackTraceElement[] withoutFrameworkFrames(StackTraceElement[] frames) {
        for (int index = frames.length - 1; index >= 0; index--) {
            if (frames[index].getClassName().startsWith(OWN_PACKAGE_PREFIX)) {
                return Arrays.copyOf(frames, index + 1);
            }
        }
        return frames;
    }
}
