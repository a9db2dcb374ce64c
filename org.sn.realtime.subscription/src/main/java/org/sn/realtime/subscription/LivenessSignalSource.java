package org.sn.realtime.subscription;

import java.time.Duration;


/**
 * Signals from the host environment about network and user activity.
 * The host adapts its own events (network interface changes, window focus, input events) to these calls.
 */
public interface LivenessSignalSource {
    void onNetworkUp();

    void onNetworkDown();

    /**
     * The application came back to the foreground.
     *
     * @param idleDuration how long the application was in the background
     */
    void onForegroundRegained(Duration idleDuration);

    void onUserActivity();
}
