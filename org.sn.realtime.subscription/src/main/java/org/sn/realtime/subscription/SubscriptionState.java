package org.sn.realtime.subscription;

public enum SubscriptionState {
    CONNECTING,
    CONNECTED,
    DISCONNECTED,
    ERROR
}
