package org.sn.realtime.subscription;

public enum ConnectionStatus {
    CONNECTED,
    CONNECTING,
    DISCONNECTED
}
