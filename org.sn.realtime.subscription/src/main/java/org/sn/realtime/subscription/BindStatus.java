package org.sn.realtime.subscription;


/**
 * Status of a channel binding as reported by the transport.
 */
public enum BindStatus {
    SUBSCRIBED,
    ERROR,
    CLOSED
}
