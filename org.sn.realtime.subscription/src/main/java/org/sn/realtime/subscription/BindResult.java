package org.sn.realtime.subscription;


/**
 * Outcome of binding a subscription to a new channel.
 */
public enum BindResult {
    /**
     * The channel is open and its callbacks are registered.
     */
    BOUND,

    /**
     * The channel could not be opened. The subscription stays, marked as ERROR, and a retry is scheduled.
     */
    FAILED,

    /**
     * The key was unsubscribed or replaced before the bind finished, and any channel opened for it was closed.
     */
    ABANDONED,

    /**
     * Another bind of the same key was already in progress, so this request was ignored.
     */
    COALESCED
}
