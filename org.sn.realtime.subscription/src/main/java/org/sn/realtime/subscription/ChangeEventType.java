package org.sn.realtime.subscription;


/**
 * The kind of row change reported by the change feed.
 * ALL is only meaningful in a {@link ChannelFilter}.
 */
public enum ChangeEventType {
    INSERT,
    UPDATE,
    DELETE,
    ALL
}
