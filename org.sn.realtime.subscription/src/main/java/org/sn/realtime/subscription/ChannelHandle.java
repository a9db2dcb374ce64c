package org.sn.realtime.subscription;


/**
 * Opaque handle to one live binding of the change feed transport.
 * Each subscription owns its handle exclusively, and a reconnect always creates a new one.
 */
public interface ChannelHandle {
    String channelName();
}
