package org.sn.realtime.subscription;

import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;
import javax.annotation.Nullable;


/**
 * The backend change feed, which publishes row changes of a table over channels.
 *
 * <p>Calls that return a CompletionStage complete it exceptionally on failure, typically with a {@link ChangeFeedException}.
 * Callers also treat an exception thrown directly by these functions as a failure.
 *
 * <p>The transport must invoke the callbacks registered for one channel in the order the events happened.
 */
public interface ChangeFeedTransport {
    /**
     * Called for each row change on a channel.
     */
    interface ChangeListener {
        /**
         * @param eventType INSERT, UPDATE, or DELETE
         * @param payload the changed row in whatever form the transport uses
         */
        void onChange(ChangeEventType eventType, @Nullable Object payload);
    }

    CompletionStage<ChannelHandle> openChannel(String table, @Nullable ChannelFilter filter);

    CompletionStage<Void> closeChannel(ChannelHandle handle);

    void onChange(ChannelHandle handle, ChangeListener listener);

    /**
     * Register a callback invoked whenever the backend reports that the channel is still alive.
     */
    void onPresence(ChannelHandle handle, Runnable listener);

    void onBindStatus(ChannelHandle handle, Consumer<BindStatus> listener);

    /**
     * A lightweight check of whether the backend can be reached.
     * Completes with false or exceptionally if it cannot.
     */
    CompletionStage<Boolean> reachabilityProbe();
}
