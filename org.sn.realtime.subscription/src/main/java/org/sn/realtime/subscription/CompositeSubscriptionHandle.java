package org.sn.realtime.subscription;

import java.util.List;


/**
 * The handles returned by a batch subscribe, released together.
 */
public class CompositeSubscriptionHandle {
    private final List<SubscriptionHandle> handles;

    CompositeSubscriptionHandle(List<SubscriptionHandle> handles) {
        this.handles = List.copyOf(handles);
    }

    public List<SubscriptionHandle> handles() {
        return handles;
    }

    /**
     * Release every member handle. Calling it a second time does nothing.
     */
    public void unsubscribe() {
        handles.forEach(SubscriptionHandle::unsubscribe);
    }
}
