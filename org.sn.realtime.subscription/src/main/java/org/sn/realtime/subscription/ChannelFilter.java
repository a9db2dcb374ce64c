package org.sn.realtime.subscription;

import java.util.Objects;
import javax.annotation.Nullable;


/**
 * Narrows a channel to certain events and rows of a table.
 *
 * @param event the events to receive
 * @param schema the database schema of the table
 * @param rowFilter a row filter expression such as <code>job_id=eq.42</code>, or null for all rows
 */
public record ChannelFilter(ChangeEventType event, String schema, @Nullable String rowFilter) {
    public static final String DEFAULT_SCHEMA = "public";

    public ChannelFilter {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(schema, "schema");
    }

    /**
     * All events on the rows matching rowFilter in the default schema.
     */
    public static ChannelFilter rows(String rowFilter) {
        return new ChannelFilter(ChangeEventType.ALL, DEFAULT_SCHEMA, rowFilter);
    }

    public static ChannelFilter events(ChangeEventType event) {
        return new ChannelFilter(event, DEFAULT_SCHEMA, null);
    }
}
