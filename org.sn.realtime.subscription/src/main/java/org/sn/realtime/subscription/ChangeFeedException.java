package org.sn.realtime.subscription;

import java.io.Serial;


/**
 * Failure reported by the change feed transport, for example a channel that could not be opened.
 */
public class ChangeFeedException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    public ChangeFeedException(String error) {
        super(error);
    }

    public ChangeFeedException(String error, Throwable cause) {
        super(error, cause);
    }
}
