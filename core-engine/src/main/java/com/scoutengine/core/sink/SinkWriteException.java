package com.scoutengine.core.sink;

/**
 * Thrown by an {@link OpportunitySink} when a write fails.
 *
 * @since 1.0.0
 */
public class SinkWriteException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SinkWriteException(String message) {
        super(message);
    }

    public SinkWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
