package com.sailfish.retrydispatch.dispatch;

/**
 * The dispatch queue refused a message.
 */
public class DispatchQueueFullException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DispatchQueueFullException(String message) {
        super(message);
    }

    public DispatchQueueFullException(String message, Throwable cause) {
        super(message, cause);
    }
}
