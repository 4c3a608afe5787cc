package com.sailfish.retrydispatch.dispatch;

/**
 * A token in a dispatch message is not a valid execution record id.
 */
public class MalformedIdException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public MalformedIdException(String token, Throwable cause) {
        super("Malformed execution record id: '" + token + "'", cause);
    }
}
