package com.sailfish.retrydispatch.handler;

/**
 * A handler name could not be turned into a usable worker.
 */
public abstract class HandlerResolutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String handlerName;

    protected HandlerResolutionException(String handlerName, String message) {
        super(message);
        this.handlerName = handlerName;
    }

    public String getHandlerName() {
        return handlerName;
    }
}
