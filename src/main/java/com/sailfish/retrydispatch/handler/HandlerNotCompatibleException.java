package com.sailfish.retrydispatch.handler;

/**
 * The requested name is bound to something that does not satisfy the worker contract.
 */
public class HandlerNotCompatibleException extends HandlerResolutionException {

    private static final long serialVersionUID = 1L;

    public HandlerNotCompatibleException(String handlerName, String reason) {
        super(handlerName, "Handler '" + handlerName + "' is not a compatible retryable worker: " + reason);
    }
}
