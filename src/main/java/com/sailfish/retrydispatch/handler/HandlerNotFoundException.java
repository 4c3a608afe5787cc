package com.sailfish.retrydispatch.handler;

/**
 * No handler is registered under the requested name.
 */
public class HandlerNotFoundException extends HandlerResolutionException {

    private static final long serialVersionUID = 1L;

    public HandlerNotFoundException(String handlerName) {
        super(handlerName, "No handler registered for name: " + handlerName);
    }
}
