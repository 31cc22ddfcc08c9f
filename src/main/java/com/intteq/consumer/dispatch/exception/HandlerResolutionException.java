package com.intteq.consumer.dispatch.exception;

/**
 * Thrown when a handler scope cannot produce an instance of the consumer type.
 */
public class HandlerResolutionException extends ConsumerDispatchException {

    public HandlerResolutionException(String message) {
        super(message);
    }

    public HandlerResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
