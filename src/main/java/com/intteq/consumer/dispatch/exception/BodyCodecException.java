package com.intteq.consumer.dispatch.exception;

/**
 * Thrown when a message body cannot be decoded into the requested type, or a
 * handler result cannot be encoded.
 */
public class BodyCodecException extends ConsumerDispatchException {

    public BodyCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
