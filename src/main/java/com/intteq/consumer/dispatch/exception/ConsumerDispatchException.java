package com.intteq.consumer.dispatch.exception;

/**
 * Base type for failures raised by the consumer dispatch library.
 */
public class ConsumerDispatchException extends RuntimeException {

    public ConsumerDispatchException(String message) {
        super(message);
    }

    public ConsumerDispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
