package com.intteq.consumer.dispatch.exception;

/**
 * Thrown at registration time when a consumer method or its bindings are inconsistent,
 * e.g. a parameter without a binding annotation or a binding that cannot supply the
 * parameter's declared type.
 */
public class DispatchConfigurationException extends ConsumerDispatchException {

    public DispatchConfigurationException(String message) {
        super(message);
    }
}
