package com.intteq.consumer.dispatch.exception;

/**
 * Wraps the {@link java.io.IOException} raised by the channel when an ack, nack or
 * publish call fails.
 */
public class DeliverySettlementException extends ConsumerDispatchException {

    public DeliverySettlementException(String message, Throwable cause) {
        super(message, cause);
    }
}
