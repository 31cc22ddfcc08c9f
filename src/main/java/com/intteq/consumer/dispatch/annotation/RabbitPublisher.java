package com.intteq.consumer.dispatch.annotation;

import java.lang.annotation.*;

/**
 * Publishes the return value of a {@link RabbitConsumer} method as a new message.
 *
 * <p>The returned value is encoded by the body codec (raw bytes pass through, strings are
 * UTF-8 encoded, anything else is written as JSON) and published to {@link #exchange()}
 * with {@link #routingKey()}. No message properties are attached.
 *
 * <p>Example:
 * <pre>
 * {@code
 * @RabbitConsumer(queue = "invoices.requested", ack = AckMode.ACK_ON_PUBLISH)
 * @RabbitPublisher(exchange = "invoices", routingKey = "invoice.issued")
 * public Invoice issue(@FromBody InvoiceRequest request) { ... }
 * }
 * </pre>
 *
 * <p>Must be combined with {@link RabbitConsumer}; a standalone publisher is a configuration error.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface RabbitPublisher {

    /**
     * Destination exchange. Empty string targets the default exchange.
     */
    String exchange();

    /**
     * Routing key used for the published message.
     */
    String routingKey() default "";
}
