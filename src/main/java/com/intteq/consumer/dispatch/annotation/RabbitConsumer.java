package com.intteq.consumer.dispatch.annotation;

import com.intteq.consumer.dispatch.AckMode;

import java.lang.annotation.*;

/**
 * Marks a method as the consumer of a RabbitMQ queue.
 *
 * <p>Every parameter of the method must carry exactly one binding annotation
 * ({@link FromBody}, {@link FromDeliveryTag}, {@link FromChannel}, {@link FromProperties},
 * {@link FromConsumerTag}, {@link FromExchange}, {@link FromRedelivered} or
 * {@link FromRoutingKey}). Unannotated parameters are rejected when the consumer is registered.
 *
 * <p>Notes:
 * <ul>
 *   <li>{@link #ack()} is fixed per method; it is never decided per message.</li>
 *   <li>{@link #requeueOnFailure()} is passed to {@code basicNack} when the handler
 *       (or anything around it) fails.</li>
 * </ul>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface RabbitConsumer {

    /**
     * Name of the queue to consume from. The queue must already exist.
     */
    String queue();

    /**
     * When the delivery is acknowledged.
     *
     * <p>Default: {@link AckMode#ACK_ON_INVOKE}.
     */
    AckMode ack() default AckMode.ACK_ON_INVOKE;

    /**
     * Whether a failed delivery is requeued ({@code true}) or dropped / dead-lettered ({@code false}).
     *
     * <p>Default: {@code false}.
     */
    boolean requeueOnFailure() default false;
}
