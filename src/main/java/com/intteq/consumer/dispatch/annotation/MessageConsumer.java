package com.intteq.consumer.dispatch.annotation;

import org.springframework.stereotype.Component;

import java.lang.annotation.*;

/**
 * Marks a Spring bean class as a holder of {@link RabbitConsumer} methods.
 *
 * <p>Only classes carrying this annotation are scanned. The class itself is never
 * instantiated during scanning; a fresh instance is resolved from the handler scope
 * for every delivery, so prototype-scoped beans get one instance per message.
 *
 * <p>Example:
 * <pre>
 * {@code
 * @MessageConsumer
 * @Scope("prototype")
 * public class OrderConsumer {
 *
 *     @RabbitConsumer(queue = "orders.created", ack = AckMode.ACK_ON_INVOKE)
 *     public void onCreated(@FromBody OrderCreated payload, @FromDeliveryTag long tag) {
 *         // business logic...
 *     }
 * }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Component
public @interface MessageConsumer {

    /**
     * Optional human-readable description for governance or documentation tools.
     */
    String description() default "";
}
