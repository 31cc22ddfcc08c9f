package com.intteq.consumer.dispatch.annotation;

import java.lang.annotation.*;

/**
 * Binds a consumer method parameter to the {@link com.rabbitmq.client.Channel} the delivery arrived on.
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface FromChannel {
}
