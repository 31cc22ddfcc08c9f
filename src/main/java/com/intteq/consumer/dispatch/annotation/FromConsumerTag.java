package com.intteq.consumer.dispatch.annotation;

import java.lang.annotation.*;

/**
 * Binds a consumer method parameter to the consumer tag the broker assigned to the subscription.
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface FromConsumerTag {
}
