package com.intteq.consumer.dispatch.annotation;

import java.lang.annotation.*;

/**
 * Binds a consumer method parameter to the delivery tag ({@code long} or {@code Long}).
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface FromDeliveryTag {
}
