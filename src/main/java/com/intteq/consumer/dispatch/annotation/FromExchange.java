package com.intteq.consumer.dispatch.annotation;

import java.lang.annotation.*;

/**
 * Binds a consumer method parameter to the exchange the message was published to.
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface FromExchange {
}
