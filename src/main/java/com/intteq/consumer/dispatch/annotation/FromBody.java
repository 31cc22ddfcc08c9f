package com.intteq.consumer.dispatch.annotation;

import java.lang.annotation.*;

/**
 * Binds a consumer method parameter to the message body, decoded to the parameter's declared type.
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface FromBody {
}
