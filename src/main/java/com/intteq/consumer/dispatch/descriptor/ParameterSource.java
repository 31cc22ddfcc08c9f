package com.intteq.consumer.dispatch.descriptor;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import org.springframework.util.ClassUtils;

/**
 * Field of a delivery (or of the dispatch context) that feeds one handler parameter.
 */
public enum ParameterSource {

    /** Message body decoded to the parameter's declared type. */
    BODY(null),
    DELIVERY_TAG(Long.class),
    CHANNEL(Channel.class),
    PROPERTIES(AMQP.BasicProperties.class),
    CONSUMER_TAG(String.class),
    EXCHANGE(String.class),
    REDELIVERED(Boolean.class),
    ROUTING_KEY(String.class);

    private final Class<?> valueType;

    ParameterSource(Class<?> valueType) {
        this.valueType = valueType;
    }

    /**
     * Whether a value produced by this source can be passed to a parameter of the given type.
     * Primitive parameters accept their wrapper type.
     */
    public boolean canSupply(Class<?> parameterType) {
        return valueType == null || ClassUtils.isAssignable(parameterType, valueType);
    }
}
