package com.intteq.consumer.dispatch.binding;

import com.intteq.consumer.dispatch.DeliveryEnvelope;
import com.intteq.consumer.dispatch.codec.BodyCodec;
import com.intteq.consumer.dispatch.descriptor.ConsumerDescriptor;
import com.intteq.consumer.dispatch.descriptor.ParameterSource;
import com.rabbitmq.client.Channel;

import java.lang.reflect.Type;
import java.util.List;

/**
 * Produces the argument array for one handler invocation.
 *
 * <p>Arguments are positional and derived from scratch on every call; nothing is cached
 * between deliveries. The binder has no side effects apart from body decoding, whose
 * failure propagates as a {@link com.intteq.consumer.dispatch.exception.BodyCodecException}.
 */
public class ParameterBinder {

    private final BodyCodec bodyCodec;

    public ParameterBinder(BodyCodec bodyCodec) {
        this.bodyCodec = bodyCodec;
    }

    public Object[] resolve(ConsumerDescriptor descriptor, DeliveryEnvelope envelope, Channel channel) {
        List<ParameterSource> sources = descriptor.parameterSources();
        List<Type> types = descriptor.parameterTypes();

        Object[] args = new Object[sources.size()];
        for (int i = 0; i < args.length; i++) {
            args[i] = resolve(sources.get(i), types.get(i), envelope, channel);
        }
        return args;
    }

    Object resolve(ParameterSource source, Type parameterType, DeliveryEnvelope envelope, Channel channel) {
        return switch (source) {
            case BODY -> bodyCodec.decode(envelope.body(), parameterType);
            case DELIVERY_TAG -> envelope.deliveryTag();
            case CHANNEL -> channel;
            case PROPERTIES -> envelope.properties();
            case CONSUMER_TAG -> envelope.consumerTag();
            case EXCHANGE -> envelope.exchange();
            case REDELIVERED -> envelope.redelivered();
            case ROUTING_KEY -> envelope.routingKey();
        };
    }
}
