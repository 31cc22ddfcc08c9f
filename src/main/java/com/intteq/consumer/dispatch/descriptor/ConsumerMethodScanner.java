package com.intteq.consumer.dispatch.descriptor;

import com.intteq.consumer.dispatch.annotation.*;
import com.intteq.consumer.dispatch.exception.DispatchConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.util.ClassUtils;
import org.springframework.util.ReflectionUtils;

import java.lang.annotation.Annotation;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds {@link ConsumerDescriptor}s from {@link RabbitConsumer} / {@link RabbitPublisher}
 * methods and the binding annotations on their parameters.
 *
 * <p>Every parameter must carry exactly one binding annotation. Anything else fails the
 * registration instead of producing a call with the wrong number of arguments later.
 */
@Slf4j
public class ConsumerMethodScanner {

    private static final Map<Class<? extends Annotation>, ParameterSource> BINDINGS = new LinkedHashMap<>();

    static {
        BINDINGS.put(FromBody.class, ParameterSource.BODY);
        BINDINGS.put(FromDeliveryTag.class, ParameterSource.DELIVERY_TAG);
        BINDINGS.put(FromChannel.class, ParameterSource.CHANNEL);
        BINDINGS.put(FromProperties.class, ParameterSource.PROPERTIES);
        BINDINGS.put(FromConsumerTag.class, ParameterSource.CONSUMER_TAG);
        BINDINGS.put(FromExchange.class, ParameterSource.EXCHANGE);
        BINDINGS.put(FromRedelivered.class, ParameterSource.REDELIVERED);
        BINDINGS.put(FromRoutingKey.class, ParameterSource.ROUTING_KEY);
    }

    /**
     * Returns one descriptor per consumer method of the given type, ordered by method name.
     *
     * @param handlerType consumer class, possibly a CGLIB subclass
     * @throws DispatchConfigurationException if any consumer method is misconfigured
     */
    public List<ConsumerDescriptor> scan(Class<?> handlerType) {
        Class<?> userType = ClassUtils.getUserClass(handlerType);
        List<ConsumerDescriptor> descriptors = new ArrayList<>();

        for (Method method : ReflectionUtils.getUniqueDeclaredMethods(userType, ReflectionUtils.USER_DECLARED_METHODS)) {
            RabbitConsumer consumer = AnnotatedElementUtils.findMergedAnnotation(method, RabbitConsumer.class);
            RabbitPublisher publisher = AnnotatedElementUtils.findMergedAnnotation(method, RabbitPublisher.class);

            if (consumer == null) {
                if (publisher != null) {
                    throw new DispatchConfigurationException(
                            "@RabbitPublisher on " + userType.getName() + "#" + method.getName()
                                    + " requires @RabbitConsumer on the same method");
                }
                continue;
            }

            descriptors.add(describe(userType, method, consumer, publisher));
        }

        descriptors.sort(Comparator.comparing(d -> d.method().getName()));
        log.debug("Found {} consumer method(s) on {}", descriptors.size(), userType.getName());
        return descriptors;
    }

    private ConsumerDescriptor describe(Class<?> type, Method method, RabbitConsumer consumer, RabbitPublisher publisher) {
        ConsumerDescriptor.Builder builder = ConsumerDescriptor.builder(type, method)
                .consumer(consumer.queue(), consumer.ack(), consumer.requeueOnFailure());

        Parameter[] parameters = method.getParameters();
        for (int i = 0; i < parameters.length; i++) {
            builder.bind(sourceOf(type, method, i, parameters[i]));
        }

        if (publisher != null) {
            builder.publisher(publisher.exchange(), publisher.routingKey());
        }
        return builder.build();
    }

    private ParameterSource sourceOf(Class<?> type, Method method, int index, Parameter parameter) {
        List<ParameterSource> found = new ArrayList<>(1);
        BINDINGS.forEach((annotation, source) -> {
            if (parameter.isAnnotationPresent(annotation)) {
                found.add(source);
            }
        });

        if (found.size() != 1) {
            throw new DispatchConfigurationException(
                    "Parameter " + index + " (" + parameter.getName() + ") of " + type.getName() + "#"
                            + method.getName() + (found.isEmpty()
                            ? " has no binding annotation"
                            : " has more than one binding annotation " + found));
        }
        return found.get(0);
    }
}
