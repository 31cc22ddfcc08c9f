package com.intteq.consumer.dispatch.descriptor;

import com.intteq.consumer.dispatch.AckMode;
import com.intteq.consumer.dispatch.exception.DispatchConfigurationException;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.springframework.lang.Nullable;
import org.springframework.util.ReflectionUtils;

import java.lang.reflect.Method;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable registration metadata for one consumer method: the owning type, the method,
 * one {@link ParameterSource} per formal parameter (in order), the consumer settings and
 * an optional publisher.
 *
 * <p>Instances are only obtainable through {@link #builder(Class, Method)}, which checks the
 * bindings against the method's arity and parameter types. A descriptor that exists is
 * therefore always bindable.
 *
 * <p>Usage:
 * <pre>
 *   ConsumerDescriptor descriptor = ConsumerDescriptor.builder(OrderConsumer.class, method)
 *           .bind(ParameterSource.BODY, ParameterSource.DELIVERY_TAG)
 *           .consumer("orders.created", AckMode.ACK_ON_INVOKE, false)
 *           .build();
 * </pre>
 */
@Getter
@Accessors(fluent = true)
public final class ConsumerDescriptor {

    private final Class<?> handlerType;
    private final Method method;
    private final List<ParameterSource> parameterSources;
    private final List<Type> parameterTypes;
    private final ConsumerSettings consumer;

    @Getter(AccessLevel.NONE)
    @Nullable
    private final PublisherSettings publisher;

    private ConsumerDescriptor(Builder builder) {
        this.handlerType = builder.handlerType;
        this.method = builder.method;
        this.parameterSources = List.copyOf(builder.sources);
        this.parameterTypes = List.of(builder.method.getGenericParameterTypes());
        this.consumer = builder.consumer;
        this.publisher = builder.publisher;
    }

    public static Builder builder(Class<?> handlerType, Method method) {
        return new Builder(handlerType, method);
    }

    public Optional<PublisherSettings> publisher() {
        return Optional.ofNullable(publisher);
    }

    public boolean hasPublisher() {
        return publisher != null;
    }

    public AckMode ackMode() {
        return consumer.ackMode();
    }

    /**
     * {@code SimpleName#method}, used in log lines and metric tags.
     */
    public String displayName() {
        return handlerType.getSimpleName() + "#" + method.getName();
    }

    @Override
    public String toString() {
        return "ConsumerDescriptor[" + displayName() + ", queue=" + consumer.queue()
                + ", ack=" + consumer.ackMode() + ", sources=" + parameterSources
                + (publisher != null ? ", publisher=" + publisher : "") + "]";
    }

    // -----------------------
    // Builder
    // -----------------------

    public static final class Builder {

        private final Class<?> handlerType;
        private final Method method;
        private final List<ParameterSource> sources = new ArrayList<>();
        private ConsumerSettings consumer;
        private PublisherSettings publisher;

        private Builder(Class<?> handlerType, Method method) {
            this.handlerType = Objects.requireNonNull(handlerType, "handlerType must not be null");
            this.method = Objects.requireNonNull(method, "method must not be null");
        }

        /**
         * Appends bindings for the next parameters, in declaration order.
         */
        public Builder bind(ParameterSource... parameterSources) {
            for (ParameterSource source : parameterSources) {
                sources.add(Objects.requireNonNull(source, "parameter source must not be null"));
            }
            return this;
        }

        public Builder consumer(ConsumerSettings settings) {
            this.consumer = settings;
            return this;
        }

        public Builder consumer(String queue, AckMode ackMode, boolean requeueOnFailure) {
            return consumer(new ConsumerSettings(queue, ackMode, requeueOnFailure));
        }

        public Builder publisher(@Nullable PublisherSettings settings) {
            this.publisher = settings;
            return this;
        }

        public Builder publisher(String exchange, String routingKey) {
            return publisher(new PublisherSettings(exchange, routingKey));
        }

        /**
         * Validates the registration and creates the descriptor.
         *
         * @throws DispatchConfigurationException if the bindings do not match the method signature,
         *                                        the method does not belong to the handler type or
         *                                        no consumer settings were given
         */
        public ConsumerDescriptor build() {
            String name = handlerType.getName() + "#" + method.getName();

            if (!method.getDeclaringClass().isAssignableFrom(handlerType)) {
                throw new DispatchConfigurationException(
                        "Method " + name + " is declared by " + method.getDeclaringClass().getName()
                                + ", which is not a supertype of " + handlerType.getName());
            }
            if (consumer == null) {
                throw new DispatchConfigurationException("No consumer settings given for " + name);
            }

            Class<?>[] types = method.getParameterTypes();
            if (types.length != sources.size()) {
                throw new DispatchConfigurationException(
                        "Consumer " + name + " declares " + types.length + " parameter(s) but "
                                + sources.size() + " binding(s) " + sources);
            }
            for (int i = 0; i < types.length; i++) {
                ParameterSource source = sources.get(i);
                if (!source.canSupply(types[i])) {
                    throw new DispatchConfigurationException(
                            "Parameter " + i + " of " + name + " has type " + types[i].getName()
                                    + " which cannot be bound from " + source
                                    + " (parameter types " + Arrays.toString(types) + ")");
                }
            }

            ReflectionUtils.makeAccessible(method);
            return new ConsumerDescriptor(this);
        }
    }
}
