package com.intteq.consumer.dispatch.internal;

import com.intteq.consumer.dispatch.AckMode;
import com.intteq.consumer.dispatch.DeliveryEnvelope;
import com.intteq.consumer.dispatch.binding.ParameterBinder;
import com.intteq.consumer.dispatch.codec.BodyCodec;
import com.intteq.consumer.dispatch.descriptor.ConsumerDescriptor;
import com.intteq.consumer.dispatch.descriptor.PublisherSettings;
import com.intteq.consumer.dispatch.exception.ConsumerDispatchException;
import com.intteq.consumer.dispatch.exception.DeliverySettlementException;
import com.intteq.consumer.dispatch.scope.HandlerScope;
import com.intteq.consumer.dispatch.scope.HandlerScopeFactory;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Delivery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;

/**
 * Drives one queue subscription for one {@link ConsumerDescriptor}.
 *
 * <p>For every delivery:
 * <ol>
 *     <li>open a {@link HandlerScope} and resolve the handler from it</li>
 *     <li>bind the parameters and invoke the handler</li>
 *     <li>ack, if the mode is {@link AckMode#ACK_ON_INVOKE}</li>
 *     <li>publish the return value, if a publisher is configured</li>
 *     <li>ack, if the mode is {@link AckMode#ACK_ON_PUBLISH}</li>
 *     <li>close the scope</li>
 * </ol>
 *
 * <p>Any failure stops the sequence and is converted into a single {@code basicNack} with the
 * configured requeue flag, unless the delivery was already settled (auto-ack, or acked on
 * invoke before a publish failed). Nothing, not even an {@link Error}, is thrown back to
 * the RabbitMQ client.
 *
 * <p>The dispatcher keeps no per-delivery state in fields; concurrent deliveries are
 * independent. The channel is shared and its thread-safety is the client's concern.
 */
@Slf4j
public class ConsumerDispatcher {

    private final ConsumerDescriptor descriptor;
    private final Channel channel;
    private final HandlerScopeFactory scopeFactory;
    private final BodyCodec bodyCodec;
    private final ParameterBinder binder;
    private final DispatchMetrics metrics;

    private volatile String consumerTag;

    private ConsumerDispatcher(
            ConsumerDescriptor descriptor,
            Channel channel,
            HandlerScopeFactory scopeFactory,
            BodyCodec bodyCodec,
            DispatchMetrics metrics
    ) {
        this.descriptor = descriptor;
        this.channel = channel;
        this.scopeFactory = scopeFactory;
        this.bodyCodec = bodyCodec;
        this.binder = new ParameterBinder(bodyCodec);
        this.metrics = metrics;
    }

    /**
     * Creates a dispatcher and registers its consumer on the descriptor's queue.
     *
     * <p>The consumer uses broker-side auto-ack if and only if the ack mode is
     * {@link AckMode#AUTO_ACK}.
     *
     * @throws IOException if {@code basicConsume} fails
     */
    public static ConsumerDispatcher subscribe(
            ConsumerDescriptor descriptor,
            Channel channel,
            HandlerScopeFactory scopeFactory,
            BodyCodec bodyCodec,
            DispatchMetrics metrics
    ) throws IOException {
        ConsumerDispatcher dispatcher =
                new ConsumerDispatcher(descriptor, channel, scopeFactory, bodyCodec, metrics);
        dispatcher.start();
        return dispatcher;
    }

    private void start() throws IOException {
        log.info("Registering method {} in {} as consumer{}.",
                descriptor.method().getName(),
                descriptor.handlerType().getSimpleName(),
                descriptor.hasPublisher() ? " and publisher" : "");

        String queue = descriptor.consumer().queue();
        consumerTag = channel.basicConsume(
                queue,
                descriptor.consumer().autoAck(),
                this::onDelivery,
                this::onCancel
        );

        log.info("RabbitMQ consumer started → queue={} consumerTag={} ack={}",
                queue, consumerTag, descriptor.ackMode());
    }

    // =====================================================================
    // DELIVERY HANDLING
    // =====================================================================

    private void onDelivery(String tag, Delivery delivery) {
        dispatch(DeliveryEnvelope.of(tag, delivery));
    }

    private void onCancel(String tag) {
        log.warn("Consumer {} on queue {} was cancelled by the broker",
                tag, descriptor.consumer().queue());
    }

    /**
     * Runs the full dispatch sequence for one delivery. Never throws.
     */
    public void dispatch(DeliveryEnvelope envelope) {
        long tag = envelope.deliveryTag();
        log.debug("Received message {} from {} with {}. Invoking {}.",
                tag, envelope.exchange(), envelope.routingKey(), descriptor.displayName());

        DeliverySettlement settlement =
                new DeliverySettlement(channel, tag, descriptor.consumer().autoAck());
        InvocationResult failure = null;
        long start = System.nanoTime();

        try (HandlerScope scope = scopeFactory.openScope()) {
            InvocationResult result = invoke(scope, envelope);
            if (result.failed()) {
                failure = result;
            } else {
                complete(envelope, settlement, result.returnValue());
            }
        } catch (Throwable e) {
            // Errors included: anything reaching the client closes the channel
            if (failure == null) {
                failure = InvocationResult.dispatchFailure(e);
            } else {
                failure.cause().addSuppressed(e);
            }
        }

        if (failure == null) {
            metrics.recordSuccess(descriptor.consumer().queue(), System.nanoTime() - start);
        } else {
            fail(envelope, settlement, failure);
        }
    }

    private InvocationResult invoke(HandlerScope scope, DeliveryEnvelope envelope) {
        try {
            Object handler = scope.resolve(descriptor.handlerType());
            Object[] args = binder.resolve(descriptor, envelope, channel);
            return InvocationResult.success(descriptor.method().invoke(handler, args));
        } catch (InvocationTargetException e) {
            return InvocationResult.handlerFailure(e.getTargetException());
        } catch (Throwable e) {
            return InvocationResult.dispatchFailure(e);
        }
    }

    private void complete(DeliveryEnvelope envelope, DeliverySettlement settlement, @Nullable Object returned) {
        long tag = envelope.deliveryTag();

        if (descriptor.ackMode() == AckMode.ACK_ON_INVOKE) {
            log.debug("Acknowledging message {} after invocation.", tag);
            settlement.ack();
        }

        if (descriptor.hasPublisher()) {
            publish(tag, descriptor.publisher().orElseThrow(), returned);
        }

        if (descriptor.ackMode() == AckMode.ACK_ON_PUBLISH) {
            log.debug("Acknowledging message {} after publish.", tag);
            settlement.ack();
        }
    }

    private void publish(long tag, PublisherSettings target, @Nullable Object returned) {
        byte[] body = bodyCodec.encode(returned);

        log.debug("Publishing result of {} from {} to {} with {}",
                tag, descriptor.displayName(), target.exchange(), target.routingKey());
        try {
            channel.basicPublish(target.exchange(), target.routingKey(), null, body);
        } catch (IOException e) {
            throw new DeliverySettlementException(
                    "Failed to publish result of message " + tag + " to exchange '" + target.exchange() + "'", e);
        }

        metrics.recordPublish(descriptor.consumer().queue());
    }

    private void fail(DeliveryEnvelope envelope, DeliverySettlement settlement, InvocationResult failure) {
        long tag = envelope.deliveryTag();
        String queue = descriptor.consumer().queue();
        boolean requeue = descriptor.consumer().requeueOnFailure();
        String what = failure.causedByHandler()
                ? "threw exception when " + descriptor.displayName() + " was invoked"
                : "failed while dispatching to " + descriptor.displayName();

        metrics.recordFailure(queue, failure.causedByHandler());

        if (settlement.isAutoAck()) {
            log.error("Message {} {}; it was auto-acknowledged and is dropped.", tag, what, failure.cause());
            return;
        }
        if (settlement.isSettled()) {
            // acked on invoke; the broker has already removed the message
            log.error("Message {} {} after it was acknowledged; it cannot be nacked.", tag, what, failure.cause());
            return;
        }

        log.error("Message {} {}, will nack (requeue={}).", tag, what, requeue, failure.cause());
        try {
            settlement.nack(requeue);
        } catch (Exception e) {
            log.error("Failed to nack message {} (queue={})", tag, queue, e);
        }
    }

    // =====================================================================
    // LIFECYCLE
    // =====================================================================

    /**
     * Cancels the subscription if the channel is still open.
     *
     * @throws ConsumerDispatchException if {@code basicCancel} fails
     */
    public void cancel() {
        String tag = consumerTag;
        if (tag == null || !channel.isOpen()) {
            return;
        }
        try {
            channel.basicCancel(tag);
            log.info("Stopped RabbitMQ consumer → queue={} consumerTag={}", descriptor.consumer().queue(), tag);
        } catch (IOException e) {
            throw new ConsumerDispatchException("Failed to cancel consumer " + tag, e);
        }
    }

    public boolean isActive() {
        return consumerTag != null && channel.isOpen();
    }

    public ConsumerDescriptor descriptor() {
        return descriptor;
    }

    public Channel channel() {
        return channel;
    }

    @Nullable
    public String consumerTag() {
        return consumerTag;
    }
}
