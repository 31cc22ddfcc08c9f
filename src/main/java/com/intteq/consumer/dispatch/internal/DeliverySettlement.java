package com.intteq.consumer.dispatch.internal;

import com.intteq.consumer.dispatch.exception.DeliverySettlementException;
import com.rabbitmq.client.Channel;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Issues the ack or nack for a single delivery, at most once.
 *
 * <p>Once an ack-family call has been attempted (successfully or not) every further
 * call is skipped. In auto-ack mode no call is ever issued. Confined to the thread
 * dispatching the delivery.
 */
@Slf4j
final class DeliverySettlement {

    private final Channel channel;
    private final long deliveryTag;
    private final boolean autoAck;
    private boolean attempted;

    DeliverySettlement(Channel channel, long deliveryTag, boolean autoAck) {
        this.channel = channel;
        this.deliveryTag = deliveryTag;
        this.autoAck = autoAck;
    }

    /**
     * Acknowledges this delivery only ({@code multiple=false}).
     *
     * @throws DeliverySettlementException if the channel call fails
     */
    void ack() {
        if (!claim("ack")) return;
        try {
            channel.basicAck(deliveryTag, false);
            log.debug("RabbitMQ ack successful (tag={})", deliveryTag);
        } catch (IOException e) {
            throw new DeliverySettlementException("Failed to ack message " + deliveryTag, e);
        }
    }

    /**
     * Negatively acknowledges this delivery only ({@code multiple=false}).
     *
     * @throws DeliverySettlementException if the channel call fails
     */
    void nack(boolean requeue) {
        if (!claim("nack")) return;
        try {
            channel.basicNack(deliveryTag, false, requeue);
            log.debug("RabbitMQ nack issued (tag={}, requeue={})", deliveryTag, requeue);
        } catch (IOException e) {
            throw new DeliverySettlementException("Failed to nack message " + deliveryTag, e);
        }
    }

    boolean isAutoAck() {
        return autoAck;
    }

    /**
     * Whether the broker already considers this delivery settled, or an attempt was made.
     */
    boolean isSettled() {
        return autoAck || attempted;
    }

    private boolean claim(String operation) {
        if (autoAck) {
            log.debug("Skipping {} for auto-acknowledged message {}", operation, deliveryTag);
            return false;
        }
        if (attempted) {
            log.warn("Skipping {} for message {}: already settled", operation, deliveryTag);
            return false;
        }
        attempted = true;
        return true;
    }
}
