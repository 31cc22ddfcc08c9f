package com.intteq.consumer.dispatch;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.Envelope;

import java.util.Objects;

/**
 * Read-only view of one received message.
 *
 * <p>Valid only for the duration of one dispatch. The body array is shared with the
 * transport and must be treated as read-only.
 *
 * @param body         raw message body, possibly {@code null}
 * @param deliveryTag  channel-scoped delivery identifier used for ack / nack
 * @param exchange     exchange the message was published to
 * @param routingKey   routing key the message was published with
 * @param consumerTag  tag of the subscription that received the message
 * @param redelivered  whether the broker has delivered this message before
 * @param properties   broker-supplied content header and headers
 */
public record DeliveryEnvelope(
        byte[] body,
        long deliveryTag,
        String exchange,
        String routingKey,
        String consumerTag,
        boolean redelivered,
        AMQP.BasicProperties properties
) {

    /**
     * Adapts a RabbitMQ client {@link Delivery} received by the given consumer.
     */
    public static DeliveryEnvelope of(String consumerTag, Delivery delivery) {
        Objects.requireNonNull(delivery, "delivery must not be null");
        Envelope envelope = delivery.getEnvelope();
        return new DeliveryEnvelope(
                delivery.getBody(),
                envelope.getDeliveryTag(),
                envelope.getExchange(),
                envelope.getRoutingKey(),
                consumerTag,
                envelope.isRedeliver(),
                delivery.getProperties()
        );
    }

    @Override
    public String toString() {
        return "DeliveryEnvelope[tag=" + deliveryTag + ", exchange=" + exchange
                + ", routingKey=" + routingKey + ", consumerTag=" + consumerTag
                + ", redelivered=" + redelivered
                + ", bodyLength=" + (body == null ? 0 : body.length) + "]";
    }
}
