package com.intteq.consumer.dispatch.descriptor;

import com.intteq.consumer.dispatch.AckMode;
import com.intteq.consumer.dispatch.exception.DispatchConfigurationException;

import java.util.Objects;

/**
 * Queue subscription and acknowledgment policy of one consumer method.
 *
 * @param queue            queue to consume from
 * @param ackMode          when deliveries are acknowledged
 * @param requeueOnFailure requeue flag passed to {@code basicNack} on failure
 */
public record ConsumerSettings(String queue, AckMode ackMode, boolean requeueOnFailure) {

    public ConsumerSettings {
        if (queue == null || queue.isBlank()) {
            throw new DispatchConfigurationException("Consumer queue name must not be blank");
        }
        Objects.requireNonNull(ackMode, "ackMode must not be null");
    }

    public boolean autoAck() {
        return ackMode == AckMode.AUTO_ACK;
    }
}
