package com.intteq.consumer.dispatch.descriptor;

import java.util.Objects;

/**
 * Destination for a consumer method's return value.
 *
 * @param exchange   destination exchange, empty for the default exchange
 * @param routingKey routing key of the published message
 */
public record PublisherSettings(String exchange, String routingKey) {

    public PublisherSettings {
        Objects.requireNonNull(exchange, "exchange must not be null");
        Objects.requireNonNull(routingKey, "routingKey must not be null");
    }
}
