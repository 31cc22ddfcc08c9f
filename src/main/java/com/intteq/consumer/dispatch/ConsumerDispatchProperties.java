package com.intteq.consumer.dispatch;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for consumer dispatch.
 *
 * <p>Prefix: {@code consumer-dispatch.*}
 *
 * <p>Examples:
 * <pre>
 * consumer-dispatch.enabled=true
 * consumer-dispatch.prefetch=20
 * consumer-dispatch.metrics-enabled=false
 * </pre>
 *
 * <p>Queue names, ack modes and publish targets are declared on the consumer methods,
 * not here. Connection settings come from {@code spring.rabbitmq.*}.
 */
@Getter
@Setter
@Validated
@ToString
@ConfigurationProperties(prefix = "consumer-dispatch")
public class ConsumerDispatchProperties {

    /** Whether consumers are discovered and started. */
    private boolean enabled = true;

    /**
     * {@code basicQos} prefetch applied to each consumer channel. 0 leaves the broker default
     * (unlimited) in place.
     */
    @Min(value = 0, message = "consumer-dispatch.prefetch must not be negative")
    private int prefetch = 0;

    /** Whether Micrometer meters are recorded when a MeterRegistry is available. */
    private boolean metricsEnabled = true;
}
