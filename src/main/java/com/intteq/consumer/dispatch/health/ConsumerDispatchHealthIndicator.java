package com.intteq.consumer.dispatch.health;

import com.intteq.consumer.dispatch.internal.ConsumerDispatcher;
import com.intteq.consumer.dispatch.internal.ConsumerRegistrar;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reports DOWN when any consumer has lost its channel or subscription.
 *
 * <p>Details list each queue with its consumer tag and state.
 */
@RequiredArgsConstructor
public class ConsumerDispatchHealthIndicator implements HealthIndicator {

    private final ConsumerRegistrar registrar;

    @Override
    public Health health() {
        List<ConsumerDispatcher> dispatchers = registrar.dispatchers();

        Map<String, Object> consumers = new LinkedHashMap<>();
        boolean allActive = true;
        for (ConsumerDispatcher dispatcher : dispatchers) {
            boolean active = dispatcher.isActive();
            allActive &= active;

            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("queue", dispatcher.descriptor().consumer().queue());
            detail.put("consumerTag", dispatcher.consumerTag());
            detail.put("ackMode", dispatcher.descriptor().ackMode().name());
            detail.put("active", active);
            consumers.put(dispatcher.descriptor().displayName(), detail);
        }

        Health.Builder builder = allActive ? Health.up() : Health.down();
        return builder
                .withDetail("count", dispatchers.size())
                .withDetail("consumers", consumers)
                .build();
    }
}
