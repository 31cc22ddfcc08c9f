package com.intteq.consumer.dispatch.health;

import com.intteq.consumer.dispatch.AckMode;
import com.intteq.consumer.dispatch.codec.BodyCodec;
import com.intteq.consumer.dispatch.descriptor.ConsumerDescriptor;
import com.intteq.consumer.dispatch.descriptor.ParameterSource;
import com.intteq.consumer.dispatch.internal.ConsumerDispatcher;
import com.intteq.consumer.dispatch.internal.ConsumerRegistrar;
import com.intteq.consumer.dispatch.internal.DispatchMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.CancelCallback;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DeliverCallback;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;

import static org.assertj.core.api.Assertions.as;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("ConsumerDispatchHealthIndicator")
class ConsumerDispatchHealthIndicatorTest {

    public static class Handler {
        public void handle(String body) {
        }
    }

    private ConsumerRegistrar registrar;
    private Channel channel;
    private ConsumerDispatchHealthIndicator indicator;

    @BeforeEach
    void setUp() throws Exception {
        registrar = mock(ConsumerRegistrar.class);
        channel = mock(Channel.class);
        when(channel.basicConsume(anyString(), anyBoolean(), any(DeliverCallback.class), any(CancelCallback.class)))
                .thenReturn("ctag-1");
        indicator = new ConsumerDispatchHealthIndicator(registrar);
    }

    private ConsumerDispatcher dispatcher() throws Exception {
        ConsumerDescriptor descriptor = ConsumerDescriptor
                .builder(Handler.class, Handler.class.getMethod("handle", String.class))
                .bind(ParameterSource.BODY)
                .consumer("orders", AckMode.ACK_ON_INVOKE, false)
                .build();
        return ConsumerDispatcher.subscribe(descriptor, channel, () -> null,
                new BodyCodec(new ObjectMapper()), DispatchMetrics.noop());
    }

    @Test
    @DisplayName("should be UP with no consumers")
    void upWithoutConsumers() {
        when(registrar.dispatchers()).thenReturn(List.of());

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("count", 0);
    }

    @Test
    @DisplayName("should be UP while every channel is open")
    void upWhenActive() throws Exception {
        ConsumerDispatcher dispatcher = dispatcher();
        when(channel.isOpen()).thenReturn(true);
        when(registrar.dispatchers()).thenReturn(List.of(dispatcher));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("count", 1)
                .extractingByKey("consumers", as(InstanceOfAssertFactories.MAP))
                .extractingByKey("Handler#handle", as(InstanceOfAssertFactories.MAP))
                .containsEntry("queue", "orders")
                .containsEntry("consumerTag", "ctag-1")
                .containsEntry("ackMode", "ACK_ON_INVOKE")
                .containsEntry("active", true);
    }

    @Test
    @DisplayName("should be DOWN when a channel has closed")
    void downWhenChannelClosed() throws Exception {
        ConsumerDispatcher dispatcher = dispatcher();
        when(channel.isOpen()).thenReturn(false);
        when(registrar.dispatchers()).thenReturn(List.of(dispatcher));

        assertThat(indicator.health().getStatus()).isEqualTo(Status.DOWN);
    }
}
