package com.intteq.consumer.dispatch.internal;

import com.intteq.consumer.dispatch.ConsumerDispatchProperties;
import com.intteq.consumer.dispatch.annotation.MessageConsumer;
import com.intteq.consumer.dispatch.annotation.RabbitConsumer;
import com.intteq.consumer.dispatch.codec.BodyCodec;
import com.intteq.consumer.dispatch.descriptor.ConsumerDescriptor;
import com.intteq.consumer.dispatch.descriptor.ConsumerMethodScanner;
import com.intteq.consumer.dispatch.exception.ConsumerDispatchException;
import com.intteq.consumer.dispatch.scope.HandlerScopeFactory;
import com.rabbitmq.client.Channel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Discovers {@link MessageConsumer} beans and starts one {@link ConsumerDispatcher} per
 * {@link RabbitConsumer} method.
 *
 * <p><b>Responsibilities:</b></p>
 * <ul>
 *     <li>Builds descriptors from bean <em>types</em>; consumer beans are not instantiated here</li>
 *     <li>Fails startup on any misconfigured consumer method</li>
 *     <li>Opens a dedicated channel per consumer and applies the configured prefetch</li>
 *     <li>Cancels consumers and closes their channels on shutdown</li>
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class ConsumerRegistrar implements SmartInitializingSingleton, DisposableBean {

    private final ConsumerDispatchProperties properties;
    private final ConfigurableListableBeanFactory beanFactory;
    private final ConnectionFactory connectionFactory;
    private final ConsumerMethodScanner scanner;
    private final HandlerScopeFactory scopeFactory;
    private final BodyCodec bodyCodec;
    private final DispatchMetrics metrics;

    /** Active dispatchers, in registration order. */
    private final List<ConsumerDispatcher> dispatchers = new CopyOnWriteArrayList<>();

    // =====================================================================
    // INITIALIZATION
    // =====================================================================

    /**
     * Scans for consumers once all singletons exist, so the connection factory and any
     * singleton handlers are ready.
     */
    @Override
    public void afterSingletonsInstantiated() {
        log.info("Scanning for @MessageConsumer beans...");

        List<ConsumerDescriptor> descriptors = discover();
        if (descriptors.isEmpty()) {
            log.info("No consumer methods found");
            return;
        }

        Connection connection = connectionFactory.createConnection();
        descriptors.forEach(descriptor -> register(connection, descriptor));

        log.info("Started {} consumer(s)", dispatchers.size());
    }

    List<ConsumerDescriptor> discover() {
        List<ConsumerDescriptor> descriptors = new ArrayList<>();

        for (String beanName : beanFactory.getBeanNamesForAnnotation(MessageConsumer.class)) {
            Class<?> type = beanFactory.getType(beanName);
            if (type == null) {
                log.warn("Skipping consumer bean '{}': type cannot be determined", beanName);
                continue;
            }
            descriptors.addAll(scanner.scan(type));
        }
        return descriptors;
    }

    private void register(Connection connection, ConsumerDescriptor descriptor) {
        Channel channel = connection.createChannel(false);
        try {
            if (properties.getPrefetch() > 0) {
                channel.basicQos(properties.getPrefetch());
            }
            dispatchers.add(ConsumerDispatcher.subscribe(descriptor, channel, scopeFactory, bodyCodec, metrics));
        } catch (IOException e) {
            closeQuietly(channel, descriptor.consumer().queue());
            throw new ConsumerDispatchException(
                    "Failed to start consumer " + descriptor.displayName()
                            + " on queue " + descriptor.consumer().queue(), e);
        }
    }

    public List<ConsumerDispatcher> dispatchers() {
        return List.copyOf(dispatchers);
    }

    // =====================================================================
    // SHUTDOWN
    // =====================================================================

    /**
     * Cancels every consumer and closes its channel. Failures are logged, not propagated.
     */
    @Override
    public void destroy() {
        log.info("Stopping RabbitMQ consumers...");

        dispatchers.forEach(dispatcher -> {
            String queue = dispatcher.descriptor().consumer().queue();
            try {
                dispatcher.cancel();
            } catch (Exception e) {
                log.warn("Failed to cancel consumer → queue={}", queue, e);
            }
            closeQuietly(dispatcher.channel(), queue);
        });

        dispatchers.clear();
    }

    private void closeQuietly(Channel channel, String queue) {
        try {
            if (channel.isOpen()) {
                channel.close();
            }
        } catch (Exception e) {
            log.warn("Failed to close channel → queue={}", queue, e);
        }
    }
}
