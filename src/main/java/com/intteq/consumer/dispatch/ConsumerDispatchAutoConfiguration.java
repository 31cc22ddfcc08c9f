package com.intteq.consumer.dispatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.consumer.dispatch.codec.BodyCodec;
import com.intteq.consumer.dispatch.descriptor.ConsumerMethodScanner;
import com.intteq.consumer.dispatch.health.ConsumerDispatchHealthIndicator;
import com.intteq.consumer.dispatch.internal.ConsumerRegistrar;
import com.intteq.consumer.dispatch.internal.DispatchMetrics;
import com.intteq.consumer.dispatch.scope.BeanFactoryHandlerScopeFactory;
import com.intteq.consumer.dispatch.scope.HandlerScopeFactory;
import com.rabbitmq.client.Channel;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.Nullable;

/**
 * Auto-configuration for consumer dispatch.
 *
 * <p>Enabled by default; disable with:
 *
 * <pre>
 *   consumer-dispatch.enabled = false
 * </pre>
 *
 * <p>The application's {@link ObjectMapper} is used for JSON bodies when present. The
 * {@link MeterRegistry} is optional; without it metrics are a no-op. Runs after Spring
 * Boot's RabbitMQ auto-configuration and consumes its {@link ConnectionFactory}, so
 * {@code spring.rabbitmq.*} (addresses, SSL, recovery) applies unchanged. An application
 * defined connection factory replaces Boot's as usual.
 */
@AutoConfiguration(after = RabbitAutoConfiguration.class)
@ConditionalOnClass(Channel.class)
@EnableConfigurationProperties(ConsumerDispatchProperties.class)
@ConditionalOnProperty(prefix = "consumer-dispatch", name = "enabled", havingValue = "true", matchIfMissing = true)
@ConditionalOnBean(ConnectionFactory.class)
public class ConsumerDispatchAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public BodyCodec bodyCodec(@Nullable ObjectMapper objectMapper) {
        // If the application does not provide an ObjectMapper, create a default one internally.
        return new BodyCodec(objectMapper != null ? objectMapper : new ObjectMapper());
    }

    @Bean
    @ConditionalOnMissingBean
    public DispatchMetrics dispatchMetrics(ConsumerDispatchProperties props, @Nullable MeterRegistry meterRegistry) {
        return new DispatchMetrics(props.isMetricsEnabled() ? meterRegistry : null);
    }

    @Bean
    @ConditionalOnMissingBean
    public ConsumerMethodScanner consumerMethodScanner() {
        return new ConsumerMethodScanner();
    }

    @Bean
    @ConditionalOnMissingBean
    public HandlerScopeFactory handlerScopeFactory(ConfigurableListableBeanFactory beanFactory) {
        return new BeanFactoryHandlerScopeFactory(beanFactory);
    }

    @Bean
    public ConsumerRegistrar consumerRegistrar(
            ConsumerDispatchProperties props,
            ConfigurableListableBeanFactory beanFactory,
            ConnectionFactory connectionFactory,
            ConsumerMethodScanner scanner,
            HandlerScopeFactory scopeFactory,
            BodyCodec bodyCodec,
            DispatchMetrics metrics) {

        return new ConsumerRegistrar(props, beanFactory, connectionFactory, scanner, scopeFactory, bodyCodec, metrics);
    }

    /**
     * Registers the health indicator only when Spring Boot Actuator is on the classpath.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "org.springframework.boot.actuate.health.HealthIndicator")
    static class HealthConfiguration {

        @Bean
        @ConditionalOnMissingBean(name = "consumerDispatchHealthIndicator")
        public ConsumerDispatchHealthIndicator consumerDispatchHealthIndicator(ConsumerRegistrar registrar) {
            return new ConsumerDispatchHealthIndicator(registrar);
        }
    }
}
