package com.intteq.consumer.dispatch.scope;

import com.intteq.consumer.dispatch.exception.HandlerResolutionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * {@link HandlerScopeFactory} backed by the Spring bean factory.
 *
 * <p>Handlers are looked up by type. Singleton handlers are shared between deliveries;
 * prototype handlers are created per delivery and destroyed (running their destroy
 * callbacks) when the scope closes.
 */
@Slf4j
@RequiredArgsConstructor
public class BeanFactoryHandlerScopeFactory implements HandlerScopeFactory {

    private final ConfigurableListableBeanFactory beanFactory;

    @Override
    public HandlerScope openScope() {
        return new BeanFactoryHandlerScope();
    }

    /** Not thread-safe: one scope is confined to the delivery that opened it. */
    private final class BeanFactoryHandlerScope implements HandlerScope {

        private final List<Object> prototypes = new ArrayList<>(1);
        private boolean closed;

        @Override
        public <T> T resolve(Class<T> type) {
            if (closed) {
                throw new IllegalStateException("Handler scope is already closed");
            }

            String[] names = beanFactory.getBeanNamesForType(type);
            if (names.length != 1) {
                throw new HandlerResolutionException(
                        "Expected exactly one bean of type " + type.getName() + " but found "
                                + (names.length == 0 ? "none" : Arrays.toString(names)));
            }

            String name = names[0];
            T instance;
            try {
                instance = beanFactory.getBean(name, type);
            } catch (BeansException e) {
                throw new HandlerResolutionException("Failed to create handler bean '" + name + "'", e);
            }

            if (beanFactory.isPrototype(name)) {
                prototypes.add(instance);
            }
            return instance;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;

            for (Object instance : prototypes) {
                try {
                    beanFactory.destroyBean(instance);
                } catch (RuntimeException e) {
                    log.warn("Failed to destroy handler instance {}", instance.getClass().getName(), e);
                }
            }
            prototypes.clear();
        }
    }
}
