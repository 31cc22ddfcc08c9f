package com.intteq.consumer.dispatch.scope;

/**
 * Resolution context owned by exactly one delivery.
 *
 * <p>Closed exactly once, on every exit path of the dispatch. Closing releases every
 * instance the scope created.
 */
public interface HandlerScope extends AutoCloseable {

    /**
     * Resolves an instance of the given type.
     *
     * @throws com.intteq.consumer.dispatch.exception.HandlerResolutionException if no instance can be produced
     */
    <T> T resolve(Class<T> type);

    @Override
    void close();
}
