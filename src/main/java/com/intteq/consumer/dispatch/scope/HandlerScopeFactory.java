package com.intteq.consumer.dispatch.scope;

/**
 * Opens a fresh {@link HandlerScope} for each delivery.
 */
@FunctionalInterface
public interface HandlerScopeFactory {

    HandlerScope openScope();
}
