package com.intteq.consumer.dispatch.internal;

import org.springframework.lang.Nullable;

/**
 * Outcome of resolving, binding and invoking a handler for one delivery.
 *
 * <p>{@code causedByHandler} separates a fault thrown by the handler method from a fault
 * in resolution, binding or the reflective call itself. It only changes logging and
 * metric tags; both kinds are settled the same way.
 */
record InvocationResult(@Nullable Object returnValue, @Nullable Throwable cause, boolean causedByHandler) {

    static InvocationResult success(@Nullable Object returnValue) {
        return new InvocationResult(returnValue, null, false);
    }

    static InvocationResult handlerFailure(Throwable cause) {
        return new InvocationResult(null, cause, true);
    }

    static InvocationResult dispatchFailure(Throwable cause) {
        return new InvocationResult(null, cause, false);
    }

    boolean failed() {
        return cause != null;
    }
}
