package com.babeltest.core.resolve;

import java.util.Map;

/**
 * A resolved callable that accepts named arguments.
 */
@FunctionalInterface
public interface Invocable {

    /**
     * Calls the target with the given named arguments.
     *
     * @throws Exception whatever the target itself raised
     */
    Object invoke(Map<String, Object> arguments) throws Exception;

    /**
     * Whether the call yields a deferred result ({@link java.util.concurrent.CompletionStage}
     * or {@link java.util.concurrent.Future}) that must be awaited.
     */
    default boolean isAsync() {
        return false;
    }
}
