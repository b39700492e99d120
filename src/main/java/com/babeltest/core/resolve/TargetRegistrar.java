package com.babeltest.core.resolve;

/**
 * Contributes modules, types and factories to a {@link TargetRegistry} at startup.
 *
 * <p>Implementations are Spring beans when running from the CLI, and
 * {@link java.util.ServiceLoader} entries when running inside a child runtime.
 */
@FunctionalInterface
public interface TargetRegistrar {

    void register(TargetRegistry registry);
}
