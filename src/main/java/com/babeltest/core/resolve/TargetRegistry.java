package com.babeltest.core.resolve;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Explicit map of everything a test can target. Modules are registered under dotted
 * paths; resolution treats "a loadable module" as "a module registered at that path".
 *
 * <p>Populated once at startup by {@link TargetRegistrar}s, then read by the
 * {@link Resolver} and modified only by mock installation.
 */
public class TargetRegistry {

    private static final Logger log = LoggerFactory.getLogger(TargetRegistry.class);

    private final Map<String, TargetModule> modules = new ConcurrentHashMap<>();
    private final Map<String, FactoryTable> factories = new ConcurrentHashMap<>();
    private final MethodOverrides overrides = new MethodOverrides();
    private final ArgumentBinder binder;

    public TargetRegistry() {
        this(new ArgumentBinder());
    }

    public TargetRegistry(ArgumentBinder binder) {
        this.binder = binder;
    }

    public static TargetRegistry of(Iterable<? extends TargetRegistrar> registrars) {
        return of(registrars, new ArgumentBinder());
    }

    public static TargetRegistry of(Iterable<? extends TargetRegistrar> registrars, ArgumentBinder binder) {
        var registry = new TargetRegistry(binder);
        for (TargetRegistrar registrar : registrars) {
            log.debug("Applying target registrar {}", registrar.getClass().getName());
            registrar.register(registry);
        }
        log.info("Target registry ready: {} module(s)", registry.modules.size());
        return registry;
    }

    /** Registry populated from {@code META-INF/services} entries visible to {@code loader}. */
    public static TargetRegistry fromServiceLoader(ClassLoader loader) {
        return of(ServiceLoader.load(TargetRegistrar.class, loader));
    }

    /** Returns the module at {@code path}, creating it on first use. */
    public TargetModule module(String path) {
        return modules.computeIfAbsent(path, p -> new TargetModule(p, binder));
    }

    public Optional<TargetModule> findModule(String path) {
        return Optional.ofNullable(modules.get(path));
    }

    public Set<String> modulePaths() {
        return new TreeSet<>(modules.keySet());
    }

    /**
     * Returns the explicit factory table at a conventional factory location
     * (e.g. {@code "babel.factories.PaymentFactories"}), creating it on first use.
     */
    public FactoryTable factories(String location) {
        return factories.computeIfAbsent(location, FactoryTable::new);
    }

    public Optional<FactoryTable> findFactories(String location) {
        return Optional.ofNullable(factories.get(location));
    }

    public MethodOverrides overrides() {
        return overrides;
    }

    public ArgumentBinder binder() {
        return binder;
    }
}
