package com.babeltest.core.resolve;

import com.babeltest.core.diagnostics.ConstructionException;
import com.babeltest.core.diagnostics.DiagnosticContext;
import com.babeltest.core.diagnostics.Suggestions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds and caches receiver instances per fully-qualified type path.
 *
 * <p>Construction order: lifecycle cache (skipped under {@link InstanceLifecycle#PER_TEST}),
 * conventional factory, zero-argument constructor. Interface-typed instances are handed out
 * behind a proxy that honours {@link MethodOverrides}.
 */
public class InstanceRegistry implements InstanceProvider {

    private static final Logger log = LoggerFactory.getLogger(InstanceRegistry.class);

    private final TargetRegistry registry;
    private final FactoryLoader factoryLoader;
    private final InstanceLifecycle lifecycle;
    private final Map<String, Object> instances = new ConcurrentHashMap<>();

    public InstanceRegistry(TargetRegistry registry, FactoryLoader factoryLoader, InstanceLifecycle lifecycle) {
        this.registry = registry;
        this.factoryLoader = factoryLoader;
        this.lifecycle = lifecycle != null ? lifecycle : InstanceLifecycle.SHARED;
    }

    public InstanceLifecycle lifecycle() {
        return lifecycle;
    }

    /**
     * Returns the instance for {@code typePath}, building it when needed.
     *
     * @throws ConstructionException when neither a factory nor a usable constructor exists
     */
    public Object instance(String typePath, Class<?> type, DiagnosticContext trail) {
        if (lifecycle != InstanceLifecycle.PER_TEST) {
            Object cached = instances.get(typePath);
            if (cached != null) {
                trail.found(typePath + " (cached, " + lifecycle.wireName() + ")");
                return cached;
            }
        }
        Object instance = factoryLoader.create(typePath, this, trail)
                .orElseGet(() -> construct(typePath, type, trail));
        if (type.isInterface() && type.isInstance(instance) && !CollaboratorProxy.isProxy(instance)) {
            instance = CollaboratorProxy.wrap(typePath, type, instance, registry.overrides(), registry.binder());
        }
        if (lifecycle != InstanceLifecycle.PER_TEST) {
            instances.put(typePath, instance);
        }
        return instance;
    }

    private Object construct(String typePath, Class<?> type, DiagnosticContext trail) {
        String where = type.getName() + "()";
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            trail.missed(where, type.isInterface() ? "is an interface" : "is abstract");
            throw constructionFailure(typePath, type, trail);
        }
        Constructor<?> constructor;
        try {
            constructor = type.getDeclaredConstructor();
        } catch (NoSuchMethodException e) {
            trail.missed(where, "no zero-argument constructor");
            throw constructionFailure(typePath, type, trail);
        }
        if (!constructor.trySetAccessible()) {
            trail.missed(where, "constructor not accessible");
            throw constructionFailure(typePath, type, trail);
        }
        try {
            Object instance = constructor.newInstance();
            trail.found(where);
            log.debug("Built {} with zero-argument constructor", typePath);
            return instance;
        } catch (InvocationTargetException e) {
            trail.missed(where, "constructor failed: " + e.getCause());
            throw new ConstructionException("Constructor of " + type.getName() + " failed", trail, e.getCause());
        } catch (ReflectiveOperationException e) {
            trail.missed(where, e.toString());
            throw constructionFailure(typePath, type, trail);
        }
    }

    private ConstructionException constructionFailure(String typePath, Class<?> type, DiagnosticContext trail) {
        List<FactoryLoader.Location> locations = factoryLoader.locations(typePath);
        String factoryClass = locations.get(0).className();
        trail.suggest(Suggestions.factory(type.getSimpleName(), factoryClass, FactoryLoader.functionName(typePath)));
        if (!type.isInterface()) {
            trail.suggest(Suggestions.zeroArgConstructor(type.getSimpleName()));
        }
        return new ConstructionException("Cannot construct " + typePath, trail);
    }

    /** Drops cached instances when a suite begins, under {@link InstanceLifecycle#PER_SUITE}. */
    public void onSuiteStart() {
        if (lifecycle == InstanceLifecycle.PER_SUITE) {
            clear();
        }
    }

    /** Drops cached instances before every test, under {@link InstanceLifecycle#PER_TEST}. */
    public void onTestStart() {
        if (lifecycle == InstanceLifecycle.PER_TEST) {
            clear();
        }
    }

    /** Clears instances only; loaded factory modules are kept. */
    public void clear() {
        if (!instances.isEmpty()) {
            log.debug("Clearing {} cached instance(s)", instances.size());
        }
        instances.clear();
    }

    public int size() {
        return instances.size();
    }

    // -- InstanceProvider ------------------------------------------------

    @Override
    public <T> T instance(String typePath, Class<T> type) {
        int dot = typePath.lastIndexOf('.');
        Class<?> registered = dot < 0 ? type : registry.findModule(typePath.substring(0, dot))
                .flatMap(m -> m.findType(typePath.substring(dot + 1)))
                .orElse(type);
        return type.cast(instance(typePath, registered, new DiagnosticContext(typePath)));
    }

    @Override
    public Invocable function(String functionPath) {
        int dot = functionPath.lastIndexOf('.');
        if (dot < 0) {
            throw new IllegalArgumentException("Function path must be <module>.<function>: " + functionPath);
        }
        String module = functionPath.substring(0, dot);
        String name = functionPath.substring(dot + 1);
        return arguments -> registry.findModule(module)
                .flatMap(m -> m.findFunction(name))
                .orElseThrow(() -> new IllegalStateException("No function registered at " + functionPath))
                .invoke(arguments);
    }
}
