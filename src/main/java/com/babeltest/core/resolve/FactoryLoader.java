package com.babeltest.core.resolve;

import com.babeltest.core.diagnostics.ConstructionException;
import com.babeltest.core.diagnostics.DiagnosticContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Finds conventionally named factory functions for a type.
 *
 * <p>For {@code example.payment.OrderService} with factories package {@code babel.factories}
 * the function {@code orderService()} is looked up, first hit wins, in:
 * <ol>
 *   <li>{@code babel.factories.example.PaymentFactories} (nested)</li>
 *   <li>{@code babel.factories.PaymentFactories} (flat)</li>
 *   <li>{@code babel.factories.OrderServiceFactory} (type-named)</li>
 * </ol>
 * Each location is either an explicit {@link FactoryTable} in the registry or a class on
 * the classpath. Loaded factory modules are cached for the loader's lifetime, independent
 * of the instance lifecycle.
 */
public class FactoryLoader {

    private static final Logger log = LoggerFactory.getLogger(FactoryLoader.class);

    private final TargetRegistry registry;
    private final String factoriesPackage;
    private final ClassLoader classLoader;
    private final Map<String, Optional<FactoryModule>> loaded = new ConcurrentHashMap<>();

    public FactoryLoader(TargetRegistry registry, String factoriesPackage) {
        this(registry, factoriesPackage, Thread.currentThread().getContextClassLoader());
    }

    public FactoryLoader(TargetRegistry registry, String factoriesPackage, ClassLoader classLoader) {
        this.registry = registry;
        this.factoriesPackage = factoriesPackage == null ? "" : factoriesPackage;
        this.classLoader = classLoader != null ? classLoader : FactoryLoader.class.getClassLoader();
    }

    public String factoriesPackage() {
        return factoriesPackage;
    }

    public record Location(String className, String description) {}

    /** Candidate factory locations for a type path, in search order. */
    public List<Location> locations(String typePath) {
        List<String> parts = Arrays.asList(typePath.split("\\."));
        List<String> moduleParts = parts.subList(0, parts.size() - 1);
        String typeName = parts.get(parts.size() - 1);
        List<Location> locations = new ArrayList<>();
        if (!moduleParts.isEmpty()) {
            String module = NameCase.capitalize(moduleParts.get(moduleParts.size() - 1)) + "Factories";
            if (moduleParts.size() > 1) {
                String parent = String.join(".", moduleParts.subList(0, moduleParts.size() - 1));
                locations.add(new Location(qualify(parent + "." + module), "nested"));
            }
            locations.add(new Location(qualify(module), "flat"));
        }
        locations.add(new Location(qualify(typeName + "Factory"), "type-named"));
        return locations;
    }

    /** Conventional factory function name for a type path ({@code OrderService} → {@code orderService}). */
    public static String functionName(String typePath) {
        return NameCase.lowerCamel(typePath.substring(typePath.lastIndexOf('.') + 1));
    }

    /**
     * Runs the first factory found for {@code typePath}, recording every location tried.
     *
     * @return the built instance, or empty when no location provides a factory
     * @throws ConstructionException when a factory exists but fails
     */
    public Optional<Object> create(String typePath, InstanceProvider provider, DiagnosticContext trail) {
        String function = functionName(typePath);
        for (Location location : locations(typePath)) {
            String where = location.className() + " (" + location.description() + ")";
            Optional<FactoryModule> module = load(location.className(), provider, trail, where);
            if (module.isEmpty()) {
                continue;
            }
            Optional<FactoryFunction> factory = module.get().find(function);
            if (factory.isEmpty()) {
                trail.missed(where, "no method '" + function + "()'");
                continue;
            }
            String call = location.className() + "." + function + "()";
            Object instance;
            try {
                instance = factory.get().create();
            } catch (Exception e) {
                trail.missed(call, "factory failed: " + e.getMessage());
                throw new ConstructionException("Factory " + call + " failed for " + typePath, trail, e);
            }
            if (instance == null) {
                trail.missed(call, "factory returned null");
                continue;
            }
            trail.found(call);
            log.debug("Built {} with factory {}", typePath, call);
            return Optional.of(instance);
        }
        return Optional.empty();
    }

    private Optional<FactoryModule> load(String className, InstanceProvider provider,
                                         DiagnosticContext trail, String where) {
        Optional<FactoryTable> explicit = registry.findFactories(className);
        if (explicit.isPresent()) {
            return Optional.of(explicit.get());
        }
        Optional<FactoryModule> cached = loaded.get(className);
        if (cached != null) {
            if (cached.isEmpty()) {
                trail.missed(where, "class not found");
            }
            return cached;
        }
        Class<?> factoryClass;
        try {
            factoryClass = Class.forName(className, true, classLoader);
        } catch (ClassNotFoundException e) {
            loaded.put(className, Optional.empty());
            trail.missed(where, "class not found");
            return Optional.empty();
        } catch (LinkageError e) {
            trail.missed(where, "failed to load: " + e);
            return Optional.empty();
        }
        Object target;
        try {
            target = instantiate(factoryClass, provider);
        } catch (ReflectiveOperationException | RuntimeException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            trail.missed(where, "failed to instantiate: " + cause);
            return Optional.empty();
        }
        Optional<FactoryModule> module = Optional.of(new ClassFactoryModule(factoryClass, target));
        loaded.put(className, module);
        return module;
    }

    private static Object instantiate(Class<?> factoryClass, InstanceProvider provider)
            throws ReflectiveOperationException {
        for (Constructor<?> constructor : factoryClass.getConstructors()) {
            Class<?>[] params = constructor.getParameterTypes();
            if (params.length == 1 && params[0] == InstanceProvider.class) {
                return constructor.newInstance(provider);
            }
        }
        for (Constructor<?> constructor : factoryClass.getConstructors()) {
            if (constructor.getParameterCount() == 0) {
                return constructor.newInstance();
            }
        }
        // static factory methods only
        return null;
    }

    private String qualify(String name) {
        return factoriesPackage.isEmpty() ? name : factoriesPackage + "." + name;
    }
}
