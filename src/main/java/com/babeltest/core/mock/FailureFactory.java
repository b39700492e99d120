package com.babeltest.core.mock;

import com.babeltest.core.model.ThrowsExpectation;
import com.babeltest.core.resolve.TargetLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Builds the failures thrown by mocks. The type name is looked up as, in order:
 * a fully-qualified class name, a throwable registered or nested alongside the mocked
 * target (or in its Java package), a well-known JDK exception, and finally a
 * {@link MockedFailure} carrying the requested name.
 */
public class FailureFactory {

    private static final Logger log = LoggerFactory.getLogger(FailureFactory.class);

    static final String DEFAULT_TYPE = "MockedFailure";
    private static final List<String> BUILTIN_PACKAGES =
            List.of("java.lang", "java.util", "java.io", "java.util.concurrent");

    private final ClassLoader classLoader;

    public FailureFactory() {
        this(Thread.currentThread().getContextClassLoader());
    }

    public FailureFactory(ClassLoader classLoader) {
        this.classLoader = classLoader != null ? classLoader : FailureFactory.class.getClassLoader();
    }

    /**
     * Returns a supplier producing a fresh failure for every call of the mock.
     */
    public Supplier<Throwable> prepare(ThrowsExpectation spec, TargetLocation location) {
        String message = spec.message() != null ? spec.message() : "";
        String name = spec.type();
        if (name == null || name.isBlank()) {
            return () -> new MockedFailure(DEFAULT_TYPE, message);
        }
        Optional<Class<? extends Throwable>> type = find(name, location);
        if (type.isEmpty()) {
            log.debug("No failure class named {}, raising MockedFailure", name);
            return () -> new MockedFailure(name, message);
        }
        Class<? extends Throwable> failureClass = type.get();
        return () -> instantiate(failureClass, name, message);
    }

    Optional<Class<? extends Throwable>> find(String name, TargetLocation location) {
        for (String candidate : candidates(name, location)) {
            Optional<Class<? extends Throwable>> type = load(candidate);
            if (type.isPresent()) {
                return type;
            }
        }
        if (location != null) {
            Optional<Class<? extends Throwable>> registered = location.module().findType(name)
                    .filter(Throwable.class::isAssignableFrom)
                    .map(FailureFactory::asThrowable);
            if (registered.isPresent()) {
                return registered;
            }
            if (location.type() != null) {
                for (Class<?> nested : location.type().getDeclaredClasses()) {
                    if (nested.getSimpleName().equals(name) && Throwable.class.isAssignableFrom(nested)) {
                        return Optional.of(asThrowable(nested));
                    }
                }
            }
        }
        for (String pkg : BUILTIN_PACKAGES) {
            Optional<Class<? extends Throwable>> type = load(pkg + "." + name);
            if (type.isPresent()) {
                return type;
            }
        }
        return Optional.empty();
    }

    private List<String> candidates(String name, TargetLocation location) {
        List<String> names = new ArrayList<>();
        if (name.contains(".")) {
            names.add(name);
        }
        if (location != null && location.type() != null && location.type().getPackageName().length() > 0) {
            names.add(location.type().getPackageName() + "." + name);
        }
        return names;
    }

    private Optional<Class<? extends Throwable>> load(String className) {
        try {
            Class<?> type = Class.forName(className, false, classLoader);
            return Throwable.class.isAssignableFrom(type) ? Optional.of(asThrowable(type)) : Optional.empty();
        } catch (ClassNotFoundException | LinkageError e) {
            return Optional.empty();
        }
    }

    @SuppressWarnings("unchecked")
    private static Class<? extends Throwable> asThrowable(Class<?> type) {
        return (Class<? extends Throwable>) type;
    }

    static Throwable instantiate(Class<? extends Throwable> type, String name, String message) {
        try {
            Constructor<? extends Throwable> withMessage = type.getDeclaredConstructor(String.class);
            withMessage.trySetAccessible();
            return withMessage.newInstance(message);
        } catch (NoSuchMethodException e) {
            try {
                Constructor<? extends Throwable> noArg = type.getDeclaredConstructor();
                noArg.trySetAccessible();
                return noArg.newInstance();
            } catch (ReflectiveOperationException inner) {
                return new MockedFailure(name, message);
            }
        } catch (ReflectiveOperationException e) {
            return new MockedFailure(name, message);
        }
    }
}
