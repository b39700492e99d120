package com.babeltest.core.resolve;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * A dotted namespace of the {@link TargetRegistry}. Holds functions, constructible types
 * and plain values, each addressable as {@code <module path>.<member name>}.
 */
public class TargetModule {

    private final String path;
    private final ArgumentBinder binder;
    private final Map<String, Invocable> functions = new ConcurrentHashMap<>();
    private final Map<String, Class<?>> types = new ConcurrentHashMap<>();
    private final Map<String, Object> values = new ConcurrentHashMap<>();

    TargetModule(String path, ArgumentBinder binder) {
        this.path = path;
        this.binder = binder;
    }

    public String path() {
        return path;
    }

    // -- registration ----------------------------------------------------

    public TargetModule function(String name, Invocable function) {
        functions.put(name, function);
        return this;
    }

    /**
     * Registers every public static method of {@code holder} as a module function.
     */
    public TargetModule functions(Class<?> holder) {
        Set<String> names = Arrays.stream(holder.getMethods())
                .filter(m -> Modifier.isStatic(m.getModifiers()))
                .filter(m -> m.getDeclaringClass() == holder)
                .map(Method::getName)
                .collect(Collectors.toSet());
        for (String name : names) {
            MethodInvocable.find(holder, null, name, binder).ifPresent(fn -> functions.put(name, fn));
        }
        return this;
    }

    /** Registers a constructible type under its simple name. */
    public TargetModule type(Class<?> type) {
        return type(type.getSimpleName(), type);
    }

    public TargetModule type(String name, Class<?> type) {
        types.put(name, type);
        return this;
    }

    public TargetModule value(String name, Object value) {
        values.put(name, value);
        return this;
    }

    // -- lookup ----------------------------------------------------------

    public Optional<Invocable> findFunction(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public Optional<Class<?>> findType(String name) {
        return Optional.ofNullable(types.get(name));
    }

    public Optional<Object> findValue(String name) {
        return Optional.ofNullable(values.get(name));
    }

    /** Name under which {@code type} is registered in this module. */
    public Optional<String> typeName(Class<?> type) {
        return types.entrySet().stream()
                .filter(e -> e.getValue() == type)
                .map(Map.Entry::getKey)
                .findFirst();
    }

    public Set<String> memberNames() {
        Set<String> names = new TreeSet<>(functions.keySet());
        names.addAll(types.keySet());
        names.addAll(values.keySet());
        return names;
    }

    /**
     * Swaps the function bound under {@code name} and returns the previous binding.
     *
     * @throws IllegalArgumentException when no function is bound under that name
     */
    public Invocable rebind(String name, Invocable replacement) {
        Invocable previous = functions.replace(name, replacement);
        if (previous == null) {
            throw new IllegalArgumentException("No function '" + name + "' in module " + path);
        }
        return previous;
    }

    @Override
    public String toString() {
        return "TargetModule[" + path + "]";
    }
}
