package com.babeltest.core.resolve;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

/**
 * Reflective call of a named Java method, choosing among overloads by the names of the
 * supplied arguments.
 */
public class MethodInvocable implements Invocable {

    private final Object receiver;
    private final String name;
    private final List<Method> overloads;
    private final ArgumentBinder binder;
    private final Map<String, String> typeHints;

    MethodInvocable(Object receiver, String name, List<Method> overloads,
                    ArgumentBinder binder, Map<String, String> typeHints) {
        this.receiver = receiver;
        this.name = name;
        this.overloads = overloads;
        this.binder = binder;
        this.typeHints = typeHints;
    }

    /**
     * Public methods called {@code name} on {@code type}. A {@code null} receiver limits the
     * candidates to static methods.
     */
    public static Optional<MethodInvocable> find(Class<?> type, Object receiver, String name, ArgumentBinder binder) {
        List<Method> methods = Arrays.stream(type.getMethods())
                .filter(m -> m.getName().equals(name))
                .filter(m -> m.getDeclaringClass() != Object.class)
                .filter(m -> receiver != null || Modifier.isStatic(m.getModifiers()))
                .sorted(Comparator.comparingInt(Method::getParameterCount)
                        .thenComparing(m -> Arrays.toString(m.getParameterTypes())))
                .toList();
        if (methods.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new MethodInvocable(receiver, name, methods, binder, Map.of()));
    }

    /** Same method, narrowing overloads by simple parameter type names. */
    public MethodInvocable withTypeHints(Map<String, String> hints) {
        if (hints == null || hints.isEmpty()) {
            return this;
        }
        return new MethodInvocable(receiver, name, overloads, binder, Map.copyOf(hints));
    }

    public String name() {
        return name;
    }

    public Object receiver() {
        return receiver;
    }

    @Override
    public boolean isAsync() {
        return overloads.stream().allMatch(MethodInvocable::returnsDeferred);
    }

    @Override
    public Object invoke(Map<String, Object> arguments) throws Exception {
        Method method = select(arguments);
        method.trySetAccessible();
        Object[] values = binder.bind(method, arguments);
        try {
            return method.invoke(Modifier.isStatic(method.getModifiers()) ? null : receiver, values);
        } catch (InvocationTargetException e) {
            throw rethrowable(e.getCause());
        }
    }

    Method select(Map<String, Object> arguments) {
        Set<String> given = arguments.keySet();
        List<Method> candidates = overloads.stream()
                .filter(m -> m.getParameterCount() == given.size())
                .filter(m -> !ArgumentBinder.hasParameterNames(m) || parameterNames(m).equals(given))
                .toList();
        if (candidates.size() > 1 && !typeHints.isEmpty()) {
            List<Method> hinted = candidates.stream().filter(this::matchesHints).toList();
            if (!hinted.isEmpty()) {
                candidates = hinted;
            }
        }
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("No overload of '%s' accepts arguments %s; available: %s"
                    .formatted(name, given, overloads.stream().map(MethodInvocable::signature).toList()));
        }
        return candidates.get(0);
    }

    private boolean matchesHints(Method method) {
        for (var parameter : method.getParameters()) {
            String hint = typeHints.get(parameter.getName());
            if (hint != null && !hint.equalsIgnoreCase(parameter.getType().getSimpleName())) {
                return false;
            }
        }
        return true;
    }

    private static Set<String> parameterNames(Method method) {
        return Arrays.stream(method.getParameters()).map(p -> p.getName()).collect(Collectors.toSet());
    }

    static boolean returnsDeferred(Method method) {
        Class<?> type = method.getReturnType();
        return CompletionStage.class.isAssignableFrom(type) || Future.class.isAssignableFrom(type);
    }

    static String signature(Method method) {
        return method.getName() + Arrays.stream(method.getParameters())
                .map(p -> p.getType().getSimpleName() + " " + p.getName())
                .collect(Collectors.joining(", ", "(", ")"));
    }

    static Exception rethrowable(Throwable cause) {
        if (cause instanceof Exception exception) {
            return exception;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException(cause);
    }
}
