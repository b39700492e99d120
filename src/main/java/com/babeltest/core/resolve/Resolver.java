package com.babeltest.core.resolve;

import com.babeltest.core.diagnostics.DiagnosticContext;
import com.babeltest.core.diagnostics.ResolutionException;
import com.babeltest.core.diagnostics.Suggestions;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Proxy;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Turns dotted targets into callables.
 *
 * <p>The longest leading run of segments naming a registered module is the root; the
 * rest is walked member by member. Types met along the way are turned into instances by
 * the {@link InstanceRegistry}, never constructed here. The last segment is the function
 * or method name. Every attempt is recorded in the {@link DiagnosticContext} attached to
 * a failure.
 */
public class Resolver {

    private final TargetRegistry registry;
    private final InstanceRegistry instances;

    public Resolver(TargetRegistry registry, InstanceRegistry instances) {
        this.registry = registry;
        this.instances = instances;
    }

    public ResolvedTarget resolve(String target) {
        return resolve(target, Map.of());
    }

    /**
     * @param typeHints parameter name to simple type name, used to narrow overloads
     * @throws ResolutionException when no interpretation of the target works
     * @throws com.babeltest.core.diagnostics.ConstructionException when a receiver cannot be built
     */
    public ResolvedTarget resolve(String target, Map<String, String> typeHints) {
        var trail = new DiagnosticContext(target);
        String[] parts = split(target, trail);
        for (int i = parts.length - 1; i >= 1; i--) {
            String modulePath = join(parts, 0, i);
            Optional<TargetModule> module = registry.findModule(modulePath);
            if (module.isEmpty()) {
                trail.missed(modulePath, "no module registered");
                continue;
            }
            trail.found(modulePath);
            return walk(module.get(), Arrays.copyOfRange(parts, i, parts.length), trail, typeHints);
        }
        trail.suggest(Suggestions.registerModule(target));
        trail.suggest(Suggestions.targetFormat());
        throw new ResolutionException("Cannot resolve target '" + target + "'", trail);
    }

    /**
     * Finds a module function or a registered type's method without building any receiver.
     */
    public TargetLocation locate(String target) {
        var trail = new DiagnosticContext(target);
        String[] parts = split(target, trail);
        for (int i = parts.length - 1; i >= 1; i--) {
            String modulePath = join(parts, 0, i);
            Optional<TargetModule> found = registry.findModule(modulePath);
            if (found.isEmpty()) {
                trail.missed(modulePath, "no module registered");
                continue;
            }
            TargetModule module = found.get();
            int remaining = parts.length - i;
            if (remaining == 1) {
                for (String name : NameCase.variants(parts[i])) {
                    if (module.findFunction(name).isPresent()) {
                        trail.found(modulePath + "." + name);
                        return new TargetLocation(module, modulePath, name, null);
                    }
                }
                trail.missed(modulePath + "." + parts[i], "no function; members: " + module.memberNames());
            } else if (remaining == 2) {
                Optional<Class<?>> type = module.findType(parts[i]);
                if (type.isPresent()) {
                    String typePath = modulePath + "." + parts[i];
                    for (String name : NameCase.variants(parts[i + 1])) {
                        if (hasPublicMethod(type.get(), name)) {
                            trail.found(typePath + "." + name);
                            return new TargetLocation(module, typePath, name, type.get());
                        }
                    }
                    trail.missed(typePath + "." + parts[i + 1], "no method on " + type.get().getSimpleName());
                } else {
                    trail.missed(modulePath + "." + parts[i], "no type registered");
                }
            } else {
                trail.missed(modulePath, "collaborator paths are <module>.<function> or <module>.<Type>.<method>");
            }
        }
        trail.suggest(Suggestions.registerModule(target));
        throw new ResolutionException("Cannot locate '" + target + "'", trail);
    }

    // -- walk ------------------------------------------------------------

    private ResolvedTarget walk(TargetModule module, String[] rest, DiagnosticContext trail,
                                Map<String, String> typeHints) {
        Object receiver = module;
        String path = module.path();
        for (int j = 0; j < rest.length - 1; j++) {
            boolean nextIsFinal = j == rest.length - 2;
            receiver = step(receiver, rest[j], path, nextIsFinal ? rest[rest.length - 1] : null, trail);
            path = path + "." + rest[j];
        }
        return lookupMethod(receiver, rest[rest.length - 1], path, trail, typeHints);
    }

    private Object step(Object receiver, String segment, String path, String finalName, DiagnosticContext trail) {
        String here = path + "." + segment;
        if (receiver instanceof TargetModule module) {
            Optional<Class<?>> type = module.findType(segment);
            if (type.isPresent()) {
                if (finalName != null && onlyStatic(type.get(), finalName)) {
                    trail.found(here + " (static)");
                    return new StaticReceiver(type.get());
                }
                trail.found(here + " (type " + type.get().getName() + ")");
                return instances.instance(here, type.get(), trail);
            }
            Optional<Object> value = module.findValue(segment);
            if (value.isPresent()) {
                trail.found(here);
                return value.get();
            }
            trail.missed(here, "no member '" + segment + "'; available: " + module.memberNames());
            throw new ResolutionException("Module '" + module.path() + "' has no member '" + segment + "'", trail);
        }
        if (receiver instanceof StaticReceiver) {
            trail.missed(here, "cannot walk through a static type");
            throw new ResolutionException("Cannot resolve '" + segment + "' on static type at " + path, trail);
        }
        Class<?> type = lookupType(receiver);
        for (Class<?> nested : type.getClasses()) {
            if (nested.getSimpleName().equals(segment)) {
                trail.found(here + " (type " + nested.getName() + ")");
                return instances.instance(here, nested, trail);
            }
        }
        for (String name : NameCase.variants(segment)) {
            Optional<Object> member = readMember(receiver, type, name, here, trail);
            if (member.isPresent()) {
                trail.found(here);
                return member.get();
            }
        }
        trail.missed(here, "no field or getter on " + type.getSimpleName());
        throw new ResolutionException("'" + segment + "' not found on " + type.getSimpleName(), trail);
    }

    private Optional<Object> readMember(Object receiver, Class<?> type, String name,
                                        String here, DiagnosticContext trail) {
        try {
            Field field = type.getField(name);
            if (!Modifier.isStatic(field.getModifiers())) {
                return Optional.ofNullable(nonNull(field.get(receiver), here, trail));
            }
        } catch (NoSuchFieldException | IllegalAccessException ignored) {
            // fall through to accessors
        }
        String capitalized = Character.toUpperCase(name.charAt(0)) + name.substring(1);
        for (String accessor : new String[] {"get" + capitalized, "is" + capitalized, name}) {
            try {
                Method method = type.getMethod(accessor);
                if (Modifier.isStatic(method.getModifiers()) || method.getReturnType() == void.class) {
                    continue;
                }
                method.trySetAccessible();
                return Optional.of(nonNull(method.invoke(receiver), here, trail));
            } catch (NoSuchMethodException | IllegalAccessException ignored) {
                // next accessor name
            } catch (InvocationTargetException e) {
                trail.missed(here, accessor + "() failed: " + e.getCause());
                throw new ResolutionException("Reading '" + name + "' failed", trail);
            }
        }
        return Optional.empty();
    }

    private static Object nonNull(Object value, String here, DiagnosticContext trail) {
        if (value == null) {
            trail.missed(here, "is null");
            throw new ResolutionException("'" + here + "' is null", trail);
        }
        return value;
    }

    private ResolvedTarget lookupMethod(Object receiver, String segment, String path,
                                        DiagnosticContext trail, Map<String, String> typeHints) {
        String here = path + "." + segment;
        if (receiver instanceof TargetModule module) {
            for (String name : NameCase.variants(segment)) {
                Optional<Invocable> function = module.findFunction(name);
                if (function.isPresent()) {
                    trail.found(path + "." + name);
                    return new ResolvedTarget(module, name, hinted(function.get(), typeHints));
                }
            }
            String reason = module.findType(segment).isPresent()
                    ? "is a type; add the method name after it"
                    : "no function '" + segment + "'; available: " + module.memberNames();
            trail.missed(here, reason);
            throw new ResolutionException("Function '" + segment + "' not found in module '" + module.path() + "'", trail);
        }
        Class<?> type;
        Object instance;
        if (receiver instanceof StaticReceiver statik) {
            type = statik.type();
            instance = null;
        } else {
            type = lookupType(receiver);
            instance = receiver;
        }
        for (String name : NameCase.variants(segment)) {
            Optional<MethodInvocable> method = MethodInvocable.find(type, instance, name, registry.binder());
            if (method.isPresent()) {
                trail.found(here);
                return new ResolvedTarget(instance != null ? instance : type, name, method.get().withTypeHints(typeHints));
            }
        }
        trail.missed(here, "no method '" + segment + "' on " + type.getSimpleName()
                + "; available: " + publicMethodNames(type));
        throw new ResolutionException("Method '" + segment + "' not found on " + type.getSimpleName(), trail);
    }

    private static Invocable hinted(Invocable function, Map<String, String> typeHints) {
        return function instanceof MethodInvocable method ? method.withTypeHints(typeHints) : function;
    }

    // -- helpers ---------------------------------------------------------

    private static String[] split(String target, DiagnosticContext trail) {
        if (target == null || target.isBlank() || !target.contains(".")
                || target.startsWith(".") || target.endsWith(".")) {
            trail.suggest(Suggestions.targetFormat());
            throw new ResolutionException("Invalid target '" + target + "'", trail);
        }
        return target.split("\\.");
    }

    private static String join(String[] parts, int from, int to) {
        return String.join(".", Arrays.copyOfRange(parts, from, to));
    }

    /** Proxies expose their interface, whose methods carry parameter names. */
    private static Class<?> lookupType(Object receiver) {
        Class<?> type = receiver.getClass();
        if (Proxy.isProxyClass(type) && type.getInterfaces().length > 0) {
            return type.getInterfaces()[0];
        }
        return type;
    }

    private static boolean onlyStatic(Class<?> type, String segment) {
        boolean any = false;
        for (String name : NameCase.variants(segment)) {
            for (Method method : type.getMethods()) {
                if (method.getName().equals(name)) {
                    if (!Modifier.isStatic(method.getModifiers())) {
                        return false;
                    }
                    any = true;
                }
            }
        }
        return any;
    }

    private static boolean hasPublicMethod(Class<?> type, String name) {
        return Arrays.stream(type.getMethods()).anyMatch(m -> m.getName().equals(name));
    }

    private static String publicMethodNames(Class<?> type) {
        return Arrays.stream(type.getMethods())
                .filter(m -> m.getDeclaringClass() != Object.class)
                .map(Method::getName)
                .collect(Collectors.toCollection(TreeSet::new))
                .toString();
    }

    private record StaticReceiver(Class<?> type) {}
}
