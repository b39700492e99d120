package com.babeltest.core.resolve;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Proxy;
import java.lang.reflect.Type;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Interface proxy that routes every call through {@link MethodOverrides} before reaching
 * the real collaborator. Values produced by an override are converted to the method's
 * declared return type.
 */
final class CollaboratorProxy implements InvocationHandler {

    private final String typePath;
    private final Object target;
    private final MethodOverrides overrides;
    private final ArgumentBinder binder;

    private CollaboratorProxy(String typePath, Object target, MethodOverrides overrides, ArgumentBinder binder) {
        this.typePath = typePath;
        this.target = target;
        this.overrides = overrides;
        this.binder = binder;
    }

    static Object wrap(String typePath, Class<?> type, Object target, MethodOverrides overrides, ArgumentBinder binder) {
        return Proxy.newProxyInstance(type.getClassLoader(), new Class<?>[] {type},
                new CollaboratorProxy(typePath, target, overrides, binder));
    }

    static boolean isProxy(Object candidate) {
        return candidate != null && Proxy.isProxyClass(candidate.getClass())
                && Proxy.getInvocationHandler(candidate) instanceof CollaboratorProxy;
    }

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
        if (method.getDeclaringClass() == Object.class) {
            return switch (method.getName()) {
                case "equals" -> proxy == args[0];
                case "hashCode" -> System.identityHashCode(proxy);
                default -> typePath + "@proxy(" + target + ")";
            };
        }
        String key = MethodOverrides.key(typePath, method.getName());
        if (!overrides.isOverridden(key)) {
            return callTarget(method, args);
        }
        Map<String, Object> named = ArgumentBinder.nameArguments(method, args);
        Object result = overrides.call(key, named, ignored -> callTarget(method, args));
        return convert(result, method);
    }

    private Object callTarget(Method method, Object[] args) throws Exception {
        try {
            method.trySetAccessible();
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw MethodInvocable.rethrowable(e.getCause());
        }
    }

    private Object convert(Object result, Method method) {
        Class<?> returnType = method.getReturnType();
        if (returnType == void.class) {
            return null;
        }
        if (CompletionStage.class.isAssignableFrom(returnType) && !(result instanceof CompletionStage<?>)
                && returnType.isAssignableFrom(CompletableFuture.class)) {
            Type generic = method.getGenericReturnType();
            Type element = generic instanceof ParameterizedType parameterized
                    ? parameterized.getActualTypeArguments()[0] : Object.class;
            return CompletableFuture.completedFuture(binder.coerce(result, element));
        }
        return binder.coerce(result, method.getGenericReturnType());
    }
}
