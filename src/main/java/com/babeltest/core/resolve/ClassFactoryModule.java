package com.babeltest.core.resolve;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Optional;

/**
 * Factory functions declared as public zero-argument methods of a factory class.
 * Instance methods are called on {@code target}, which is {@code null} when the class
 * could not be instantiated.
 */
class ClassFactoryModule implements FactoryModule {

    private final Class<?> factoryClass;
    private final Object target;

    ClassFactoryModule(Class<?> factoryClass, Object target) {
        this.factoryClass = factoryClass;
        this.target = target;
    }

    @Override
    public String location() {
        return factoryClass.getName();
    }

    @Override
    public Optional<FactoryFunction> find(String functionName) {
        Method method;
        try {
            method = factoryClass.getMethod(functionName);
        } catch (NoSuchMethodException e) {
            return Optional.empty();
        }
        boolean isStatic = Modifier.isStatic(method.getModifiers());
        if (!isStatic && target == null) {
            return Optional.empty();
        }
        method.trySetAccessible();
        return Optional.of(() -> {
            try {
                return method.invoke(isStatic ? null : target);
            } catch (InvocationTargetException e) {
                throw MethodInvocable.rethrowable(e.getCause());
            }
        });
    }
}
