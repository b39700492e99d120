package com.babeltest.core.resolve;

import com.babeltest.core.ir.IrJson;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.lang.reflect.Array;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts JSON-like test inputs into Java method arguments, and mock values into return values.
 */
public class ArgumentBinder {

    private final ObjectMapper mapper;

    public ArgumentBinder() {
        this(IrJson.newMapper());
    }

    public ArgumentBinder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    /**
     * Binds named arguments to the parameters of {@code method}. When the class was compiled
     * without parameter names, arguments are bound positionally in their given order.
     */
    public Object[] bind(Method method, Map<String, Object> arguments) {
        Parameter[] parameters = method.getParameters();
        Type[] types = method.getGenericParameterTypes();
        Object[] values = new Object[parameters.length];
        if (!hasParameterNames(method)) {
            List<Object> ordered = new ArrayList<>(arguments.values());
            for (int i = 0; i < parameters.length; i++) {
                values[i] = coerce(ordered.get(i), types[i], parameters[i].getName());
            }
            return values;
        }
        for (int i = 0; i < parameters.length; i++) {
            String name = parameters[i].getName();
            values[i] = coerce(arguments.get(name), types[i], name);
        }
        return values;
    }

    /**
     * Named view of positional arguments, used when recording intercepted calls.
     */
    public static Map<String, Object> nameArguments(Method method, Object[] args) {
        var named = new LinkedHashMap<String, Object>();
        Parameter[] parameters = method.getParameters();
        for (int i = 0; i < parameters.length; i++) {
            named.put(parameters[i].getName(), args != null && i < args.length ? args[i] : null);
        }
        return named;
    }

    public static boolean hasParameterNames(Method method) {
        for (Parameter parameter : method.getParameters()) {
            if (!parameter.isNamePresent()) {
                return false;
            }
        }
        return true;
    }

    public Object coerce(Object value, Type type) {
        return coerce(value, type, "value");
    }

    private Object coerce(Object value, Type type, String name) {
        Class<?> raw = mapper.getTypeFactory().constructType(type).getRawClass();
        if (value == null) {
            return raw.isPrimitive() ? defaultValue(raw) : null;
        }
        if (raw == Object.class || (!raw.isPrimitive() && raw.isInstance(value) && type instanceof Class<?>)) {
            return value;
        }
        try {
            return mapper.convertValue(value, mapper.getTypeFactory().constructType(type));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Cannot convert '%s' to %s: %s".formatted(name, type.getTypeName(), e.getMessage()), e);
        }
    }

    static Object defaultValue(Class<?> primitive) {
        if (primitive == void.class) {
            return null;
        }
        return Array.get(Array.newInstance(primitive, 1), 0);
    }
}
