package com.babeltest.core.expect;

import com.babeltest.core.ir.IrJson;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.lang.reflect.Array;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns structured results into maps and lists so they can be compared against JSON-like
 * expectations.
 *
 * <p>Map normalization order: {@link Map} as is, a public {@code toMap()}, a public
 * {@code asMap()}, record components, then Jackson bean properties.
 */
public class ValueNormalizer {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final String[] MAP_METHODS = {"toMap", "asMap"};

    private final ObjectMapper mapper;

    public ValueNormalizer() {
        this(IrJson.newMapper());
    }

    public ValueNormalizer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public Optional<Map<String, Object>> toMap(Object value) {
        if (value == null || isScalar(value) || isList(value)) {
            return Optional.empty();
        }
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return Optional.of(copy);
        }
        for (String name : MAP_METHODS) {
            Optional<Object> converted = callNoArg(value, name);
            if (converted.isPresent() && converted.get() instanceof Map<?, ?>) {
                return toMap(converted.get());
            }
        }
        if (value.getClass().isRecord()) {
            var fields = new LinkedHashMap<String, Object>();
            for (RecordComponent component : value.getClass().getRecordComponents()) {
                try {
                    Method accessor = component.getAccessor();
                    accessor.trySetAccessible();
                    fields.put(component.getName(), accessor.invoke(value));
                } catch (ReflectiveOperationException e) {
                    return Optional.empty();
                }
            }
            return Optional.of(fields);
        }
        try {
            Map<String, Object> properties = mapper.convertValue(value, MAP_TYPE);
            return properties.isEmpty() ? Optional.empty() : Optional.of(properties);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /** Lists, arrays and other collections as a list; anything else empty. */
    public Optional<List<Object>> toList(Object value) {
        if (value instanceof List<?> list) {
            return Optional.of(new ArrayList<>(list));
        }
        if (value instanceof Collection<?> collection) {
            return Optional.of(new ArrayList<>(collection));
        }
        if (value != null && value.getClass().isArray()) {
            List<Object> items = new ArrayList<>();
            for (int i = 0; i < Array.getLength(value); i++) {
                items.add(Array.get(value, i));
            }
            return Optional.of(items);
        }
        return Optional.empty();
    }

    public static boolean isList(Object value) {
        return value instanceof Collection<?> || (value != null && value.getClass().isArray());
    }

    public static boolean isScalar(Object value) {
        return value instanceof CharSequence || value instanceof Number || value instanceof Boolean
                || value instanceof Character || value instanceof Enum<?>;
    }

    private static Optional<Object> callNoArg(Object value, String name) {
        try {
            Method method = value.getClass().getMethod(name);
            if (Modifier.isStatic(method.getModifiers())) {
                return Optional.empty();
            }
            method.trySetAccessible();
            return Optional.ofNullable(method.invoke(value));
        } catch (NoSuchMethodException e) {
            return Optional.empty();
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException(name + "() failed on " + value.getClass().getSimpleName(), e);
        }
    }
}
