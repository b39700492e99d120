package com.babeltest.core.resolve;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Factory functions registered explicitly through {@link TargetRegistry#factories(String)}.
 */
public class FactoryTable implements FactoryModule {

    private final String location;
    private final Map<String, FactoryFunction> functions = new ConcurrentHashMap<>();

    FactoryTable(String location) {
        this.location = location;
    }

    public FactoryTable factory(String name, FactoryFunction function) {
        functions.put(name, function);
        return this;
    }

    @Override
    public String location() {
        return location;
    }

    @Override
    public Optional<FactoryFunction> find(String functionName) {
        return Optional.ofNullable(functions.get(functionName));
    }
}
