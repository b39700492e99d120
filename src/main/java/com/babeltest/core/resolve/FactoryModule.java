package com.babeltest.core.resolve;

import java.util.Optional;

/**
 * A set of named factory functions found at one conventional location.
 */
public interface FactoryModule {

    /** Location key, the fully-qualified factory class name. */
    String location();

    Optional<FactoryFunction> find(String functionName);
}
