package com.babeltest.core.resolve;

/**
 * Zero-argument factory building one receiver instance.
 */
@FunctionalInterface
public interface FactoryFunction {

    Object create() throws Exception;
}
