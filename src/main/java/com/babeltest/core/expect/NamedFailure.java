package com.babeltest.core.expect;

/**
 * A failure that reports a type name other than its Java class name. Failures raised
 * by mocks use this to carry the name a test asked for.
 */
public interface NamedFailure {

    String failureType();
}
