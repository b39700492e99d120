package com.babeltest.core.mock;

import com.babeltest.core.expect.NamedFailure;

/**
 * Raised by a mock whose failure type could not be found as a Java class. Carries the
 * requested name so failure expectations still match it.
 */
public class MockedFailure extends RuntimeException implements NamedFailure {

    private final String failureType;

    public MockedFailure(String failureType, String message) {
        super(message);
        this.failureType = failureType;
    }

    @Override
    public String failureType() {
        return failureType;
    }
}
