package com.babeltest.core.resolve;

/**
 * Replaces or observes calls to an overridden collaborator method.
 */
@FunctionalInterface
public interface CallInterceptor {

    Object intercept(InterceptedCall call) throws Exception;
}
