package com.babeltest.core.resolve;

/**
 * Gives factories access to registry-managed collaborators, so that the instances they
 * build honour the active lifecycle policy and any installed mocks.
 *
 * <p>A factory class with a public {@code (InstanceProvider)} constructor receives one
 * when it is loaded.
 */
public interface InstanceProvider {

    /**
     * Returns the instance registered for the type at {@code typePath}
     * (e.g. {@code "payments.PaymentGateway"}).
     */
    <T> T instance(String typePath, Class<T> type);

    /**
     * Returns a late-bound handle on the module function at {@code functionPath}.
     * Every call looks the binding up again, so a mock installed later is honoured.
     */
    Invocable function(String functionPath);
}
