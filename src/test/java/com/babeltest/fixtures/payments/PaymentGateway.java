package com.babeltest.fixtures.payments;

public interface PaymentGateway {

    String charge(String customerId, double amount);
}
