package com.babeltest.fixtures.payments;

public class RealPaymentGateway implements PaymentGateway {

    @Override
    public String charge(String customerId, double amount) {
        return "rcpt-" + customerId;
    }
}
