package com.babeltest.core.expect;

import com.babeltest.core.mock.MockedFailure;
import com.babeltest.core.model.ThrowsExpectation;
import com.babeltest.fixtures.payments.PaymentDeclined;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.InvocationTargetException;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class FailureMatcherTest {

    private final FailureMatcher matcher = new FailureMatcher();

    @Test
    @DisplayName("matches by simple or qualified type name")
    void typeNames() {
        var declined = new PaymentDeclined("insufficient funds");
        assertTrue(matcher.matches(declined, ThrowsExpectation.ofType("PaymentDeclined")).passed());
        assertTrue(matcher.matches(declined, ThrowsExpectation.ofType(PaymentDeclined.class.getName())).passed());
        assertEquals("Expected ValueError, got PaymentDeclined",
                matcher.matches(declined, ThrowsExpectation.ofType("ValueError")).message());
    }

    @Test
    @DisplayName("message is a substring match")
    void messageSubstring() {
        var failure = new IllegalArgumentException("amount must be positive");
        assertTrue(matcher.matches(failure, new ThrowsExpectation(null, "positive", null)).passed());
        assertFalse(matcher.matches(failure, new ThrowsExpectation(null, "negative", null)).passed());
    }

    @Test
    @DisplayName("code is read from a getter")
    void code() {
        var declined = new PaymentDeclined("no");
        assertTrue(matcher.matches(declined, new ThrowsExpectation(null, null, "card_declined")).passed());
        assertEquals("Expected error code 'expired', got 'card_declined'",
                matcher.matches(declined, new ThrowsExpectation(null, null, "expired")).message());
        assertTrue(matcher.matches(new IllegalStateException(), new ThrowsExpectation(null, null, 42))
                .message().contains("has no error code"));
    }

    @Test
    @DisplayName("wrappers are stripped before matching")
    void unwrapsWrappers() {
        var wrapped = new CompletionException(new InvocationTargetException(new PaymentDeclined("no")));
        assertTrue(matcher.matches(wrapped, ThrowsExpectation.ofType("PaymentDeclined")).passed());
    }

    @Test
    @DisplayName("named failures report their declared type")
    void namedFailure() {
        var mocked = new MockedFailure("RateLimited", "slow down");
        assertTrue(matcher.matches(mocked, ThrowsExpectation.ofType("RateLimited")).passed());
        assertEquals("RateLimited: slow down", FailureMatcher.describe(mocked));
    }
}
