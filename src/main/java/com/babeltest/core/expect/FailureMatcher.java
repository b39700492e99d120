package com.babeltest.core.expect;

import com.babeltest.core.model.ThrowsExpectation;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static com.babeltest.core.diagnostics.ValueFormatter.format;

/**
 * Checks a raised failure against a {@link ThrowsExpectation}. Absent fields match
 * anything; present ones must all hold.
 */
public class FailureMatcher {

    private static final String[] CODE_ACCESSORS = {"code", "getCode", "errorCode", "getErrorCode"};

    public MatchResult matches(Throwable raised, ThrowsExpectation expectation) {
        Throwable failure = unwrap(raised);
        if (expectation.type() != null && !typeMatches(failure, expectation.type())) {
            return MatchResult.fail("Expected " + expectation.type() + ", got " + typeName(failure));
        }
        String message = failure.getMessage() != null ? failure.getMessage() : "";
        if (expectation.message() != null && !message.contains(expectation.message())) {
            return MatchResult.fail("Expected message containing " + format(expectation.message())
                    + ", got " + format(message));
        }
        if (expectation.code() != null) {
            Optional<Object> code = code(failure);
            if (code.isEmpty()) {
                return MatchResult.fail("Expected error code " + format(expectation.code())
                        + ", but " + typeName(failure) + " has no error code");
            }
            if (!codeEquals(expectation.code(), code.get())) {
                return MatchResult.fail("Expected error code " + format(expectation.code())
                        + ", got " + format(code.get()));
            }
        }
        return MatchResult.pass();
    }

    /**
     * Strips reflection and concurrency wrappers to reach the failure the target raised.
     */
    public static Throwable unwrap(Throwable raised) {
        Throwable current = raised;
        while (current.getCause() != null && (current instanceof UndeclaredThrowableException
                || current instanceof InvocationTargetException
                || current instanceof CompletionException
                || current instanceof ExecutionException)) {
            current = current.getCause();
        }
        return current;
    }

    /** Reported failure type: {@link NamedFailure#failureType()}, else the simple class name. */
    public static String typeName(Throwable failure) {
        if (failure instanceof NamedFailure named) {
            return named.failureType();
        }
        return failure.getClass().getSimpleName();
    }

    /** {@code Type: message}, as shown for unexpected failures. */
    public static String describe(Throwable raised) {
        Throwable failure = unwrap(raised);
        return failure.getMessage() == null ? typeName(failure) : typeName(failure) + ": " + failure.getMessage();
    }

    private static boolean typeMatches(Throwable failure, String expected) {
        return expected.equals(typeName(failure))
                || expected.equals(failure.getClass().getSimpleName())
                || expected.equals(failure.getClass().getName());
    }

    private static Optional<Object> code(Throwable failure) {
        for (String name : CODE_ACCESSORS) {
            try {
                Method accessor = failure.getClass().getMethod(name);
                if (accessor.getReturnType() == void.class) {
                    continue;
                }
                accessor.trySetAccessible();
                return Optional.ofNullable(accessor.invoke(failure));
            } catch (NoSuchMethodException e) {
                // try the next accessor name
            } catch (ReflectiveOperationException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static boolean codeEquals(Object expected, Object actual) {
        if (expected instanceof Number e && actual instanceof Number a) {
            return ValueEquality.numericEqual(e, a);
        }
        return String.valueOf(expected).equals(String.valueOf(actual));
    }
}
