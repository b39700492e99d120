package com.babeltest.core.expect;

import com.babeltest.core.model.Expectation;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.babeltest.core.diagnostics.ValueFormatter.format;

/**
 * Checks a returned value against an {@link Expectation}.
 *
 * <p>CONTAINS is a recursive partial match: every expected key must be present with a
 * matching value, extra keys are ignored, and expected lists match as unordered subsets.
 * The first mismatch is reported with its dotted path.
 */
public class ExpectationMatcher {

    private final ValueNormalizer normalizer;
    private final ValueEquality equality;

    public ExpectationMatcher() {
        this(new ValueNormalizer());
    }

    public ExpectationMatcher(ValueNormalizer normalizer) {
        this.normalizer = normalizer;
        this.equality = new ValueEquality(normalizer.mapper());
    }

    public MatchResult matches(Object actual, Expectation expectation) {
        Object expected = expectation.value();
        return switch (expectation.type()) {
            case EXACT -> equality.equal(expected, actual)
                    ? MatchResult.pass()
                    : MatchResult.fail("Expected " + format(expected) + ", got " + format(actual));
            case CONTAINS -> contains(actual, expected, "");
            case TYPE -> matchType(actual, String.valueOf(expected));
            case NULL -> actual == null
                    ? MatchResult.pass()
                    : MatchResult.fail("Expected null, got " + format(actual));
            case NOT_NULL -> actual != null
                    ? MatchResult.pass()
                    : MatchResult.fail("Expected non-null value, got null");
            case TRUE -> Boolean.TRUE.equals(actual)
                    ? MatchResult.pass()
                    : MatchResult.fail("Expected true, got " + format(actual));
            case FALSE -> Boolean.FALSE.equals(actual)
                    ? MatchResult.pass()
                    : MatchResult.fail("Expected false, got " + format(actual));
        };
    }

    /** Simple class name, or the fully-qualified one when {@code expected} is qualified. */
    public static String typeName(Object value, boolean qualified) {
        if (value == null) {
            return "null";
        }
        return qualified ? value.getClass().getName() : value.getClass().getSimpleName();
    }

    private MatchResult matchType(Object actual, String expected) {
        String name = typeName(actual, expected.contains("."));
        return name.equals(expected)
                ? MatchResult.pass()
                : MatchResult.fail("Expected type " + expected + ", got " + name);
    }

    private MatchResult contains(Object actual, Object expected, String path) {
        if (expected instanceof Map<?, ?> expectedMap) {
            Optional<Map<String, Object>> normalized = normalizer.toMap(actual);
            if (normalized.isEmpty()) {
                return MatchResult.fail("Expected object with keys" + at(path) + ", got " + typeName(actual, false));
            }
            Map<String, Object> actualMap = normalized.get();
            for (Map.Entry<?, ?> entry : expectedMap.entrySet()) {
                String key = String.valueOf(entry.getKey());
                String keyPath = path.isEmpty() ? key : path + "." + key;
                if (!actualMap.containsKey(key)) {
                    return MatchResult.fail("Missing key '" + key + "'" + at(path));
                }
                Object actualValue = actualMap.get(key);
                Object expectedValue = entry.getValue();
                if (expectedValue instanceof Map<?, ?> || expectedValue instanceof List<?>) {
                    MatchResult nested = contains(actualValue, expectedValue, keyPath);
                    if (!nested.passed()) {
                        return nested;
                    }
                } else if (!equality.equal(expectedValue, actualValue)) {
                    return MatchResult.fail("Mismatch at '" + keyPath + "': expected "
                            + format(expectedValue) + ", got " + format(actualValue));
                }
            }
            return MatchResult.pass();
        }
        if (expected instanceof List<?> expectedList) {
            return listContains(actual, expectedList, path);
        }
        return equality.equal(expected, actual)
                ? MatchResult.pass()
                : MatchResult.fail("Expected " + format(expected) + at(path) + ", got " + format(actual));
    }

    private MatchResult listContains(Object actual, List<?> expected, String path) {
        Optional<List<Object>> normalized = normalizer.toList(actual);
        if (normalized.isEmpty()) {
            return MatchResult.fail("Expected list" + at(path) + ", got " + typeName(actual, false));
        }
        List<Object> actualItems = normalized.get();
        for (Object expectedItem : expected) {
            boolean found = actualItems.stream().anyMatch(item -> expectedItem instanceof Map<?, ?>
                    ? contains(item, expectedItem, "").passed()
                    : equality.equal(expectedItem, item));
            if (!found) {
                return MatchResult.fail("Expected item " + format(expectedItem) + " not found in list" + at(path));
            }
        }
        return MatchResult.pass();
    }

    private static String at(String path) {
        return path.isEmpty() ? "" : " at '" + path + "'";
    }
}
