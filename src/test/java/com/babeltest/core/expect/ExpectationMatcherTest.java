package com.babeltest.core.expect;

import com.babeltest.core.model.Expectation;
import com.babeltest.core.model.ExpectationType;
import com.babeltest.fixtures.math.Calculator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExpectationMatcherTest {

    private final ExpectationMatcher matcher = new ExpectationMatcher();

    private MatchResult match(Object actual, ExpectationType type, Object expected) {
        return matcher.matches(actual, new Expectation(type, expected));
    }

    // -- exact -----------------------------------------------------------------

    @Nested
    @DisplayName("exact")
    class Exact {

        @Test
        @DisplayName("numbers compare by value across types")
        void numbersByValue() {
            assertTrue(match(5, ExpectationType.EXACT, 5L).passed());
            assertTrue(match(2.0, ExpectationType.EXACT, 2).passed());
        }

        @Test
        @DisplayName("booleans are not numbers")
        void booleansStrict() {
            assertFalse(match(true, ExpectationType.EXACT, 1).passed());
        }

        @Test
        @DisplayName("records compare structurally with maps")
        void recordsAsMaps() {
            var profile = new Calculator.Profile("ada", 36, List.of("new", "trial"));
            assertTrue(match(profile, ExpectationType.EXACT,
                    Map.of("name", "ada", "age", 36, "tags", List.of("new", "trial"))).passed());
        }

        @Test
        @DisplayName("mismatch message shows both values")
        void mismatchMessage() {
            assertEquals("Expected 5, got 6", match(6, ExpectationType.EXACT, 5).message());
            assertEquals("Expected 'a', got 'b'", match("b", ExpectationType.EXACT, "a").message());
        }
    }

    // -- contains --------------------------------------------------------------

    @Nested
    @DisplayName("contains")
    class Contains {

        @Test
        @DisplayName("ignores extra keys, recursively")
        void partialNested() {
            Map<String, Object> actual = Map.of("user", Map.of("id", 1, "name", "ada", "roles", List.of("admin")),
                    "meta", Map.of());
            assertTrue(match(actual, ExpectationType.CONTAINS, Map.of("user", Map.of("name", "ada"))).passed());
        }

        @Test
        @DisplayName("reports the missing key and its path")
        void missingKey() {
            MatchResult result = match(Map.of("user", Map.of("id", 1)), ExpectationType.CONTAINS,
                    Map.of("user", Map.of("email", "x")));
            assertEquals("Missing key 'email' at 'user'", result.message());
        }

        @Test
        @DisplayName("reports a mismatched value with its key path")
        void mismatch() {
            MatchResult result = match(Map.of("user", Map.of("id", 1)), ExpectationType.CONTAINS,
                    Map.of("user", Map.of("id", 2)));
            assertEquals("Mismatch at 'user.id': expected 2, got 1", result.message());
        }

        @Test
        @DisplayName("list matching is unordered subset")
        void unorderedLists() {
            assertTrue(match(List.of(3, 1, 2), ExpectationType.CONTAINS, List.of(1, 2)).passed());
            assertFalse(match(List.of(1, 2), ExpectationType.CONTAINS, List.of(1, 2, 3)).passed());
        }

        @Test
        @DisplayName("list items may be partial maps")
        void partialItems() {
            var actual = List.of(Map.of("id", 1, "name", "a"), Map.of("id", 2, "name", "b"));
            assertTrue(match(actual, ExpectationType.CONTAINS, List.of(Map.of("id", 2))).passed());
        }

        @Test
        @DisplayName("arrays count as lists")
        void arrays() {
            assertTrue(match(new int[] {4, 5, 6}, ExpectationType.CONTAINS, List.of(6)).passed());
        }

        @Test
        @DisplayName("non-map actual for a map expectation")
        void notAMap() {
            assertEquals("Expected object with keys, got Integer",
                    match(3, ExpectationType.CONTAINS, Map.of("a", 1)).message());
        }
    }

    // -- the rest ----------------------------------------------------------------

    @Nested
    @DisplayName("type, null and boolean")
    class Others {

        @Test
        @DisplayName("type by simple or qualified name")
        void typeNames() {
            assertTrue(match("x", ExpectationType.TYPE, "String").passed());
            assertTrue(match("x", ExpectationType.TYPE, "java.lang.String").passed());
            assertEquals("Expected type Integer, got String", match("x", ExpectationType.TYPE, "Integer").message());
        }

        @Test
        @DisplayName("null and not_null")
        void nulls() {
            assertTrue(match(null, ExpectationType.NULL, null).passed());
            assertEquals("Expected null, got 'x'", match("x", ExpectationType.NULL, null).message());
            assertEquals("Expected non-null value, got null", match(null, ExpectationType.NOT_NULL, null).message());
        }

        @Test
        @DisplayName("true and false are strict")
        void booleans() {
            assertTrue(match(true, ExpectationType.TRUE, null).passed());
            assertFalse(match(1, ExpectationType.TRUE, null).passed());
            assertEquals("Expected false, got 'false'", match("false", ExpectationType.FALSE, null).message());
        }
    }
}
