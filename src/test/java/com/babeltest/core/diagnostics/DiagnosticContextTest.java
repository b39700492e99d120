package com.babeltest.core.diagnostics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticContextTest {

    @Test
    @DisplayName("format lists the search trail and numbered suggestions")
    void format() {
        var context = new DiagnosticContext("shop.Cart.total")
                .found("shop")
                .missed("shop.Cart", "no zero-argument constructor")
                .suggest("Add a public zero-argument constructor to Cart")
                .suggest("Add a public zero-argument constructor to Cart");

        String text = context.format("Cannot construct shop.Cart");

        assertEquals("""
                Cannot construct shop.Cart

                Searched:
                  + shop
                  x shop.Cart (no zero-argument constructor)

                Suggestions:
                  1. Add a public zero-argument constructor to Cart""", text);
    }

    @Test
    @DisplayName("an empty trail formats as the summary alone")
    void emptyTrail() {
        assertEquals("Nothing", new DiagnosticContext("x.y").format("Nothing"));
    }

    @Test
    @DisplayName("merge appends attempts and keeps suggestions unique")
    void merge() {
        var outer = new DiagnosticContext("a.B.c").found("a").suggest("one");
        var inner = new DiagnosticContext("a.B").missed("a.B()", "is abstract").suggest("one").suggest("two");

        outer.merge(inner).merge(outer);

        assertEquals(2, outer.searches().size());
        assertEquals(List.of("one", "two"), outer.suggestions());
    }

    @Test
    @DisplayName("resolution failures carry their trail in the message")
    void resolutionMessage() {
        var context = new DiagnosticContext("m.f").missed("m", "no module registered");
        var e = new ResolutionException("Cannot resolve target 'm.f'", context);
        assertTrue(e.getMessage().startsWith("Cannot resolve target 'm.f'\n\nSearched:"));
        assertSame(context, e.context());
    }

    @Test
    @DisplayName("factory suggestion shows a compilable class")
    void factorySuggestion() {
        String text = Suggestions.factory("Cart", "babel.factories.ShopFactories", "cart");
        assertTrue(text.contains("package babel.factories;"));
        assertTrue(text.contains("public class ShopFactories {"));
        assertTrue(text.contains("public static Cart cart() {"));
    }

    @Test
    @DisplayName("values are rendered compactly and truncated")
    void valueFormatter() {
        assertEquals("'x'", ValueFormatter.format("x"));
        assertEquals("{'a': [1, 2]}", ValueFormatter.format(Map.of("a", List.of(1, 2))));
        assertEquals("[1, 2]", ValueFormatter.format(new int[] {1, 2}));
        assertEquals("null", ValueFormatter.format(null));
        String longText = ValueFormatter.format("y".repeat(500));
        assertEquals(ValueFormatter.DEFAULT_MAX_LENGTH, longText.length());
        assertTrue(longText.endsWith("..."));
    }
}
