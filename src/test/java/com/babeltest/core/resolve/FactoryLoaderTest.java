package com.babeltest.core.resolve;

import com.babeltest.core.diagnostics.ConstructionException;
import com.babeltest.core.diagnostics.DiagnosticContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class FactoryLoaderTest {

    private TargetRegistry registry;
    private FactoryLoader loader;
    private final InstanceProvider provider = mock(InstanceProvider.class);

    @BeforeEach
    void setUp() {
        registry = new TargetRegistry();
        loader = new FactoryLoader(registry, "babel.factories");
    }

    @Test
    @DisplayName("locations are nested, flat, then type-named")
    void locationOrder() {
        List<FactoryLoader.Location> locations = loader.locations("example.payment.OrderService");
        assertEquals(List.of(
                "babel.factories.example.PaymentFactories",
                "babel.factories.PaymentFactories",
                "babel.factories.OrderServiceFactory"),
                locations.stream().map(FactoryLoader.Location::className).toList());
    }

    @Test
    @DisplayName("single-segment modules have no nested location")
    void singleSegmentModule() {
        assertEquals(2, loader.locations("payments.OrderService").size());
    }

    @Test
    @DisplayName("function name is the lower camel type name")
    void functionName() {
        assertEquals("orderService", FactoryLoader.functionName("payments.OrderService"));
        assertEquals("httpClient", FactoryLoader.functionName("net.HTTPClient"));
    }

    @Test
    @DisplayName("explicit factory tables are consulted")
    void explicitTable() {
        Object built = new Object();
        registry.factories("babel.factories.InventoryFactories").factory("stockService", () -> built);

        Optional<Object> result = loader.create("inventory.StockService", provider,
                new DiagnosticContext("inventory.StockService"));

        assertSame(built, result.orElseThrow());
    }

    @Test
    @DisplayName("a factory returning null is skipped")
    void nullFactoryIsSkipped() {
        Object fallback = new Object();
        registry.factories("babel.factories.InventoryFactories").factory("stockService", () -> null);
        registry.factories("babel.factories.StockServiceFactory").factory("stockService", () -> fallback);
        var trail = new DiagnosticContext("inventory.StockService");

        assertSame(fallback, loader.create("inventory.StockService", provider, trail).orElseThrow());
        assertTrue(trail.searches().stream().anyMatch(s -> !s.found() && "factory returned null".equals(s.reason())));
    }

    @Test
    @DisplayName("a failing factory is a construction error")
    void failingFactory() {
        registry.factories("babel.factories.InventoryFactories").factory("stockService", () -> {
            throw new IllegalStateException("database down");
        });

        var e = assertThrows(ConstructionException.class, () -> loader.create("inventory.StockService",
                provider, new DiagnosticContext("inventory.StockService")));
        assertTrue(e.getMessage().contains("database down"));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    @DisplayName("no factory anywhere is empty, not an error")
    void noFactory() {
        var trail = new DiagnosticContext("inventory.StockService");
        assertTrue(loader.create("inventory.StockService", provider, trail).isEmpty());
        assertEquals(2, trail.searches().size());
    }
}
