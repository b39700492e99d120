package com.babeltest.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    // -- RunEvent record tests ------------------------------------------------

    @Nested
    @DisplayName("RunEvent")
    class RunEventTests {

        @Test
        @DisplayName("of stamps the current time")
        void ofStampsTime() {
            Instant before = Instant.now();
            var event = RunEvent.of(RunEvent.RUN_STARTED, "BT-1", null, Map.of("tests", 3));

            assertEquals("run.started", event.eventType());
            assertEquals("BT-1", event.runId());
            assertNull(event.suite());
            assertEquals(3, event.payload().get("tests"));
            assertFalse(event.timestamp().isBefore(before));
        }
    }

    // -- Subscribe and publish tests ------------------------------------------

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to run subscriber")
        void deliversEventToRunSubscriber() {
            List<RunEvent> received = new ArrayList<>();
            eventBus.subscribe("BT-1", received::add);

            var event = RunEvent.of(RunEvent.TEST_COMPLETED, "BT-1", "math", Map.of());
            eventBus.publish(event);

            assertEquals(1, received.size());
            assertEquals(event, received.get(0));
        }

        @Test
        @DisplayName("does not deliver event to subscribers of a different run")
        void doesNotDeliverToDifferentRun() {
            List<RunEvent> received = new ArrayList<>();
            eventBus.subscribe("BT-2", received::add);

            eventBus.publish(RunEvent.of(RunEvent.TEST_COMPLETED, "BT-1", null, Map.of()));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("a throwing subscriber does not stop delivery to others")
        void throwingSubscriberIsIsolated() {
            List<RunEvent> received = new ArrayList<>();
            eventBus.subscribe("BT-1", event -> {
                throw new IllegalStateException("subscriber bug");
            });
            eventBus.subscribe("BT-1", received::add);

            eventBus.publish(RunEvent.of(RunEvent.RUN_STARTED, "BT-1", null, Map.of()));

            assertEquals(1, received.size());
        }
    }

    // -- Global subscription tests --------------------------------------------

    @Nested
    @DisplayName("global subscription")
    class GlobalSubscriptionTests {

        @Test
        @DisplayName("global subscriber receives events from all runs")
        void globalSubscriberReceivesAllEvents() {
            List<RunEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(RunEvent.of(RunEvent.RUN_STARTED, "BT-1", null, Map.of()));
            eventBus.publish(RunEvent.of(RunEvent.RUN_STARTED, "BT-2", null, Map.of()));

            assertEquals(2, received.size());
            assertEquals("BT-1", received.get(0).runId());
            assertEquals("BT-2", received.get(1).runId());
        }
    }

    // -- Unsubscribe tests ----------------------------------------------------

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("unsubscribing stops delivery of future events")
        void unsubscribeStopsDelivery() {
            List<RunEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe("BT-1", received::add);

            eventBus.publish(RunEvent.of(RunEvent.SUITE_STARTED, "BT-1", "math", Map.of()));
            assertEquals(1, received.size());

            subscription.unsubscribe();

            eventBus.publish(RunEvent.of(RunEvent.SUITE_COMPLETED, "BT-1", "math", Map.of()));
            assertEquals(1, received.size()); // still 1, no new event
        }
    }
}
