package com.taskforest.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

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

    private static ReconstructionEvent event(String type, String runId) {
        return ReconstructionEvent.of(type, runId, null, Map.of());
    }

    @Nested
    @DisplayName("ReconstructionEvent")
    class ReconstructionEventTests {

        @Test
        @DisplayName("of() stamps the current time")
        void stampsTime() {
            Instant before = Instant.now();
            var e = ReconstructionEvent.of("edge.resolved", "TF-1", "T1", Map.of("prefixLength", 192));
            assertEquals("edge.resolved", e.eventType());
            assertEquals("TF-1", e.runId());
            assertEquals("T1", e.taskId());
            assertEquals(192, e.payload().get("prefixLength"));
            assertFalse(e.timestamp().isBefore(before));
        }
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublish {

        @Test
        @DisplayName("delivers events only to subscribers of the same run")
        void perRun() {
            List<ReconstructionEvent> run1 = new ArrayList<>();
            List<ReconstructionEvent> run2 = new ArrayList<>();
            eventBus.subscribe("TF-1", run1::add);
            eventBus.subscribe("TF-2", run2::add);

            eventBus.publish(event("run.started", "TF-1"));

            assertEquals(1, run1.size());
            assertTrue(run2.isEmpty());
        }

        @Test
        @DisplayName("global subscribers receive every run")
        void global() {
            List<ReconstructionEvent> all = new ArrayList<>();
            eventBus.subscribeAll(all::add);

            eventBus.publish(event("run.started", "TF-1"));
            eventBus.publish(event("run.started", "TF-2"));

            assertEquals(2, all.size());
        }

        @Test
        @DisplayName("unsubscribe stops delivery")
        void unsubscribe() {
            List<ReconstructionEvent> received = new ArrayList<>();
            var sub = eventBus.subscribe("TF-1", received::add);
            var global = eventBus.subscribeAll(received::add);

            sub.unsubscribe();
            global.unsubscribe();
            eventBus.publish(event("run.started", "TF-1"));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("a throwing subscriber does not stop the others")
        void isolation() {
            List<ReconstructionEvent> received = new ArrayList<>();
            eventBus.subscribe("TF-1", e -> {
                throw new RuntimeException("subscriber failure");
            });
            eventBus.subscribe("TF-1", received::add);

            assertDoesNotThrow(() -> eventBus.publish(event("run.started", "TF-1")));
            assertEquals(1, received.size());
        }
    }

    @Nested
    @DisplayName("typed subscriptions")
    class TypedSubscriptions {

        @Test
        @DisplayName("a family wildcard matches every type of that family only")
        void familyWildcard() {
            List<String> received = new ArrayList<>();
            eventBus.subscribeTypes(List.of("edge.*"), e -> received.add(e.eventType()));

            eventBus.publish(event("edge.resolved", "TF-1"));
            eventBus.publish(event("edge.invalidated", "TF-2"));
            eventBus.publish(event("match.rejected", "TF-1"));
            eventBus.publish(event("edgewise", "TF-1"));

            assertEquals(List.of("edge.resolved", "edge.invalidated"), received);
        }

        @Test
        @DisplayName("exact types and wildcards combine")
        void exactAndWildcard() {
            List<String> received = new ArrayList<>();
            var sub = eventBus.subscribeTypes(List.of("match.*", "skeleton.unresolved"), e -> received.add(e.eventType()));

            eventBus.publish(event("match.ambiguous", "TF-1"));
            eventBus.publish(event("skeleton.unresolved", "TF-1"));
            eventBus.publish(event("run.completed", "TF-1"));
            sub.unsubscribe();
            eventBus.publish(event("match.rejected", "TF-1"));

            assertEquals(List.of("match.ambiguous", "skeleton.unresolved"), received);
        }

        @Test
        @DisplayName("at least one pattern is required")
        void emptyPatterns() {
            assertThrows(IllegalArgumentException.class, () -> eventBus.subscribeTypes(List.of(), e -> { }));
        }
    }

    @Test
    @DisplayName("concurrent publishers lose no events")
    void concurrentPublish() throws InterruptedException {
        List<ReconstructionEvent> received = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(received::add);
        int threads = 8;
        var done = new CountDownLatch(threads);
        for (int t = 0; t < threads; t++) {
            new Thread(() -> {
                for (int i = 0; i < 100; i++) {
                    eventBus.publish(event("edge.resolved", "TF-1"));
                }
                done.countDown();
            }).start();
        }
        assertTrue(done.await(10, TimeUnit.SECONDS));
        assertEquals(800, received.size());
    }
}
