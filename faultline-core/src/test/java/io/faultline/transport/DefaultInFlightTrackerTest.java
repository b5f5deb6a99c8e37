package io.faultline.transport;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultInFlightTrackerTest {

    @Test
    void beginAndEndTrackPending() {
        DefaultInFlightTracker tracker = new DefaultInFlightTracker();

        tracker.begin("event-1");
        tracker.begin("event-2");
        assertEquals(2, tracker.pending());
        assertTrue(tracker.isInFlight("event-1"));

        tracker.end("event-1");
        assertEquals(1, tracker.pending());
        assertFalse(tracker.isInFlight("event-1"));
    }

    @Test
    void sameIdNeedsOneEndPerBegin() {
        DefaultInFlightTracker tracker = new DefaultInFlightTracker();

        tracker.begin("event-1");
        tracker.begin("event-1");
        tracker.end("event-1");

        assertTrue(tracker.isInFlight("event-1"));
        assertEquals(1, tracker.pending());

        tracker.end("event-1");
        assertEquals(0, tracker.pending());
    }

    @Test
    void endOfUnknownIdIsNoOp() {
        DefaultInFlightTracker tracker = new DefaultInFlightTracker();

        tracker.end("non-existent");

        assertEquals(0, tracker.pending());
    }

    @Test
    void awaitDrainedReturnsAtOnceWhenIdle() throws InterruptedException {
        assertTrue(new DefaultInFlightTracker().awaitDrained(0));
    }

    @Test
    void awaitDrainedTimesOut() throws InterruptedException {
        DefaultInFlightTracker tracker = new DefaultInFlightTracker();
        tracker.begin("event-1");

        assertFalse(tracker.awaitDrained(30));
    }

    @Test
    void awaitDrainedWakesWhenLastEventEnds() throws Exception {
        DefaultInFlightTracker tracker = new DefaultInFlightTracker();
        tracker.begin("event-1");

        CompletableFuture<Boolean> drained = CompletableFuture.supplyAsync(() -> {
            try {
                return tracker.awaitDrained(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        });
        Thread.sleep(50);
        tracker.end("event-1");

        assertTrue(drained.get(5, TimeUnit.SECONDS));
    }
}
