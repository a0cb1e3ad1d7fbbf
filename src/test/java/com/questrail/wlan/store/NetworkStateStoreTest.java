package com.questrail.wlan.store;

import com.questrail.wlan.api.AccessPoint;
import com.questrail.wlan.api.UnknownAccessPointException;
import com.questrail.wlan.observability.AccessPointRegisteredEvent;
import com.questrail.wlan.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link NetworkStateStore}.
 */
class NetworkStateStoreTest {

    private RecordingObservabilitySink sink;
    private NetworkStateStore store;

    @BeforeEach
    void setUp() {
        sink = new RecordingObservabilitySink();
        store = new NetworkStateStore(sink);
    }

    @Test
    void addThenGetReturnsTheRecord() {
        AccessPoint ap = AccessPoint.of("AP-001", 6, 20);
        store.add(ap);

        assertEquals(ap, store.get("AP-001"));
        assertEquals(1, store.size());
        assertEquals(Set.of("AP-001"), store.ids());
    }

    @Test
    void addReplacesExistingRecord() {
        store.add(AccessPoint.restored("AP-001", 6, 20, 500));
        store.add(AccessPoint.of("AP-001", 11, 17));

        AccessPoint stored = store.get("AP-001");
        assertEquals(11, stored.channel());
        assertEquals(17, stored.powerDb());
        assertEquals(-241, stored.lastChangeTimeMinutes());
        assertEquals(1, store.size());
    }

    @Test
    void addPerformsNoRangeValidation() {
        store.add(AccessPoint.of("odd", -5, 999));

        assertEquals(-5, store.get("odd").channel());
    }

    @Test
    void addEmitsRegistrationEvent() {
        AccessPoint first = AccessPoint.of("AP-001", 6, 20);
        AccessPoint second = first.withChannel(1);

        store.add(first);
        store.add(second);

        List<AccessPointRegisteredEvent> events = sink.eventsOfType(AccessPointRegisteredEvent.class);
        assertEquals(2, events.size());
        assertFalse(events.get(0).isReplacement());
        assertEquals(first, events.get(0).accessPoint());
        assertTrue(events.get(1).isReplacement());
        assertEquals(first, events.get(1).replaced().orElseThrow());
    }

    @Test
    void getUnknownIdThrows() {
        UnknownAccessPointException e =
                assertThrows(UnknownAccessPointException.class, () -> store.get("nope"));
        assertEquals("nope", e.accessPointId());
    }

    @Test
    void findUnknownIdIsEmpty() {
        assertTrue(store.find("nope").isEmpty());
    }

    @Test
    void modifyStoresUpdatedRecordAndReturnsOutcome() {
        store.add(AccessPoint.of("AP-001", 6, 20));

        String outcome = store.modify("AP-001",
                ap -> new NetworkStateStore.Modification<>(ap.withChannel(11), "done"));

        assertEquals("done", outcome);
        assertEquals(11, store.get("AP-001").channel());
    }

    @Test
    void modifyUnknownIdThrowsAndInsertsNothing() {
        assertThrows(UnknownAccessPointException.class, () -> store.modify("ghost",
                ap -> new NetworkStateStore.Modification<>(ap, null)));

        assertTrue(store.find("ghost").isEmpty());
        assertEquals(0, store.size());
    }

    @Test
    void modifyMayNotChangeTheRecordId() {
        store.add(AccessPoint.of("AP-001", 6, 20));

        assertThrows(IllegalStateException.class, () -> store.modify("AP-001",
                ap -> new NetworkStateStore.Modification<>(AccessPoint.of("AP-002", 6, 20), null)));

        assertEquals(6, store.get("AP-001").channel());
        assertTrue(store.find("AP-002").isEmpty());
    }

    @Test
    void modifyDoesNotEmitRegistrationEvents() {
        store.add(AccessPoint.of("AP-001", 6, 20));
        sink.clear();

        store.modify("AP-001", ap -> new NetworkStateStore.Modification<>(ap.withPowerDb(23), null));

        assertFalse(sink.hasEventOfType(AccessPointRegisteredEvent.class));
    }

    @Test
    void modifyReevaluatesWhenRecordChangesBeforeCommit() {
        store.add(AccessPoint.restored("AP-001", 6, 20, 0));
        AtomicInteger calls = new AtomicInteger();

        String outcome = store.modify("AP-001", ap -> {
            if (calls.incrementAndGet() == 1) {
                // a concurrent writer lands between read and commit
                store.add(AccessPoint.restored("AP-001", 1, 17, 50));
            }
            return new NetworkStateStore.Modification<>(ap.withPowerDb(ap.powerDb() + 5), "ch" + ap.channel());
        });

        assertEquals(2, calls.get());
        assertEquals("ch1", outcome);
        assertEquals(AccessPoint.restored("AP-001", 1, 22, 50), store.get("AP-001"));
    }

    @Test
    void modifyReturningSameRecordLeavesStoreUntouched() {
        AccessPoint original = AccessPoint.restored("AP-001", 6, 20, 0);
        store.add(original);

        Boolean outcome = store.modify("AP-001", ap -> new NetworkStateStore.Modification<>(ap, Boolean.TRUE));

        assertTrue(outcome);
        assertSame(original, store.get("AP-001"));
    }

    @Test
    void exposesItsObservabilitySink() {
        assertSame(sink, store.observabilitySink());
    }
}
