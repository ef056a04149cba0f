package com.pawpal.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventJournalTest {

    private EventBus eventBus;
    private EventJournal journal;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        journal = new EventJournal(eventBus);
    }

    @Test
    @DisplayName("records published events per owner, oldest first")
    void recordsPerOwner() {
        eventBus.publish(PawPalEvent.of("plan.generated", "O-1", null, Map.of("accepted", 2)));
        eventBus.publish(PawPalEvent.of("task.completed", "O-2", "walk", Map.of()));
        eventBus.publish(PawPalEvent.of("conflicts.detected", "O-1", null, Map.of("count", 0)));

        var events = journal.eventsFor("O-1");
        assertEquals(2, events.size());
        assertEquals("plan.generated", events.get(0).eventType());
        assertEquals("conflicts.detected", events.get(1).eventType());
        assertEquals(1, journal.eventsFor("O-2").size());
        assertTrue(journal.eventsFor("O-3").isEmpty());
    }

    @Test
    @DisplayName("keeps only the most recent events of an owner")
    void bounded() {
        for (int i = 0; i < EventJournal.CAPACITY_PER_OWNER + 5; i++) {
            eventBus.publish(PawPalEvent.of("task.completed", "O-1", "T-" + i, Map.of()));
        }

        var events = journal.eventsFor("O-1");
        assertEquals(EventJournal.CAPACITY_PER_OWNER, events.size());
        assertEquals("T-5", events.get(0).taskId());
    }

    @Test
    @DisplayName("describes an event with its task and payload sorted by key")
    void describe() {
        var recurred = PawPalEvent.of("task.recurred", "O-1", "T-2",
                Map.of("previousTaskId", "T-1", "dueDate", "2026-02-16"));
        assertEquals("task.recurred task=T-2 dueDate=2026-02-16 previousTaskId=T-1",
                EventJournal.describe(recurred));
        assertEquals("conflicts.detected",
                EventJournal.describe(PawPalEvent.of("conflicts.detected", "O-1", null, Map.of())));
    }

    @Test
    @DisplayName("returned lists are snapshots")
    void snapshot() {
        eventBus.publish(PawPalEvent.of("plan.generated", "O-1", null, Map.of()));
        var before = journal.eventsFor("O-1");

        eventBus.publish(PawPalEvent.of("plan.generated", "O-1", null, Map.of()));

        assertEquals(1, before.size());
        assertThrows(UnsupportedOperationException.class, () -> before.add(before.get(0)));
    }
}
