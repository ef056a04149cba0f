package com.pawpal.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Keeps the most recent events of each owner and logs every event it sees.
 * <p>
 * Backs {@code pawpal plan --verbose}, which prints what the planner and the
 * conflict detector reported for the loaded owner.
 */
@Component
public class EventJournal {

    private static final Logger log = LoggerFactory.getLogger(EventJournal.class);

    static final int CAPACITY_PER_OWNER = 100;

    private final ConcurrentHashMap<String, Deque<PawPalEvent>> byOwner = new ConcurrentHashMap<>();

    public EventJournal(EventBus eventBus) {
        eventBus.subscribeAll(this::record);
    }

    void record(PawPalEvent event) {
        log.debug("[{}] {}", event.ownerId(), describe(event));
        if (event.ownerId() == null) {
            return;
        }
        Deque<PawPalEvent> events = byOwner.computeIfAbsent(event.ownerId(), k -> new ArrayDeque<>());
        synchronized (events) {
            events.addLast(event);
            if (events.size() > CAPACITY_PER_OWNER) {
                events.removeFirst();
            }
        }
    }

    /** Oldest first. Empty for an owner with no events. */
    public List<PawPalEvent> eventsFor(String ownerId) {
        Deque<PawPalEvent> events = byOwner.get(ownerId);
        if (events == null) {
            return List.of();
        }
        synchronized (events) {
            return List.copyOf(events);
        }
    }

    /**
     * One line: event type, task id when present, then the payload sorted by key,
     * e.g. {@code plan.generated accepted=3 date=2026-02-15 rejected=1 totalMinutes=50}.
     */
    public static String describe(PawPalEvent event) {
        var sb = new StringBuilder(event.eventType());
        if (event.taskId() != null) {
            sb.append(" task=").append(event.taskId());
        }
        Map<String, Object> payload = event.payload() != null ? event.payload() : Map.of();
        if (!payload.isEmpty()) {
            sb.append(' ').append(new TreeMap<>(payload).entrySet().stream()
                    .map(e -> e.getKey() + "=" + e.getValue())
                    .collect(Collectors.joining(" ")));
        }
        return sb.toString();
    }
}
