package com.github.salilvnair.convflow.engine.journal;

import java.util.Map;

/**
 * One entry of the turn journal. The payload stays mutable until the turn ends so that
 * the engine can record which control command a scenario produced.
 */
public record JournalEvent(
        String type,
        Map<String, Object> payload
) {

    public boolean is(JournalEventType eventType) {
        return eventType != null && eventType.value().equals(type);
    }
}
