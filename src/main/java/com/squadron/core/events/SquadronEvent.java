package com.squadron.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted as an orchestrator or allocator operation completes.
 *
 * @param eventType the kind of notification
 * @param scopeId   subscription key: the agent id for agent events, the repository name for git events
 * @param subjectId the process or allocation this event relates to (nullable)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record SquadronEvent(
    SquadronEventType eventType,
    String scopeId,
    String subjectId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static SquadronEvent of(SquadronEventType type, String scopeId, String subjectId,
                                   Map<String, Object> payload) {
        return new SquadronEvent(type, scopeId, subjectId, payload, Instant.now());
    }
}
