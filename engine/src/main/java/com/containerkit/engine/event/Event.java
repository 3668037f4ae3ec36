package com.containerkit.engine.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable record of something that happened inside the engine.
 *
 * @param sessionId copied from {@code data["session_id"]} when present, else null
 */
public record Event(String id,
                   EventType type,
                   String source,
                   Map<String, Object> data,
                   Instant timestamp,
                   String sessionId) {

    public Event {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
