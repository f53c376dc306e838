package com.rebenew.listeningRooms.syncserver.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Evento tipado tal como viaja por el wire:
 * {@code { event_id, type, scope, priority, payload, timestamp }}.
 * Cada conexión destino recibe su propia instancia con su propio id.
 */
@Getter
@JsonPropertyOrder({"event_id", "type", "scope", "priority", "payload", "timestamp"})
public class BroadcastEvent {

    @JsonProperty("event_id")
    private final String eventId;
    private final EventType type;
    private final EventScope scope;
    private final EventPriority priority;
    private final Map<String, Object> payload;
    private final long timestamp;

    @JsonIgnore
    private final Instant createdAt;
    @JsonIgnore
    private final Instant deliveryDeadline;

    private BroadcastEvent(String eventId, EventType type, EventScope scope, EventPriority priority,
            Map<String, Object> payload, Instant createdAt, Instant deliveryDeadline) {
        this.eventId = eventId;
        this.type = type;
        this.scope = scope;
        this.priority = priority;
        this.payload = payload;
        this.createdAt = createdAt;
        this.timestamp = createdAt.toEpochMilli();
        this.deliveryDeadline = deliveryDeadline;
    }

    public static BroadcastEvent create(EventType type, EventScope scope, EventPriority priority,
            Map<String, Object> payload, Instant now, Duration retention) {
        if (type == null || scope == null) {
            throw new IllegalArgumentException("type y scope son obligatorios");
        }
        Map<String, Object> copy = payload != null ? new LinkedHashMap<>(payload) : new LinkedHashMap<>();
        return new BroadcastEvent(newEventId(), type, scope,
                priority != null ? priority : EventPriority.NORMAL,
                Collections.unmodifiableMap(copy), now, now.plus(retention));
    }

    private static String newEventId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    @Override
    public String toString() {
        return String.format("BroadcastEvent{id='%s', type='%s', scope='%s', priority='%s'}",
                eventId, type, scope, priority.getWireName());
    }
}
