package com.rebenew.listeningRooms.syncserver.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Usuario unido a una sala.
 */
public record Participant(String userId, String displayName, Instant joinedAt) implements EventSubject {

    public Participant {
        if (userId == null || userId.trim().isEmpty()) {
            throw new IllegalArgumentException("userId no puede ser nulo o vacío");
        }
        if (displayName == null || displayName.isBlank()) {
            displayName = userId;
        }
    }

    public static Participant of(String userId, Instant joinedAt) {
        return new Participant(userId, userId, joinedAt);
    }

    @JsonIgnore
    @Override
    public String getId() {
        return userId;
    }

    @Override
    public String displayLabel() {
        return displayName;
    }

    @Override
    public Map<String, Object> toSummary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("userId", userId);
        summary.put("displayName", displayName);
        if (joinedAt != null)
            summary.put("joinedAt", joinedAt.toEpochMilli());
        return summary;
    }
}
