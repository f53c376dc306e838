package com.rebenew.listeningRooms.syncserver.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Identidad devuelta por el validador de tokens.
 */
public record AuthPrincipal(String userId, String displayName) implements EventSubject {

    public AuthPrincipal {
        if (userId == null || userId.trim().isEmpty()) {
            throw new IllegalArgumentException("userId no puede ser nulo o vacío");
        }
        if (displayName == null || displayName.isBlank()) {
            displayName = userId;
        }
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
        return summary;
    }
}
