package com.rebenew.listeningRooms.syncserver.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Representa una canción en la cola de una sala.
 * voteScore lo mantiene el repositorio externo; aquí solo se transporta.
 */
public record TrackEntry(
        String trackId,
        String title,
        String addedBy,
        long addedAt,
        long durationMs,  // duración en milisegundos, 0 = desconocida
        int voteScore
) implements EventSubject {
    public TrackEntry {
        if (trackId == null || trackId.trim().isEmpty()) {
            throw new IllegalArgumentException("trackId no puede ser nulo o vacío");
        }
        if (addedBy == null || addedBy.trim().isEmpty()) {
            throw new IllegalArgumentException("addedBy no puede ser nulo o vacío");
        }
        if (title == null || title.isBlank()) {
            title = "Unknown Track";
        }
        if (addedAt <= 0) {
            addedAt = System.currentTimeMillis();
        }
        if (durationMs < 0) {
            durationMs = 0L; // no permitimos negativos
        }
    }

    public TrackEntry(String trackId, String title, String addedBy, long addedAt) {
        this(trackId, title, addedBy, addedAt, 0L, 0);
    }

    public TrackEntry withVoteScore(int newScore) {
        return new TrackEntry(trackId, title, addedBy, addedAt, durationMs, newScore);
    }

    @JsonIgnore
    @Override
    public String getId() {
        return trackId;
    }

    @Override
    public String displayLabel() {
        return title;
    }

    @Override
    public Map<String, Object> toSummary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("trackId", trackId);
        summary.put("title", title);
        summary.put("addedBy", addedBy);
        summary.put("addedAt", addedAt);
        summary.put("durationMs", durationMs);
        summary.put("voteScore", voteScore);
        return summary;
    }
}
