package com.rebenew.listeningRooms.syncserver.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Estado de reproducción ligero tal como lo guarda el repositorio.
 * Solo contiene información necesaria para sync, no duplica estado.
 */
public class PlaybackState {
    private final String currentTrackId;
    private final String currentTrackTitle;
    private final boolean isPlaying;
    private final Long startedAt; // epoch ms, null si nunca arrancó
    private final Long pausedAt;  // epoch ms, null si no está en pausa

    public PlaybackState(String currentTrackId, String currentTrackTitle,
                         boolean isPlaying, Long startedAt, Long pausedAt) {
        this.currentTrackId = currentTrackId;
        this.currentTrackTitle = currentTrackTitle;
        this.isPlaying = isPlaying;
        this.startedAt = startedAt;
        this.pausedAt = pausedAt;
    }

    public static PlaybackState idle() {
        return new PlaybackState(null, null, false, null, null);
    }

    // Posición actual calculada contra "now" (mismo criterio que los clientes)
    public long positionAt(long nowMs) {
        if (startedAt == null)
            return 0L;
        if (isPlaying)
            return Math.max(0L, nowMs - startedAt);
        if (pausedAt != null)
            return Math.max(0L, pausedAt - startedAt);
        return 0L;
    }

    public Map<String, Object> toSummary(long nowMs) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("currentTrackId", currentTrackId);
        summary.put("currentTrackTitle", currentTrackTitle);
        summary.put("isPlaying", isPlaying);
        summary.put("startedAt", startedAt);
        summary.put("pausedAt", pausedAt);
        summary.put("positionMs", positionAt(nowMs));
        return summary;
    }

    // Getters (sin setters para inmutabilidad)
    public String getCurrentTrackId() { return currentTrackId; }
    public String getCurrentTrackTitle() { return currentTrackTitle; }
    public boolean isPlaying() { return isPlaying; }
    public Long getStartedAt() { return startedAt; }
    public Long getPausedAt() { return pausedAt; }
}
