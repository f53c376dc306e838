package com.rebenew.listeningRooms.syncserver.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Vocabulario cerrado de eventos que el servidor emite hacia las conexiones.
 */
public enum EventType {
    // Usuarios
    USER_JOINED("user_joined"),
    USER_LEFT("user_left"),
    USER_CONNECTED("user_connected"),
    USER_DISCONNECTED("user_disconnected"),

    // Cola de tracks
    TRACK_ADDED("track_added"),
    TRACK_VOTED("track_voted"),
    TRACK_UNVOTED("track_unvoted"),
    QUEUE_REORDERED("queue_reordered"),

    // Reproducción
    PLAYBACK_STARTED("playback_started"),
    PLAYBACK_PAUSED("playback_paused"),
    PLAYBACK_RESUMED("playback_resumed"),
    PLAYBACK_STOPPED("playback_stopped"),
    PLAYBACK_SEEKED("playback_seeked"),
    TRACK_SKIPPED("track_skipped"),

    // Sala / sistema
    ROOM_STATE_UPDATED("room_state_updated"),
    ERROR("error");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static Optional<EventType> fromWireName(String wireName) {
        if (wireName == null)
            return Optional.empty();
        return Arrays.stream(values())
                .filter(t -> t.wireName.equalsIgnoreCase(wireName.trim()))
                .findFirst();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
