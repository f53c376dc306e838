package com.rebenew.listeningRooms.syncserver.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Destino lógico de un evento: {@code room:<id>}, {@code user:<id>} o {@code global}.
 */
public final class EventScope {

    public enum Kind {
        ROOM, USER, GLOBAL
    }

    private static final EventScope GLOBAL = new EventScope(Kind.GLOBAL, null);

    private final Kind kind;
    private final String target;

    private EventScope(Kind kind, String target) {
        this.kind = kind;
        this.target = target;
    }

    public static EventScope room(String roomId) {
        return new EventScope(Kind.ROOM, requireTarget(roomId, "roomId"));
    }

    public static EventScope user(String userId) {
        return new EventScope(Kind.USER, requireTarget(userId, "userId"));
    }

    public static EventScope global() {
        return GLOBAL;
    }

    // Acepta la forma textual del wire ("room:abc", "user:42", "global")
    public static EventScope parse(String value) {
        if (value == null || value.isBlank() || "global".equals(value.trim()))
            return GLOBAL;
        String trimmed = value.trim();
        if (trimmed.startsWith("room:"))
            return room(trimmed.substring("room:".length()));
        if (trimmed.startsWith("user:"))
            return user(trimmed.substring("user:".length()));
        throw new IllegalArgumentException("Scope inválido: " + value);
    }

    private static String requireTarget(String target, String name) {
        if (target == null || target.trim().isEmpty()) {
            throw new IllegalArgumentException(name + " no puede ser nulo o vacío");
        }
        return target;
    }

    public Kind getKind() {
        return kind;
    }

    public String getTarget() {
        return target;
    }

    public boolean isRoom() {
        return kind == Kind.ROOM;
    }

    @JsonValue
    @Override
    public String toString() {
        return kind == Kind.GLOBAL ? "global" : kind.name().toLowerCase() + ":" + target;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EventScope))
            return false;
        EventScope other = (EventScope) o;
        return kind == other.kind && Objects.equals(target, other.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, target);
    }
}
