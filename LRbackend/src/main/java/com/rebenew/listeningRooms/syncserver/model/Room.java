package com.rebenew.listeningRooms.syncserver.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sala de escucha: directorio de participantes y reloj de inactividad.
 * Solo RoomManager la muta. Cada mutación incrementa {@link #getVersion()}, que es lo que
 * invalida el snapshot cacheado.
 */
public class Room {
    // IDENTIFICACIÓN
    private final String roomId;
    private final String ownerId;
    private final String name;
    private final Instant createdAt;

    // PARTICIPANTES (orden de llegada para mostrar)
    private final Map<String, Participant> participants = new LinkedHashMap<>();

    // ESTADO
    private RoomState state;
    private Instant lastNonEmptyAt;
    private long version;

    public Room(String roomId, String ownerId, String name, Instant createdAt) {
        if (roomId == null || roomId.trim().isEmpty()) {
            throw new IllegalArgumentException("roomId no puede ser nulo o vacío");
        }
        this.roomId = roomId;
        this.ownerId = ownerId;
        this.name = name != null && !name.isBlank() ? name.trim() : roomId;
        this.createdAt = createdAt;
        // una sala recién creada está vacía: el TTL cuenta desde su creación
        this.lastNonEmptyAt = createdAt;
        this.state = RoomState.IDLE;
    }

    // ========== PARTICIPANTES ==========
    public synchronized boolean addParticipant(Participant participant) {
        ensureNotDestroyed();
        if (participants.containsKey(participant.userId()))
            return false;
        participants.put(participant.userId(), participant);
        state = RoomState.ACTIVE;
        version++;
        return true;
    }

    public synchronized boolean removeParticipant(String userId, Instant now) {
        if (participants.remove(userId) == null)
            return false;
        if (participants.isEmpty() && state == RoomState.ACTIVE) {
            state = RoomState.IDLE;
            lastNonEmptyAt = now;
        }
        version++;
        return true;
    }

    public synchronized Participant getParticipant(String userId) {
        return participants.get(userId);
    }

    public synchronized boolean hasParticipant(String userId) {
        return participants.containsKey(userId);
    }

    public synchronized List<Participant> getParticipants() {
        return new ArrayList<>(participants.values());
    }

    public synchronized int getParticipantCount() {
        return participants.size();
    }

    // Cambios de cola/reproducción hechos fuera (repositorio) también invalidan el snapshot
    public synchronized void markChanged() {
        version++;
    }

    // ========== CICLO DE VIDA ==========
    public synchronized boolean isIdleLongerThan(Duration ttl, Instant now) {
        return state == RoomState.IDLE && lastNonEmptyAt.plus(ttl).isBefore(now);
    }

    public synchronized void markDestroyed() {
        state = RoomState.DESTROYED;
        participants.clear();
        version++;
    }

    public synchronized boolean isDestroyed() {
        return state == RoomState.DESTROYED;
    }

    private void ensureNotDestroyed() {
        if (state == RoomState.DESTROYED) {
            throw new IllegalStateException("La sala fue destruida: " + roomId);
        }
    }

    // ========== GETTERS ==========
    public String getRoomId() {
        return roomId;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public String getName() {
        return name;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized RoomState getState() {
        return state;
    }

    public synchronized Instant getLastNonEmptyAt() {
        return lastNonEmptyAt;
    }

    public synchronized long getVersion() {
        return version;
    }
}
