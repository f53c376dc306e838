package com.rebenew.listeningRooms.syncserver.core;

import com.rebenew.listeningRooms.syncserver.core.EventBroadcaster.UserActivity;
import com.rebenew.listeningRooms.syncserver.exception.AlreadyExistsException;
import com.rebenew.listeningRooms.syncserver.exception.AuthException;
import com.rebenew.listeningRooms.syncserver.exception.ConnectionNotFoundException;
import com.rebenew.listeningRooms.syncserver.exception.RoomNotFoundException;
import com.rebenew.listeningRooms.syncserver.model.*;
import com.rebenew.listeningRooms.syncserver.repository.RoomRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

// Directorio de salas: membresía, snapshots cacheados y limpieza de salas vacías.

public class RoomManager {
    private static final Logger logger = LoggerFactory.getLogger(RoomManager.class);
    private static final int USER_LOCK_STRIPES = 64;

    // ============================
    // ESTADO PRINCIPAL
    // ============================
    private final ConcurrentHashMap<String, Room> rooms = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, RoomStateSnapshot> snapshotCache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> roomByUser = new ConcurrentHashMap<>();
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    // Serializa los cambios de sala de un mismo usuario; se toma siempre antes que el monitor de la sala
    private final Object[] userLocks = new Object[USER_LOCK_STRIPES];

    private final ConnectionRegistry registry;
    private final EventBroadcaster broadcaster;
    private final RoomRepository repository;
    private final Clock clock;
    private final Duration snapshotTtl;

    public RoomManager(ConnectionRegistry registry, EventBroadcaster broadcaster, RoomRepository repository,
            Clock clock, Duration snapshotTtl) {
        this.registry = registry;
        this.broadcaster = broadcaster;
        this.repository = repository;
        this.clock = clock;
        this.snapshotTtl = snapshotTtl;
        for (int i = 0; i < userLocks.length; i++) {
            userLocks[i] = new Object();
        }
        logger.info("RoomManager inicializado (snapshotTtl={})", snapshotTtl);
    }

    // ====================
    // CREACIÓN DE SALAS
    // ====================

    /**
     * Crea una sala vacía. El dueño no queda unido automáticamente.
     *
     * @throws AlreadyExistsException si el roomId pedido ya está en uso
     */
    public String createRoom(String ownerId, RoomConfig config) {
        validateUserId(ownerId);
        ensureRunning();
        Instant now = clock.instant();
        String name = config != null ? config.getName() : null;
        String requestedId = config != null ? config.getRoomId() : null;

        Room room;
        if (requestedId != null && !requestedId.isBlank()) {
            room = new Room(requestedId.trim(), ownerId, name, now);
            if (rooms.putIfAbsent(room.getRoomId(), room) != null) {
                logger.warn("Intento de crear sala existente: {}", room.getRoomId());
                throw new AlreadyExistsException(room.getRoomId());
            }
        } else {
            do {
                room = new Room(newRoomId(), ownerId, name, now);
            } while (rooms.putIfAbsent(room.getRoomId(), room) != null);
        }

        logger.info("🎵 Sala creada: {} ('{}') por {}", room.getRoomId(), room.getName(), ownerId);
        return room.getRoomId();
    }

    private static String newRoomId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    // ====================
    // MEMBRESÍA
    // ====================
    public boolean joinRoom(String roomId, String userId) {
        validateUserId(userId);
        return joinRoom(roomId, Participant.of(userId, clock.instant()));
    }

    /**
     * Une al usuario a la sala. Es idempotente: si ya estaba, no cambia nada ni emite eventos.
     * Un usuario solo pertenece a una sala; si estaba en otra, primero sale de ella.
     *
     * @return true si el usuario se agregó en esta llamada
     */
    public boolean joinRoom(String roomId, Participant participant) {
        ensureRunning();
        String userId = participant.userId();
        Room room = requireRoom(roomId);

        List<Participant> participants;
        synchronized (userLock(userId)) {
            String previousRoom = roomByUser.get(userId);
            if (previousRoom != null && !previousRoom.equals(roomId)) {
                leavePreviousRoom(previousRoom, userId);
            }

            synchronized (room) {
                if (room.isDestroyed()) {
                    throw new RoomNotFoundException(roomId);
                }
                if (!room.addParticipant(participant)) {
                    logger.debug("Usuario {} ya estaba en sala {}", userId, roomId);
                    return false;
                }
                roomByUser.put(userId, roomId);
                snapshotCache.remove(roomId);
                participants = room.getParticipants();
            }
        }

        logger.info("👤 Usuario {} unido a sala {} ({} participantes)", userId, roomId, participants.size());
        broadcaster.userActivity(roomId, UserActivity.JOINED, participant, membershipExtra(participants));
        return true;
    }

    private Object userLock(String userId) {
        return userLocks[Math.floorMod(userId.hashCode(), userLocks.length)];
    }

    private void leavePreviousRoom(String previousRoom, String userId) {
        try {
            leaveRoom(previousRoom, userId);
        } catch (RoomNotFoundException e) {
            logger.debug("Sala previa {} de {} ya no existe", previousRoom, userId);
            roomByUser.remove(userId, previousRoom);
        }
    }

    /**
     * Saca al usuario de la sala y desasocia su conexión. No hace nada si no era participante.
     *
     * @throws RoomNotFoundException si la sala no existe
     */
    public boolean leaveRoom(String roomId, String userId) {
        Room room = requireRoom(roomId);
        Departure departure = removeMember(room, userId);
        if (departure == null)
            return false;

        detachUserConnection(userId, roomId);
        logger.info("👋 Usuario {} salió de sala {}", userId, roomId);
        broadcaster.userActivity(roomId, UserActivity.LEFT, departure.participant, membershipExtra(departure.remaining));
        return true;
    }

    /**
     * Saca al usuario de su sala actual tras perder la conexión.
     * Emite user_left y user_disconnected a quienes quedan.
     *
     * @return false si el usuario no estaba en ninguna sala
     */
    public boolean handleUserDisconnect(String userId) {
        if (userId == null)
            return false;
        String roomId = roomByUser.get(userId);
        if (roomId == null)
            return false;
        Room room = rooms.get(roomId);
        if (room == null) {
            roomByUser.remove(userId, roomId);
            return false;
        }
        Departure departure = removeMember(room, userId);
        if (departure == null)
            return false;

        detachUserConnection(userId, roomId);
        logger.info("🔌 Usuario {} desconectado de sala {}", userId, roomId);
        Map<String, Object> extra = membershipExtra(departure.remaining);
        broadcaster.userActivity(roomId, UserActivity.LEFT, departure.participant, extra);
        broadcaster.userActivity(roomId, UserActivity.DISCONNECTED, departure.participant, extra);
        return true;
    }

    private Departure removeMember(Room room, String userId) {
        synchronized (room) {
            if (room.isDestroyed()) {
                throw new RoomNotFoundException(room.getRoomId());
            }
            Participant participant = room.getParticipant(userId);
            if (participant == null || !room.removeParticipant(userId, clock.instant())) {
                roomByUser.remove(userId, room.getRoomId());
                return null;
            }
            roomByUser.remove(userId, room.getRoomId());
            snapshotCache.remove(room.getRoomId());
            return new Departure(participant, room.getParticipants());
        }
    }

    private void detachUserConnection(String userId, String roomId) {
        registry.connectionFor(userId)
                .flatMap(registry::find)
                .filter(c -> roomId.equals(c.getRoomId()))
                .ifPresent(c -> {
                    try {
                        registry.leaveRoom(c.getConnectionId());
                    } catch (ConnectionNotFoundException e) {
                        logger.debug("Conexión {} ya no existe", c.getConnectionId());
                    }
                });
    }

    private static Map<String, Object> membershipExtra(List<Participant> participants) {
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("participantCount", participants.size());
        extra.put("participants", participants.stream().map(Participant::getId).collect(Collectors.toList()));
        return extra;
    }

    private static final class Departure {
        final Participant participant;
        final List<Participant> remaining;

        Departure(Participant participant, List<Participant> remaining) {
            this.participant = participant;
            this.remaining = remaining;
        }
    }

    // ====================
    // CONEXIONES
    // ====================

    /**
     * Asocia una conexión autenticada a la sala: une al usuario si hacía falta, registra la
     * conexión en la sala y anuncia user_connected.
     */
    public RoomStateSnapshot attachConnection(String connectionId, String roomId) {
        Connection connection = registry.find(connectionId)
                .orElseThrow(() -> new ConnectionNotFoundException(connectionId));
        if (!connection.isAuthenticated()) {
            throw new AuthException("La conexión no está autenticada");
        }
        AuthPrincipal principal = connection.getPrincipal();
        requireRoom(roomId);

        joinRoom(roomId, new Participant(principal.userId(), principal.displayName(), clock.instant()));
        registry.joinRoom(connectionId, roomId);

        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("liveConnections", registry.connectionsFor(roomId).size());
        broadcaster.userActivity(roomId, UserActivity.CONNECTED, principal, extra);
        return getRoomState(roomId);
    }

    // Salida voluntaria desde la conexión; devuelve la sala abandonada
    public Optional<String> detachConnection(String connectionId) {
        Connection connection = registry.find(connectionId)
                .orElseThrow(() -> new ConnectionNotFoundException(connectionId));
        Optional<String> roomId = registry.leaveRoom(connectionId);
        if (roomId.isPresent() && connection.isAuthenticated()) {
            try {
                leaveRoom(roomId.get(), connection.getUserId());
            } catch (RoomNotFoundException e) {
                logger.debug("Sala {} ya no existe al salir {}", roomId.get(), connection.getUserId());
            }
        }
        return roomId;
    }

    // El transporte se cerró: se da de baja la conexión y, si era la última del usuario, el usuario sale
    public void handleConnectionClosed(String connectionId) {
        registry.unregister(connectionId).ifPresent(this::propagateDeparture);
    }

    public int sweepStaleConnections(Duration timeout) {
        List<Connection> stale = registry.sweepStale(timeout);
        stale.forEach(this::propagateDeparture);
        return stale.size();
    }

    public int reapUnauthenticated(Duration grace) {
        return registry.reapUnauthenticated(grace).size();
    }

    private void propagateDeparture(Connection connection) {
        String userId = connection.getUserId();
        if (userId == null)
            return;
        if (registry.connectionFor(userId).isPresent()) {
            logger.debug("Usuario {} sigue conectado por otra conexión", userId);
            return;
        }
        try {
            handleUserDisconnect(userId);
        } catch (RoomNotFoundException e) {
            logger.debug("Sala de {} destruida durante la desconexión", userId);
        }
    }

    // ====================
    // ESTADO DE SALA
    // ====================

    /**
     * Devuelve el snapshot de la sala. Se reutiliza el cacheado mientras su versión coincida con
     * la de la sala y no supere el TTL; si no, se recalcula sin bloquear la sala durante la lectura
     * del repositorio.
     */
    public RoomStateSnapshot getRoomState(String roomId) {
        Room room = requireRoom(roomId);
        Instant now = clock.instant();

        RoomStateSnapshot cached = snapshotCache.get(roomId);
        if (cached != null && cached.isCurrentFor(room.getVersion()) && !cached.isOlderThan(snapshotTtl, now)) {
            return cached;
        }

        List<Participant> participants;
        RoomState state;
        long version;
        synchronized (room) {
            if (room.isDestroyed()) {
                throw new RoomNotFoundException(roomId);
            }
            participants = room.getParticipants();
            state = room.getState();
            version = room.getVersion();
        }

        List<TrackEntry> queue = repository.findQueue(roomId);
        PlaybackState playback = repository.findPlayback(roomId);
        RoomStateSnapshot fresh = new RoomStateSnapshot(room, state, participants, version, queue, playback, now);

        // No pisar un snapshot más nuevo calculado por otro hilo
        snapshotCache.merge(roomId, fresh, (old, neu) -> old.getVersion() > neu.getVersion() ? old : neu);
        if (rooms.get(roomId) != room) {
            snapshotCache.remove(roomId);
        }
        return fresh;
    }

    // Cambios de cola o reproducción hechos fuera del núcleo
    public void notifyRoomChanged(String roomId) {
        Room room = requireRoom(roomId);
        room.markChanged();
        snapshotCache.remove(roomId);
    }

    public boolean broadcastRoomState(String roomId, EventSubject updatedBy) {
        RoomStateSnapshot snapshot = getRoomState(roomId);
        return broadcaster.roomState(roomId, snapshot, updatedBy);
    }

    public Optional<String> currentRoomOf(String userId) {
        return Optional.ofNullable(roomByUser.get(userId));
    }

    // ====================
    // LIMPIEZA
    // ====================

    /**
     * Destruye las salas vacías desde hace más de {@code emptyRoomTtl} y descarta snapshots vencidos.
     *
     * @return cantidad de salas destruidas
     */
    public int cleanupStaleData(Duration emptyRoomTtl) {
        Instant now = clock.instant();
        int destroyed = 0;
        for (Room room : new ArrayList<>(rooms.values())) {
            boolean destroy;
            synchronized (room) {
                destroy = room.isIdleLongerThan(emptyRoomTtl, now);
                if (destroy) {
                    room.markDestroyed();
                    rooms.remove(room.getRoomId(), room);
                    snapshotCache.remove(room.getRoomId());
                }
            }
            if (destroy) {
                registry.clearRoom(room.getRoomId());
                repository.deleteRoom(room.getRoomId());
                destroyed++;
                logger.info("🗑️ Sala {} eliminada tras {} vacía", room.getRoomId(), emptyRoomTtl);
            }
        }
        snapshotCache.entrySet().removeIf(e -> e.getValue().isOlderThan(snapshotTtl, now));
        return destroyed;
    }

    // ====================
    // ESTADÍSTICAS
    // ====================
    public RoomStatistics getRoomStatistics(String roomId) {
        Room room = requireRoom(roomId);
        Instant now = clock.instant();
        return new RoomStatistics(room.getRoomId(), room.getName(), room.getState(), room.getParticipantCount(),
                registry.connectionsFor(roomId).size(), room.getCreatedAt().toEpochMilli(),
                Duration.between(room.getCreatedAt(), now).toMillis());
    }

    public GlobalStatistics getGlobalStatistics() {
        int active = 0;
        int idle = 0;
        int participants = 0;
        List<Room> snapshot = new ArrayList<>(rooms.values());
        for (Room room : snapshot) {
            RoomState state = room.getState();
            if (state == RoomState.ACTIVE)
                active++;
            else if (state == RoomState.IDLE)
                idle++;
            participants += room.getParticipantCount();
        }
        return new GlobalStatistics(snapshot.size(), active, idle, participants, snapshotCache.size(),
                registry.getStatistics(), broadcaster.getStatistics(), clock.millis());
    }

    // ====================
    // UTILIDADES
    // ====================
    private Room requireRoom(String roomId) {
        if (roomId == null || roomId.isBlank()) {
            throw new IllegalArgumentException("roomId no puede ser nulo o vacío");
        }
        Room room = rooms.get(roomId);
        if (room == null) {
            throw new RoomNotFoundException(roomId);
        }
        return room;
    }

    private void validateUserId(String userId) {
        if (userId == null || userId.trim().isEmpty()) {
            throw new IllegalArgumentException("userId no puede ser nulo o vacío");
        }
    }

    private void ensureRunning() {
        if (shuttingDown.get()) {
            throw new IllegalStateException("RoomManager está cerrándose");
        }
    }

    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true))
            return;
        int count = rooms.size();
        rooms.clear();
        snapshotCache.clear();
        roomByUser.clear();
        logger.info("🛑 RoomManager detenido ({} salas descartadas)", count);
    }
}
