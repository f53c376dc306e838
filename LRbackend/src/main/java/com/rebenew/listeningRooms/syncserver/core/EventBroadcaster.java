package com.rebenew.listeningRooms.syncserver.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebenew.listeningRooms.syncserver.exception.TransientDeliveryException;
import com.rebenew.listeningRooms.syncserver.model.*;
import com.rebenew.listeningRooms.syncserver.transport.TransportHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Construye eventos tipados y los entrega a las conexiones de una sala, de un usuario o de todo el servidor.
 *
 * <p>Cada conexión tiene una bandeja ordenada por prioridad. Un despacho primero encola en todas
 * las bandejas destino y después las vacía, así un evento crítico adelanta a los de menor
 * prioridad que sigan esperando. Ningún lock de estado se mantiene durante un envío.
 *
 * <p>Cada envío deja un {@link DeliveryRecord}. Los eventos critical/high quedan pendientes
 * hasta que el cliente confirma; los que no se confirman dentro de la retención expiran.
 */
public class EventBroadcaster {
    private static final Logger logger = LoggerFactory.getLogger(EventBroadcaster.class);

    private static final int MAX_ATTEMPTS_WITH_RETRY = 2;

    // ============================
    // ESTADO PRINCIPAL
    // ============================
    private final ConcurrentHashMap<String, DeliveryRecord> deliveryRecords = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Outbox> outboxes = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    // Contadores, protegidos por statsLock
    private final Object statsLock = new Object();
    private long totalEvents;
    private long successfulDeliveries;
    private long failedDeliveries;
    private long expiredDeliveries;
    private long confirmedDeliveries;
    private long retriedDeliveries;
    private final Map<String, Long> eventsByType = new TreeMap<>();
    private final Map<String, Long> eventsByRoom = new TreeMap<>();

    private final ConnectionRegistry registry;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration retention;

    public EventBroadcaster(ConnectionRegistry registry, ObjectMapper objectMapper, Clock clock, Duration retention) {
        this.registry = registry;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.retention = retention;
        logger.info("EventBroadcaster inicializado (retención={})", retention);
    }

    // ====================
    // ACTIVIDADES
    // ====================
    public enum UserActivity {
        JOINED(EventType.USER_JOINED, EventPriority.CRITICAL, "se unió a la sala"),
        LEFT(EventType.USER_LEFT, EventPriority.CRITICAL, "salió de la sala"),
        CONNECTED(EventType.USER_CONNECTED, EventPriority.HIGH, "se conectó"),
        DISCONNECTED(EventType.USER_DISCONNECTED, EventPriority.HIGH, "se desconectó");

        private final EventType eventType;
        private final EventPriority priority;
        private final String verb;

        UserActivity(EventType eventType, EventPriority priority, String verb) {
            this.eventType = eventType;
            this.priority = priority;
            this.verb = verb;
        }
    }

    public enum TrackActivity {
        ADDED(EventType.TRACK_ADDED, "agregó"),
        VOTED(EventType.TRACK_VOTED, "votó"),
        UNVOTED(EventType.TRACK_UNVOTED, "retiró su voto de"),
        QUEUE_REORDERED(EventType.QUEUE_REORDERED, "reordenó la cola con");

        private final EventType eventType;
        private final String verb;

        TrackActivity(EventType eventType, String verb) {
            this.eventType = eventType;
            this.verb = verb;
        }
    }

    public enum PlaybackActivity {
        STARTED(EventType.PLAYBACK_STARTED, "inició la reproducción"),
        PAUSED(EventType.PLAYBACK_PAUSED, "pausó la reproducción"),
        RESUMED(EventType.PLAYBACK_RESUMED, "reanudó la reproducción"),
        STOPPED(EventType.PLAYBACK_STOPPED, "detuvo la reproducción"),
        SEEKED(EventType.PLAYBACK_SEEKED, "movió la posición"),
        SKIPPED(EventType.TRACK_SKIPPED, "saltó el track");

        private final EventType eventType;
        private final String verb;

        PlaybackActivity(EventType eventType, String verb) {
            this.eventType = eventType;
            this.verb = verb;
        }
    }

    // ====================
    // DIFUSIÓN
    // ====================
    public boolean broadcastToRoom(String roomId, EventType type, Map<String, Object> payload) {
        return broadcastToRoom(roomId, type, payload, EventPriority.NORMAL);
    }

    /**
     * Entrega un evento a cada conexión asociada a la sala.
     * Una sala sin conexiones cuenta como éxito sin crear eventos.
     *
     * @return true si todas las entregas salieron bien
     */
    public boolean broadcastToRoom(String roomId, EventType type, Map<String, Object> payload, EventPriority priority) {
        EventScope scope = EventScope.room(roomId);
        return dispatch(scope, registry.connectionsFor(roomId), type, payload, priority);
    }

    // Falso sin crear evento si el usuario no tiene conexión viva
    public boolean broadcastToUser(String userId, EventType type, Map<String, Object> payload, EventPriority priority) {
        EventScope scope = EventScope.user(userId);
        Optional<String> connectionId = registry.connectionFor(userId);
        if (connectionId.isEmpty()) {
            logger.debug("Usuario {} sin conexión viva, se descarta {}", userId, type);
            return false;
        }
        return dispatch(scope, Set.of(connectionId.get()), type, payload, priority);
    }

    public boolean broadcastGlobal(EventType type, Map<String, Object> payload, EventPriority priority) {
        return dispatch(EventScope.global(), registry.allConnections(), type, payload, priority);
    }

    private boolean dispatch(EventScope scope, Set<String> targets, EventType type,
            Map<String, Object> payload, EventPriority priority) {
        if (shuttingDown.get()) {
            logger.debug("Broadcaster detenido, se descarta {} para {}", type, scope);
            return false;
        }
        if (targets.isEmpty())
            return true;

        EventPriority effective = priority != null ? priority : EventPriority.NORMAL;
        Instant now = clock.instant();
        List<Delivery> deliveries = new ArrayList<>(targets.size());

        // 1) encolar en todas las bandejas
        for (String connectionId : targets) {
            Optional<Connection> connection = registry.find(connectionId);
            if (connection.isEmpty())
                continue;
            BroadcastEvent event = BroadcastEvent.create(type, scope, effective, payload, now, retention);
            DeliveryRecord record = new DeliveryRecord(event, connectionId, connection.get().getUserId());
            deliveryRecords.put(event.getEventId(), record);
            countCreated(type, scope);

            Outbox outbox = outboxes.computeIfAbsent(connectionId, k -> new Outbox());
            Delivery delivery = new Delivery(event, record, connection.get().getHandle(), outbox, sequence.incrementAndGet());
            outbox.enqueue(delivery);
            deliveries.add(delivery);
        }

        // 2) vaciar bandejas; si otro hilo ya está vaciando una, él entrega lo nuestro
        for (Delivery delivery : deliveries) {
            delivery.outbox.drain(this::attempt);
        }

        boolean allDelivered = true;
        for (Delivery delivery : deliveries) {
            allDelivered &= delivery.result.join();
        }
        logger.debug("📡 {} → {} ({} destinos, ok={})", type, scope, deliveries.size(), allDelivered);
        return allDelivered;
    }

    private boolean attempt(Delivery delivery) {
        DeliveryRecord record = delivery.record;
        String json;
        try {
            json = objectMapper.writeValueAsString(delivery.event);
        } catch (JsonProcessingException e) {
            logger.error("Error serializando {}: {}", delivery.event, e.getMessage());
            markFailed(record);
            return false;
        }

        int maxAttempts = record.getPriority().isRetryOnTransientFailure() ? MAX_ATTEMPTS_WITH_RETRY : 1;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (!delivery.handle.isOpen()) {
                logger.debug("Conexión {} cerrada, {} no entregado", record.getConnectionId(), delivery.event);
                break;
            }
            record.recordAttempt(clock.instant());
            try {
                delivery.handle.send(json);
                record.markSent(clock.instant());
                synchronized (statsLock) {
                    successfulDeliveries++;
                }
                return true;
            } catch (IOException e) {
                TransientDeliveryException failure = new TransientDeliveryException(record.getConnectionId(), e);
                logger.warn("⚠️ {} (intento {}/{}): {}", failure.getMessage(), attempt, maxAttempts, e.getMessage());
                if (attempt < maxAttempts) {
                    synchronized (statsLock) {
                        retriedDeliveries++;
                    }
                }
            } catch (RuntimeException e) {
                logger.warn("⚠️ Envío a {} rechazado por el transporte: {}", record.getConnectionId(), e.getMessage());
                break;
            }
        }
        markFailed(record);
        return false;
    }

    private void markFailed(DeliveryRecord record) {
        if (record.markFailed(clock.instant())) {
            synchronized (statsLock) {
                failedDeliveries++;
            }
        }
    }

    private void countCreated(EventType type, EventScope scope) {
        synchronized (statsLock) {
            totalEvents++;
            eventsByType.merge(type.getWireName(), 1L, Long::sum);
            if (scope.isRoom()) {
                eventsByRoom.merge(scope.getTarget(), 1L, Long::sum);
            }
        }
    }

    // ====================
    // COMPOSERS
    // ====================
    public boolean userActivity(String roomId, UserActivity activity, EventSubject user, Map<String, Object> extra) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("roomId", roomId);
        payload.put("user", user.toSummary());
        payload.put("message", user.displayLabel() + " " + activity.verb);
        if (extra != null)
            payload.putAll(extra);
        return broadcastToRoom(roomId, activity.eventType, payload, activity.priority);
    }

    public boolean trackActivity(String roomId, TrackActivity activity, EventSubject track,
            EventSubject actor, Map<String, Object> extra) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("roomId", roomId);
        payload.put("track", track.toSummary());
        if (actor != null) {
            payload.put("actor", actor.toSummary());
            payload.put("message", actor.displayLabel() + " " + activity.verb + " " + track.displayLabel());
        }
        if (extra != null)
            payload.putAll(extra);
        return broadcastToRoom(roomId, activity.eventType, payload, EventPriority.HIGH);
    }

    public boolean playbackActivity(String roomId, PlaybackActivity activity, EventSubject actor,
            Map<String, Object> playback, Map<String, Object> extra) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("roomId", roomId);
        if (actor != null) {
            payload.put("actor", actor.toSummary());
            payload.put("message", actor.displayLabel() + " " + activity.verb);
        }
        payload.put("playback", playback != null ? playback : Map.of());
        payload.put("serverTime", clock.millis());
        if (extra != null)
            payload.putAll(extra);
        return broadcastToRoom(roomId, activity.eventType, payload, EventPriority.CRITICAL);
    }

    public boolean roomState(String roomId, EventSubject snapshot, EventSubject updatedBy) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("roomId", roomId);
        payload.put("room", snapshot.toSummary());
        if (updatedBy != null)
            payload.put("updatedBy", updatedBy.toSummary());
        return broadcastToRoom(roomId, EventType.ROOM_STATE_UPDATED, payload, EventPriority.HIGH);
    }

    public boolean error(EventScope target, String errorCode, String message, Map<String, Object> extra) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("code", errorCode);
        payload.put("message", message);
        if (extra != null)
            payload.putAll(extra);
        switch (target.getKind()) {
            case ROOM:
                return broadcastToRoom(target.getTarget(), EventType.ERROR, payload, EventPriority.CRITICAL);
            case USER:
                return broadcastToUser(target.getTarget(), EventType.ERROR, payload, EventPriority.CRITICAL);
            default:
                return broadcastGlobal(EventType.ERROR, payload, EventPriority.CRITICAL);
        }
    }

    // ====================
    // CONFIRMACIONES Y LIMPIEZA
    // ====================

    // Solo el destinatario del evento puede confirmarlo
    public boolean confirmDelivery(String eventId, String userId) {
        if (eventId == null || userId == null)
            return false;
        DeliveryRecord record = deliveryRecords.get(eventId);
        if (record == null || !userId.equals(record.getUserId()))
            return false;
        if (!record.markConfirmed(clock.instant()))
            return false;
        synchronized (statsLock) {
            confirmedDeliveries++;
        }
        logger.debug("✔️ Evento {} confirmado por {}", eventId, userId);
        return true;
    }

    /**
     * Expira los registros pendientes sin confirmar más allá de la retención (cuentan como fallidos)
     * y purga los ya resueltos.
     *
     * @return cantidad de registros expirados en esta pasada
     */
    public int cleanupStaleEvents() {
        Instant now = clock.instant();
        int expired = 0;
        Iterator<DeliveryRecord> it = deliveryRecords.values().iterator();
        while (it.hasNext()) {
            DeliveryRecord record = it.next();
            if (record.expireIfUnconfirmed(retention, now)) {
                expired++;
            }
            if (record.isPurgeable(retention, now)) {
                it.remove();
            }
        }
        if (expired > 0) {
            synchronized (statsLock) {
                // solo expira lo enviado, que ya sumaba como exitoso
                successfulDeliveries -= expired;
                expiredDeliveries += expired;
                failedDeliveries += expired;
            }
            logger.info("⌛ {} entregas expiradas sin confirmación", expired);
        }
        outboxes.entrySet().removeIf(e -> e.getValue().isIdle() && registry.find(e.getKey()).isEmpty());
        return expired;
    }

    // ====================
    // ESTADÍSTICAS
    // ====================
    public BroadcastStatistics getStatistics() {
        int pending = (int) deliveryRecords.values().stream().filter(DeliveryRecord::isPending).count();
        synchronized (statsLock) {
            return new BroadcastStatistics(totalEvents, successfulDeliveries, failedDeliveries,
                    expiredDeliveries, confirmedDeliveries, retriedDeliveries,
                    BroadcastStatistics.successRate(successfulDeliveries, failedDeliveries),
                    new TreeMap<>(eventsByType), new TreeMap<>(eventsByRoom), pending, clock.millis());
        }
    }

    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true))
            return;
        outboxes.clear();
        logger.info("🛑 EventBroadcaster detenido ({} registros de entrega descartados)", deliveryRecords.size());
        deliveryRecords.clear();
    }

    // ====================
    // BANDEJAS
    // ====================
    static final class Delivery {
        final BroadcastEvent event;
        final DeliveryRecord record;
        final TransportHandle handle;
        final Outbox outbox;
        final long sequence;
        final CompletableFuture<Boolean> result = new CompletableFuture<>();

        Delivery(BroadcastEvent event, DeliveryRecord record, TransportHandle handle, Outbox outbox, long sequence) {
            this.event = event;
            this.record = record;
            this.handle = handle;
            this.outbox = outbox;
            this.sequence = sequence;
        }
    }

    interface Sender {
        boolean send(Delivery delivery);
    }

    // Cola por conexión; un solo hilo la vacía a la vez, así los envíos a una conexión no se intercalan
    static final class Outbox {
        private static final Comparator<Delivery> ORDER = Comparator
                .comparingInt((Delivery d) -> d.event.getPriority().getRank())
                .thenComparingLong(d -> d.sequence);

        private final PriorityQueue<Delivery> queue = new PriorityQueue<>(ORDER);
        private boolean draining;

        synchronized void enqueue(Delivery delivery) {
            queue.add(delivery);
        }

        synchronized boolean isIdle() {
            return !draining && queue.isEmpty();
        }

        void drain(Sender sender) {
            synchronized (this) {
                if (draining)
                    return;
                draining = true;
            }
            while (true) {
                Delivery next;
                synchronized (this) {
                    next = queue.poll();
                    if (next == null) {
                        draining = false;
                        return;
                    }
                }
                next.result.complete(sender.send(next));
            }
        }
    }
}
