package com.rebenew.listeningRooms.syncserver.model;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

/**
 * Registro de entrega de un evento a una conexión concreta.
 * Nace PENDING al encolar; CONFIRMED, FAILED y EXPIRED son finales.
 */
@Getter
public class DeliveryRecord {
    private final String eventId;
    private final String connectionId;
    private final String userId; // null si la conexión no estaba autenticada
    private final EventType eventType;
    private final EventPriority priority;
    private final String roomId; // null para eventos user/global
    private final Instant createdAt;

    private volatile DeliveryOutcome outcome = DeliveryOutcome.PENDING;
    private volatile Instant attemptedAt;
    private volatile Instant sentAt;
    private volatile Instant resolvedAt;
    private volatile int attempts;

    public DeliveryRecord(BroadcastEvent event, String connectionId, String userId) {
        this.eventId = event.getEventId();
        this.connectionId = connectionId;
        this.userId = userId;
        this.eventType = event.getType();
        this.priority = event.getPriority();
        this.roomId = event.getScope().isRoom() ? event.getScope().getTarget() : null;
        this.createdAt = event.getCreatedAt();
    }

    public boolean requiresConfirmation() {
        return priority == EventPriority.CRITICAL || priority == EventPriority.HIGH;
    }

    public synchronized void recordAttempt(Instant now) {
        this.attempts++;
        this.attemptedAt = now;
    }

    // El transporte aceptó el envío
    public synchronized void markSent(Instant now) {
        if (outcome != DeliveryOutcome.PENDING)
            return;
        this.sentAt = now;
        if (!requiresConfirmation()) {
            this.outcome = DeliveryOutcome.DELIVERED;
            this.resolvedAt = now;
        }
    }

    public synchronized boolean markFailed(Instant now) {
        if (outcome != DeliveryOutcome.PENDING)
            return false;
        return resolve(DeliveryOutcome.FAILED, now);
    }

    public synchronized boolean markConfirmed(Instant now) {
        if (outcome != DeliveryOutcome.PENDING && outcome != DeliveryOutcome.DELIVERED)
            return false;
        return resolve(DeliveryOutcome.CONFIRMED, now);
    }

    // Solo expira lo que ya salió y sigue sin confirmar; nunca un envío en curso
    public synchronized boolean expireIfUnconfirmed(Duration retention, Instant now) {
        if (outcome != DeliveryOutcome.PENDING || sentAt == null)
            return false;
        if (!sentAt.plus(retention).isBefore(now))
            return false;
        return resolve(DeliveryOutcome.EXPIRED, now);
    }

    private boolean resolve(DeliveryOutcome target, Instant now) {
        this.outcome = target;
        this.resolvedAt = now;
        return true;
    }

    public boolean isPending() {
        return outcome == DeliveryOutcome.PENDING;
    }

    public boolean isPurgeable(Duration retention, Instant now) {
        Instant resolved = resolvedAt;
        return resolved != null && resolved.plus(retention).isBefore(now);
    }
}
