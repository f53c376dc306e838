package com.rebenew.listeningRooms.syncserver.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Prioridad de entrega. Un rango menor se entrega antes dentro de un mismo ciclo de despacho.
 * CRITICAL y HIGH se reintentan una vez ante un fallo transitorio de envío.
 */
public enum EventPriority {
    CRITICAL(1, true),
    HIGH(2, true),
    NORMAL(3, false),
    LOW(4, false);

    private final int rank;
    private final boolean retryOnTransientFailure;

    EventPriority(int rank, boolean retryOnTransientFailure) {
        this.rank = rank;
        this.retryOnTransientFailure = retryOnTransientFailure;
    }

    public int getRank() {
        return rank;
    }

    public boolean isRetryOnTransientFailure() {
        return retryOnTransientFailure;
    }

    @JsonValue
    public String getWireName() {
        return name().toLowerCase();
    }
}
