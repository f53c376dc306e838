package com.rebenew.listeningRooms.syncserver.transport;

public enum CloseReason {
    NORMAL,
    AUTH_FAILED,
    SUPERSEDED,   // el mismo usuario abrió otra conexión autenticada
    STALE,        // sin actividad dentro del timeout
    PROTOCOL_ERROR,
    SHUTDOWN
}
