package com.rebenew.listeningRooms.syncserver.model;

public enum DeliveryOutcome {
    PENDING,   // en cola, o enviado y esperando confirmación del cliente (critical/high)
    DELIVERED, // aceptado por el transporte, sin confirmación requerida (normal/low)
    CONFIRMED, // el cliente confirmó la recepción
    FAILED,    // el envío falló tras los reintentos permitidos
    EXPIRED    // sin confirmación dentro de la ventana de retención
}
