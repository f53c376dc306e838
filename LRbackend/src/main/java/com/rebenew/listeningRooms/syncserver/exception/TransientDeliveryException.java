package com.rebenew.listeningRooms.syncserver.exception;

/**
 * La conexión destino no aceptó el envío en este momento. Se reintenta según la prioridad del evento.
 */
public class TransientDeliveryException extends SyncException {

    public TransientDeliveryException(String connectionId, Throwable cause) {
        super("delivery_failed", "Fallo transitorio enviando a la conexión " + connectionId, cause);
    }
}
