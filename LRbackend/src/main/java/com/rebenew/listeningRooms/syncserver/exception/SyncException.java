package com.rebenew.listeningRooms.syncserver.exception;

/**
 * Raíz de los errores del núcleo en tiempo real. El código es estable y viaja a los clientes.
 */
public abstract class SyncException extends RuntimeException {
    private final String errorCode;

    protected SyncException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected SyncException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
