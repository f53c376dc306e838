package com.rebenew.listeningRooms.syncserver.exception;

// Credencial ausente, inválida o expirada. No reintentable: la conexión se cierra.
public class AuthException extends SyncException {

    public AuthException(String message) {
        super("auth_failed", message);
    }

    public AuthException(String message, Throwable cause) {
        super("auth_failed", message, cause);
    }
}
