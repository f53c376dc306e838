package com.rebenew.listeningRooms.syncserver.exception;

public class ConnectionNotFoundException extends NotFoundException {

    public ConnectionNotFoundException(String connectionId) {
        super("connection_not_found", "Conexión no registrada: " + connectionId);
    }
}
