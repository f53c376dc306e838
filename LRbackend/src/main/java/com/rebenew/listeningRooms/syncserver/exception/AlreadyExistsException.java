package com.rebenew.listeningRooms.syncserver.exception;

public class AlreadyExistsException extends SyncException {

    public AlreadyExistsException(String roomId) {
        super("room_already_exists", "La sala ya existe: " + roomId);
    }
}
