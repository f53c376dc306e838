package com.rebenew.listeningRooms.syncserver.exception;

public class NotFoundException extends SyncException {

    protected NotFoundException(String errorCode, String message) {
        super(errorCode, message);
    }
}
