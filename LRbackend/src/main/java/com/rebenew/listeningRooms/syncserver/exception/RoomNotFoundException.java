package com.rebenew.listeningRooms.syncserver.exception;

public class RoomNotFoundException extends NotFoundException {
    private final String roomId;

    public RoomNotFoundException(String roomId) {
        super("room_not_found", "Sala no encontrada: " + roomId);
        this.roomId = roomId;
    }

    public String getRoomId() {
        return roomId;
    }
}
