package com.rebenew.listeningRooms.syncserver.model;

import lombok.Getter;
import lombok.Setter;

/**
 * Parámetros de creación de sala. roomId es opcional: si falta se genera uno.
 */
@Getter
@Setter
public class RoomConfig {
    private String roomId;
    private String name;

    public RoomConfig() {}

    public RoomConfig(String roomId, String name) {
        this.roomId = roomId;
        this.name = name;
    }

    public static RoomConfig withId(String roomId) {
        return new RoomConfig(roomId, null);
    }
}
