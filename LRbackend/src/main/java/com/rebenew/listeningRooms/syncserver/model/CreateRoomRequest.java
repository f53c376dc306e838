package com.rebenew.listeningRooms.syncserver.model;

import lombok.Getter;
import lombok.Setter;

@Setter
@Getter
public class CreateRoomRequest {
    private String senderId;
    private String roomId;
    private String name;

    public CreateRoomRequest() {}

    public CreateRoomRequest(String senderId) {
        this.senderId = senderId;
    }

    public RoomConfig toConfig() {
        return new RoomConfig(roomId, name);
    }
}
