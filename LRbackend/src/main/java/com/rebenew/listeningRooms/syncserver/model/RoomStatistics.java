package com.rebenew.listeningRooms.syncserver.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class RoomStatistics {
    private final String roomId;
    private final String name;
    private final RoomState state;
    private final int participantCount;
    private final int liveConnections;
    private final long createdAt;
    private final long uptimeMs;
}
