package com.rebenew.listeningRooms.syncserver.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;
import java.util.Set;

@Getter
@AllArgsConstructor
public class ConnectionStatistics {
    private final int totalConnections;
    private final int authenticatedConnections;
    private final Set<String> authenticatedUsers;
    private final Map<String, Integer> roomConnections;
}
