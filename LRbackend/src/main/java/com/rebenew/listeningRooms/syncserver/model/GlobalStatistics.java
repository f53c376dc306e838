package com.rebenew.listeningRooms.syncserver.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Estado global del servicio: salas, participantes, conexiones y entregas.
 */
@Getter
@AllArgsConstructor
public class GlobalStatistics {
    private final int totalRooms;
    private final int activeRooms;
    private final int idleRooms;
    private final int totalParticipants;
    private final int cachedSnapshots;
    private final ConnectionStatistics connections;
    private final BroadcastStatistics events;
    private final long serverTime;
}
