package com.rebenew.listeningRooms.syncserver.model;

//Estados posibles de una sala de escucha.

public enum RoomState {
    ACTIVE,    // al menos un participante
    IDLE,      // vacía, corre el TTL de limpieza
    DESTROYED  // TTL vencido, irreversible
}
