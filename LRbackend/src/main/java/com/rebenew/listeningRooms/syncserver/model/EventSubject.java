package com.rebenew.listeningRooms.syncserver.model;

import java.util.Map;

/**
 * Capacidad mínima que necesitan los composers del broadcaster: un id y un resumen serializable.
 * Usuarios, tracks y snapshots de sala la implementan; el broadcaster no conoce los tipos concretos.
 */
public interface EventSubject {

    String getId();

    Map<String, Object> toSummary();

    // Nombre legible para los mensajes de los eventos
    default String displayLabel() {
        return getId();
    }
}
