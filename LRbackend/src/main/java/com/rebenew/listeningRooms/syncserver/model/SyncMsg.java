package com.rebenew.listeningRooms.syncserver.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;
import lombok.Setter;

import java.util.HashMap;
import java.util.Map;

/**
 * Mensaje WebSocket de control (entrante) y respuesta directa (saliente).
 * Los eventos de sala no usan este sobre: viajan como {@link BroadcastEvent}.
 */

@Getter
@Setter
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SyncMsg {
    // Tipos entrantes
    public static final String AUTH = "auth";
    public static final String JOIN_ROOM = "join_room";
    public static final String LEAVE_ROOM = "leave_room";
    public static final String GET_ROOM_STATE = "get_room_state";
    public static final String PING = "ping";
    public static final String CONFIRM_DELIVERY = "confirm_delivery";

    // Metadatos básicos
    private String type;
    private String roomId;
    private String correlationId;
    private Long timestamp;

    // Un solo campo para datos
    private Object data;

    // ==================== CONSTRUCTORES ESTÁTICOS ====================

    public static SyncMsg reply(String type, Map<String, Object> data, String correlationId) {
        SyncMsg msg = new SyncMsg(type, null, data);
        msg.setCorrelationId(correlationId);
        return msg;
    }

    public static SyncMsg ack(boolean success, String reason, String correlationId) {
        Map<String, Object> ackData = new HashMap<>();
        ackData.put("success", success);
        ackData.put("reason", reason);
        return reply("ack", ackData, correlationId);
    }

    public static SyncMsg error(String errorCode, String message, String correlationId) {
        Map<String, Object> errorData = new HashMap<>();
        errorData.put("code", errorCode);
        errorData.put("message", message);
        return reply("error", errorData, correlationId);
    }

    // Aviso del servidor sin correlación, p.ej. antes de cerrar la conexión
    public static SyncMsg system(String event) {
        Map<String, Object> systemData = new HashMap<>();
        systemData.put("event", event);
        return new SyncMsg("system", null, systemData);
    }

    public static SyncMsg authenticationError(String message) {
        Map<String, Object> errorData = new HashMap<>();
        errorData.put("error", "Authentication failed");
        errorData.put("message", message);
        return new SyncMsg("authentication_error", null, errorData);
    }

    // Constructor principal privado
    private SyncMsg(String type, String roomId, Object data) {
        this.type = type;
        this.roomId = roomId;
        this.data = data;
        this.timestamp = System.currentTimeMillis();
    }

    // Constructor público vacío para Jackson
    public SyncMsg() {
        this.timestamp = System.currentTimeMillis();
    }

    // ==================== MÉTODOS DE CONVENIENCIA ====================

    /**
     * Extracción segura de datos
     */
    @JsonIgnore
    @SuppressWarnings("unchecked")
    public Map<String, Object> getDataAsMap() {
        return data instanceof Map ? (Map<String, Object>) data : null;
    }

    public String getStringData(String key) {
        Map<String, Object> dataMap = getDataAsMap();
        Object value = dataMap != null ? dataMap.get(key) : null;
        return value != null ? value.toString() : null;
    }

    public Long getLongData(String key) {
        Map<String, Object> dataMap = getDataAsMap();
        Object value = dataMap != null ? dataMap.get(key) : null;
        if (value instanceof Number)
            return ((Number) value).longValue();
        if (value instanceof String) {
            try {
                return Long.parseLong((String) value);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    // roomId puede venir en la raíz o dentro de data
    @JsonIgnore
    public String getTargetRoomId() {
        return roomId != null ? roomId : getStringData("roomId");
    }

    @Override
    public String toString() {
        return String.format("SyncMsg{type='%s', roomId='%s', correlationId='%s', timestamp=%d}",
                type, roomId, correlationId, timestamp);
    }
}
