package com.rebenew.listeningRooms.syncserver.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebenew.listeningRooms.syncserver.core.Connection;
import com.rebenew.listeningRooms.syncserver.core.ConnectionRegistry;
import com.rebenew.listeningRooms.syncserver.core.EventBroadcaster;
import com.rebenew.listeningRooms.syncserver.core.RoomManager;
import com.rebenew.listeningRooms.syncserver.exception.AuthException;
import com.rebenew.listeningRooms.syncserver.exception.SyncException;
import com.rebenew.listeningRooms.syncserver.model.AuthPrincipal;
import com.rebenew.listeningRooms.syncserver.model.EventScope;
import com.rebenew.listeningRooms.syncserver.model.RoomStateSnapshot;
import com.rebenew.listeningRooms.syncserver.model.SyncMsg;
import com.rebenew.listeningRooms.syncserver.transport.WebSocketTransportHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Clock;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

// Adaptador WebSocket: traduce mensajes de control a operaciones del núcleo.

@Component
public class RoomSyncWebSocketHandler extends TextWebSocketHandler {
    private static final Logger logger = LoggerFactory.getLogger(RoomSyncWebSocketHandler.class);

    static final String CONNECTION_ID_ATTR = "connectionId";

    private final ConnectionRegistry registry;
    private final RoomManager roomManager;
    private final EventBroadcaster broadcaster;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RoomSyncWebSocketHandler(ConnectionRegistry registry, RoomManager roomManager,
            EventBroadcaster broadcaster, ObjectMapper objectMapper, Clock clock) {
        this.registry = registry;
        this.roomManager = roomManager;
        this.broadcaster = broadcaster;
        this.objectMapper = objectMapper;
        this.clock = clock;
        logger.info("✅ RoomSyncWebSocketHandler inicializado");
    }

    // ==================== CICLO DE VIDA WEBSOCKET ====================

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) {
        String connectionId = registry.register(new WebSocketTransportHandle(session, objectMapper));
        session.getAttributes().put(CONNECTION_ID_ATTR, connectionId);
        logger.info("🔄 Nueva conexión WebSocket: {} → {}", session.getId(), connectionId);

        Optional<String> token = HandshakeTokenExtractor.extract(session.getUri(), session.getHandshakeHeaders());
        if (token.isPresent()) {
            authenticate(session, connectionId, token.get(), null);
        }
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        String connectionId = connectionIdOf(session);
        if (connectionId == null) {
            logger.warn("Mensaje de sesión sin registrar: {}", session.getId());
            return;
        }
        registry.touch(connectionId);

        SyncMsg syncMsg;
        try {
            syncMsg = objectMapper.readValue(message.getPayload(), SyncMsg.class);
        } catch (JsonProcessingException e) {
            logger.warn("❌ Error parseando mensaje de {}: {}", connectionId, e.getOriginalMessage());
            reportError(session, connectionId, "invalid_message", "Mensaje JSON inválido", null);
            return;
        }
        processMessage(session, connectionId, syncMsg);
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        String connectionId = connectionIdOf(session);
        if (connectionId != null) {
            roomManager.handleConnectionClosed(connectionId);
        }
        logger.info("🔌 Conexión cerrada: {} ({})", session.getId(), status);
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        logger.error("🚨 Error de transporte WebSocket: {} - {}", session.getId(), exception.getMessage());
        if (session.isOpen()) {
            try {
                session.close(CloseStatus.SERVER_ERROR);
            } catch (IOException e) {
                logger.warn("Error cerrando sesión {}: {}", session.getId(), e.getMessage());
            }
        }
    }

    // ==================== PROCESAMIENTO PRINCIPAL ====================

    private void processMessage(WebSocketSession session, String connectionId, SyncMsg msg) {
        String type = msg.getType();
        String correlationId = msg.getCorrelationId();

        if (type == null) {
            reportError(session, connectionId, "missing_type", "El mensaje no tiene tipo", correlationId);
            return;
        }

        Optional<Connection> connection = registry.find(connectionId);
        if (connection.isEmpty()) {
            logger.warn("Mensaje {} de conexión ya eliminada: {}", type, connectionId);
            return;
        }
        if (!connection.get().isAuthenticated() && !SyncMsg.AUTH.equals(type) && !SyncMsg.PING.equals(type)) {
            sendReply(session, SyncMsg.ack(false, "not_authenticated", correlationId));
            return;
        }

        try {
            switch (type) {
                case SyncMsg.AUTH:
                    authenticate(session, connectionId, msg.getStringData("token"), correlationId);
                    break;
                case SyncMsg.JOIN_ROOM:
                    handleJoinRoom(session, connectionId, msg);
                    break;
                case SyncMsg.LEAVE_ROOM:
                    handleLeaveRoom(session, connectionId, msg);
                    break;
                case SyncMsg.GET_ROOM_STATE:
                    handleGetRoomState(session, connection.get(), msg);
                    break;
                case SyncMsg.PING:
                    handlePing(session, msg);
                    break;
                case SyncMsg.CONFIRM_DELIVERY:
                    handleConfirmDelivery(session, connection.get(), msg);
                    break;
                default:
                    logger.warn("Tipo de mensaje desconocido de {}: {}", connectionId, type);
                    reportError(session, connectionId, "unknown_message_type", "Tipo desconocido: " + type, correlationId);
            }
        } catch (AuthException e) {
            sendReply(session, SyncMsg.ack(false, e.getErrorCode(), correlationId));
        } catch (SyncException e) {
            logger.warn("❌ {} falló para {}: {}", type, connectionId, e.getMessage());
            reportError(session, connectionId, e.getErrorCode(), e.getMessage(), correlationId);
        } catch (IllegalArgumentException e) {
            reportError(session, connectionId, "invalid_request", e.getMessage(), correlationId);
        } catch (RuntimeException e) {
            logger.error("❌ Error procesando mensaje {}: {}", type, e.getMessage(), e);
            reportError(session, connectionId, "processing_error", "Error interno", correlationId);
        }
    }

    // ==================== AUTENTICACIÓN ====================

    private void authenticate(WebSocketSession session, String connectionId, String token, String correlationId) {
        AuthPrincipal principal;
        try {
            principal = registry.authenticate(connectionId, token);
        } catch (AuthException e) {
            // el registro ya cerró la conexión con el aviso authentication_error
            logger.warn("🔒 {} rechazada: {}", connectionId, e.getMessage());
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("connectionId", connectionId);
        data.put("user", principal.toSummary());
        data.put("serverTime", clock.millis());
        data.put("message", "Conectado como " + principal.displayLabel());
        sendReply(session, SyncMsg.reply("connection_established", data, correlationId));
    }

    // ==================== SALAS ====================

    private void handleJoinRoom(WebSocketSession session, String connectionId, SyncMsg msg) {
        String roomId = msg.getTargetRoomId();
        if (roomId == null || roomId.isBlank()) {
            reportError(session, connectionId, "missing_room_id", "Falta roomId", msg.getCorrelationId());
            return;
        }
        RoomStateSnapshot snapshot = roomManager.attachConnection(connectionId, roomId);
        sendReply(session, SyncMsg.reply("room_state", snapshot.toSummary(), msg.getCorrelationId()));
    }

    private void handleLeaveRoom(WebSocketSession session, String connectionId, SyncMsg msg) {
        Optional<String> left = roomManager.detachConnection(connectionId);
        Map<String, Object> data = new HashMap<>();
        data.put("roomId", left.orElse(null));
        data.put("left", left.isPresent());
        sendReply(session, SyncMsg.reply("room_left", data, msg.getCorrelationId()));
    }

    private void handleGetRoomState(WebSocketSession session, Connection connection, SyncMsg msg) {
        String roomId = msg.getTargetRoomId() != null ? msg.getTargetRoomId() : connection.getRoomId();
        if (roomId == null) {
            reportError(session, connection.getConnectionId(), "not_in_room", "La conexión no está en ninguna sala",
                    msg.getCorrelationId());
            return;
        }
        RoomStateSnapshot snapshot = roomManager.getRoomState(roomId);
        sendReply(session, SyncMsg.reply("room_state", snapshot.toSummary(), msg.getCorrelationId()));
    }

    // ==================== PING Y CONFIRMACIONES ====================

    private void handlePing(WebSocketSession session, SyncMsg msg) {
        Map<String, Object> data = new HashMap<>();
        data.put("serverTime", clock.millis());
        data.put("clientTime", msg.getLongData("clientTime"));
        sendReply(session, SyncMsg.reply("pong", data, msg.getCorrelationId()));
    }

    private void handleConfirmDelivery(WebSocketSession session, Connection connection, SyncMsg msg) {
        String eventId = msg.getStringData("eventId");
        boolean confirmed = broadcaster.confirmDelivery(eventId, connection.getUserId());
        sendReply(session, SyncMsg.ack(confirmed, confirmed ? "confirmed" : "unknown_event", msg.getCorrelationId()));
    }

    // ==================== ENVÍO ====================

    // Usuarios autenticados reciben el error como evento; el resto, como respuesta directa
    private void reportError(WebSocketSession session, String connectionId, String code, String message,
            String correlationId) {
        Optional<String> userId = registry.find(connectionId).map(Connection::getUserId);
        if (userId.isPresent()) {
            Map<String, Object> extra = new HashMap<>();
            if (correlationId != null)
                extra.put("correlationId", correlationId);
            if (broadcaster.error(EventScope.user(userId.get()), code, message, extra))
                return;
        }
        sendReply(session, SyncMsg.error(code, message, correlationId));
    }

    private void sendReply(WebSocketSession session, SyncMsg msg) {
        if (!session.isOpen())
            return;
        try {
            String json = objectMapper.writeValueAsString(msg);
            synchronized (session) {
                session.sendMessage(new TextMessage(json));
            }
        } catch (IOException e) {
            logger.warn("⚠️ No se pudo responder {} a {}: {}", msg.getType(), session.getId(), e.getMessage());
        }
    }

    private static String connectionIdOf(WebSocketSession session) {
        Object value = session.getAttributes().get(CONNECTION_ID_ATTR);
        return value != null ? value.toString() : null;
    }
}
