package com.rebenew.listeningRooms.syncserver.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebenew.listeningRooms.syncserver.model.SyncMsg;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * Adaptador de {@link WebSocketSession} de Spring a {@link TransportHandle}.
 */
public class WebSocketTransportHandle implements TransportHandle {
    private static final Logger logger = LoggerFactory.getLogger(WebSocketTransportHandle.class);

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;

    public WebSocketTransportHandle(WebSocketSession session, ObjectMapper objectMapper) {
        this.session = session;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String payload) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("Sesión cerrada: " + session.getId());
        }
        // WebSocketSession no admite envíos concurrentes
        synchronized (session) {
            session.sendMessage(new TextMessage(payload));
        }
    }

    @Override
    public void close(CloseReason reason) {
        if (!session.isOpen())
            return;
        SyncMsg farewell = farewellFor(reason);
        if (farewell != null) {
            try {
                send(objectMapper.writeValueAsString(farewell));
            } catch (JsonProcessingException e) {
                logger.warn("No se pudo serializar el mensaje de cierre {}: {}", reason, e.getMessage());
            } catch (IOException e) {
                logger.debug("Error enviando mensaje de cierre a {}: {}", session.getId(), e.getMessage());
            }
        }
        try {
            session.close(toCloseStatus(reason));
        } catch (IOException e) {
            logger.debug("Error cerrando sesión {}: {}", session.getId(), e.getMessage());
        }
    }

    // Último mensaje antes de cerrar, para que el cliente sepa por qué
    static SyncMsg farewellFor(CloseReason reason) {
        switch (reason) {
            case AUTH_FAILED:
                return SyncMsg.authenticationError("Invalid or missing token");
            case SUPERSEDED:
                return SyncMsg.system("connection_superseded");
            case STALE:
                return SyncMsg.system("connection_stale");
            case SHUTDOWN:
                return SyncMsg.system("server_shutdown");
            default:
                return null;
        }
    }

    static CloseStatus toCloseStatus(CloseReason reason) {
        switch (reason) {
            case AUTH_FAILED:
                return CloseStatus.POLICY_VIOLATION.withReason("authentication_failed");
            case SUPERSEDED:
                return CloseStatus.NORMAL.withReason("superseded");
            case STALE:
                return CloseStatus.SESSION_NOT_RELIABLE.withReason("stale");
            case PROTOCOL_ERROR:
                return CloseStatus.PROTOCOL_ERROR;
            case SHUTDOWN:
                return CloseStatus.GOING_AWAY;
            default:
                return CloseStatus.NORMAL;
        }
    }
}
