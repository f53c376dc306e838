package com.rebenew.listeningRooms.syncserver.core;

import com.rebenew.listeningRooms.syncserver.model.AuthPrincipal;
import com.rebenew.listeningRooms.syncserver.transport.TransportHandle;

import java.time.Instant;

/**
 * Conexión de cliente viva. Solo ConnectionRegistry muta su estado; el resto la lee.
 */
public class Connection {
    private final String connectionId;
    private final TransportHandle handle;
    private final Instant openedAt;

    private volatile AuthPrincipal principal;
    private volatile String roomId;
    private volatile Instant lastActivityAt;

    Connection(String connectionId, TransportHandle handle, Instant openedAt) {
        this.connectionId = connectionId;
        this.handle = handle;
        this.openedAt = openedAt;
        this.lastActivityAt = openedAt;
    }

    void bind(AuthPrincipal principal) {
        this.principal = principal;
    }

    void attachRoom(String roomId) {
        this.roomId = roomId;
    }

    void touch(Instant now) {
        this.lastActivityAt = now;
    }

    public String getConnectionId() {
        return connectionId;
    }

    public TransportHandle getHandle() {
        return handle;
    }

    public Instant getOpenedAt() {
        return openedAt;
    }

    public AuthPrincipal getPrincipal() {
        return principal;
    }

    public boolean isAuthenticated() {
        return principal != null;
    }

    public String getUserId() {
        AuthPrincipal p = principal;
        return p != null ? p.userId() : null;
    }

    public String getRoomId() {
        return roomId;
    }

    public Instant getLastActivityAt() {
        return lastActivityAt;
    }

    @Override
    public String toString() {
        return String.format("Connection{id='%s', user='%s', room='%s'}", connectionId, getUserId(), roomId);
    }
}
