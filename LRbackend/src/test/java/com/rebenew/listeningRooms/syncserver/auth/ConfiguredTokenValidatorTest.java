package com.rebenew.listeningRooms.syncserver.auth;

import com.rebenew.listeningRooms.syncserver.exception.AuthException;
import com.rebenew.listeningRooms.syncserver.model.AuthPrincipal;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfiguredTokenValidatorTest {

    private final ConfiguredTokenValidator validator = new ConfiguredTokenValidator(
            Map.of("abc123", new AuthPrincipal("alice", "Alice")));

    @Test
    void tokenConocidoDevuelveIdentidad() {
        AuthPrincipal principal = validator.validateToken(" abc123 ");

        assertEquals("alice", principal.userId());
        assertEquals("Alice", principal.displayName());
    }

    @Test
    void tokenAusenteODesconocidoFalla() {
        assertThrows(AuthException.class, () -> validator.validateToken(null));
        assertThrows(AuthException.class, () -> validator.validateToken(""));
        AuthException e = assertThrows(AuthException.class, () -> validator.validateToken("otro"));
        assertEquals("auth_failed", e.getErrorCode());
    }
}
