package com.rebenew.listeningRooms.syncserver.auth;

import com.rebenew.listeningRooms.syncserver.exception.AuthException;
import com.rebenew.listeningRooms.syncserver.model.AuthPrincipal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Validador por defecto: tabla token → usuario tomada de la configuración.
 * Pensado para desarrollo y pruebas; en producción se registra otro bean TokenValidator.
 */
public class ConfiguredTokenValidator implements TokenValidator {
    private static final Logger logger = LoggerFactory.getLogger(ConfiguredTokenValidator.class);

    private final Map<String, AuthPrincipal> principalsByToken;

    public ConfiguredTokenValidator(Map<String, AuthPrincipal> principalsByToken) {
        this.principalsByToken = Map.copyOf(principalsByToken);
        logger.info("ConfiguredTokenValidator inicializado con {} tokens", principalsByToken.size());
    }

    @Override
    public AuthPrincipal validateToken(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthException("Token ausente");
        }
        AuthPrincipal principal = principalsByToken.get(token.trim());
        if (principal == null) {
            throw new AuthException("Token inválido o expirado");
        }
        return principal;
    }
}
