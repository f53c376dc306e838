package com.rebenew.listeningRooms.syncserver.auth;

import com.rebenew.listeningRooms.syncserver.exception.AuthException;
import com.rebenew.listeningRooms.syncserver.model.AuthPrincipal;

/**
 * Colaborador externo que valida credenciales. El algoritmo (JWT, sesión, etc.) no es asunto del núcleo.
 */
@FunctionalInterface
public interface TokenValidator {

    AuthPrincipal validateToken(String token) throws AuthException;
}
