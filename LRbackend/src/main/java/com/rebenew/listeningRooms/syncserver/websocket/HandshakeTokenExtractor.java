package com.rebenew.listeningRooms.syncserver.websocket;

import org.springframework.http.HttpHeaders;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * Busca el token en el handshake: query {@code ?token=}, cabecera {@code Authorization: Bearer}
 * o subprotocolo {@code token.<valor>}, en ese orden.
 */
public final class HandshakeTokenExtractor {
    static final String QUERY_PARAM = "token";
    static final String BEARER_PREFIX = "Bearer ";
    static final String SUBPROTOCOL_PREFIX = "token.";

    private HandshakeTokenExtractor() {
    }

    public static Optional<String> extract(URI uri, HttpHeaders headers) {
        if (uri != null) {
            String fromQuery = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst(QUERY_PARAM);
            if (fromQuery != null && !fromQuery.isBlank())
                return Optional.of(fromQuery.trim());
        }
        if (headers == null)
            return Optional.empty();

        String authorization = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            if (!token.isEmpty())
                return Optional.of(token);
        }

        List<String> protocols = headers.get("Sec-WebSocket-Protocol");
        if (protocols != null) {
            for (String header : protocols) {
                for (String protocol : header.split(",")) {
                    String candidate = protocol.trim();
                    if (candidate.startsWith(SUBPROTOCOL_PREFIX) && candidate.length() > SUBPROTOCOL_PREFIX.length())
                        return Optional.of(candidate.substring(SUBPROTOCOL_PREFIX.length()));
                }
            }
        }
        return Optional.empty();
    }
}
