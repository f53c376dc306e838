package com.rebenew.listeningRooms.syncserver.websocket;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.net.URI;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

class HandshakeTokenExtractorTest {

    @Test
    void tokenEnQuery() {
        assertEquals(Optional.of("abc"),
                HandshakeTokenExtractor.extract(URI.create("ws://localhost/ws/rooms?token=abc"), new HttpHeaders()));
    }

    @Test
    void tokenEnCabeceraBearer() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "Bearer xyz");

        assertEquals(Optional.of("xyz"), HandshakeTokenExtractor.extract(URI.create("ws://localhost/ws/rooms"), headers));
    }

    @Test
    void tokenEnSubprotocolo() {
        HttpHeaders headers = new HttpHeaders();
        headers.set("Sec-WebSocket-Protocol", "rooms.v1, token.s3cr3t");

        assertEquals(Optional.of("s3cr3t"), HandshakeTokenExtractor.extract(null, headers));
    }

    @Test
    void laQueryTienePrioridad() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "Bearer header");

        assertEquals(Optional.of("query"),
                HandshakeTokenExtractor.extract(URI.create("ws://localhost/ws/rooms?token=query"), headers));
    }

    @Test
    void sinTokenDevuelveVacio() {
        assertEquals(Optional.empty(), HandshakeTokenExtractor.extract(URI.create("ws://localhost/ws/rooms"), new HttpHeaders()));
        assertEquals(Optional.empty(), HandshakeTokenExtractor.extract(null, null));
    }
}
