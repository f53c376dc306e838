package com.rebenew.listeningRooms.syncserver;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ListeningRoomsServerApplicationTest {

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate rest;

    @Autowired
    private ObjectMapper mapper;

    @Test
    void crearYConsultarSala() {
        ResponseEntity<Map> created = rest.postForEntity("/rooms",
                Map.of("senderId", "alice", "roomId", "http-room", "name", "Demo"), Map.class);
        assertEquals(HttpStatus.CREATED, created.getStatusCode());
        assertEquals("http-room", created.getBody().get("roomId"));

        ResponseEntity<Map> duplicated = rest.postForEntity("/rooms",
                Map.of("senderId", "alice", "roomId", "http-room"), Map.class);
        assertEquals(HttpStatus.CONFLICT, duplicated.getStatusCode());
        assertEquals("room_already_exists", duplicated.getBody().get("error"));

        ResponseEntity<Map> state = rest.getForEntity("/rooms/http-room/state", Map.class);
        assertEquals(HttpStatus.OK, state.getStatusCode());
        assertEquals(0, state.getBody().get("participantCount"));

        assertEquals(HttpStatus.OK, rest.getForEntity("/rooms/status", Map.class).getStatusCode());
        assertEquals(HttpStatus.OK, rest.getForEntity("/rooms/http-room/stats", Map.class).getStatusCode());
    }

    @Test
    void erroresHttpTraducidos() {
        ResponseEntity<Map> missing = rest.getForEntity("/rooms/no-existe/state", Map.class);
        assertEquals(HttpStatus.NOT_FOUND, missing.getStatusCode());
        assertEquals("room_not_found", missing.getBody().get("error"));

        ResponseEntity<Map> invalid = rest.postForEntity("/rooms", Map.of("name", "sin dueño"), Map.class);
        assertEquals(HttpStatus.BAD_REQUEST, invalid.getStatusCode());
    }

    @Test
    void clienteWebSocketSeAutenticaYSeUneASala() throws Exception {
        rest.postForEntity("/rooms", Map.of("senderId", "alice", "roomId", "ws-room"), Map.class);

        BlockingQueue<JsonNode> inbox = new LinkedBlockingQueue<>();
        TextWebSocketHandler handler = new TextWebSocketHandler() {
            @Override
            protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message)
                    throws Exception {
                inbox.add(mapper.readTree(message.getPayload()));
            }
        };

        WebSocketSession session = new StandardWebSocketClient()
                .execute(handler, "ws://localhost:" + port + "/ws/rooms?token=dev-token-alice")
                .get(5, TimeUnit.SECONDS);
        try {
            JsonNode welcome = next(inbox, "connection_established");
            assertEquals("alice", welcome.get("data").get("user").get("userId").asText());

            session.sendMessage(new TextMessage("{\"type\":\"join_room\",\"roomId\":\"ws-room\",\"correlationId\":\"c1\"}"));
            JsonNode state = next(inbox, "room_state");
            assertEquals("c1", state.get("correlationId").asText());
            assertEquals(1, state.get("data").get("participantCount").asInt());

            session.sendMessage(new TextMessage("{\"type\":\"ping\",\"data\":{\"clientTime\":5}}"));
            assertEquals(5, next(inbox, "pong").get("data").get("clientTime").asLong());
        } finally {
            session.close();
        }
    }

    private static JsonNode next(BlockingQueue<JsonNode> inbox, String type) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            JsonNode node = inbox.poll(200, TimeUnit.MILLISECONDS);
            if (node != null && type.equals(node.path("type").asText()))
                return node;
        }
        fail("no llegó " + type);
        return null;
    }
}
