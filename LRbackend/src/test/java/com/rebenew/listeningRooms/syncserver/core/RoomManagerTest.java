package com.rebenew.listeningRooms.syncserver.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebenew.listeningRooms.syncserver.exception.AlreadyExistsException;
import com.rebenew.listeningRooms.syncserver.exception.AuthException;
import com.rebenew.listeningRooms.syncserver.exception.RoomNotFoundException;
import com.rebenew.listeningRooms.syncserver.model.*;
import com.rebenew.listeningRooms.syncserver.repository.InMemoryRoomRepository;
import com.rebenew.listeningRooms.syncserver.support.MutableClock;
import com.rebenew.listeningRooms.syncserver.support.RecordingTransportHandle;
import com.rebenew.listeningRooms.syncserver.support.StubTokenValidator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RoomManagerTest {

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

    private MutableClock clock;
    private ExecutorService authExecutor;
    private ConnectionRegistry registry;
    private EventBroadcaster broadcaster;
    private InMemoryRoomRepository repository;
    private RoomManager manager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        authExecutor = Executors.newSingleThreadExecutor();
        registry = new ConnectionRegistry(new StubTokenValidator(), authExecutor, Duration.ofSeconds(2), clock);
        broadcaster = new EventBroadcaster(registry, mapper, clock, Duration.ofSeconds(30));
        repository = new InMemoryRoomRepository();
        manager = new RoomManager(registry, broadcaster, repository, clock, Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        authExecutor.shutdownNow();
    }

    // ========== CREACIÓN ==========

    @Test
    void creaSalaVaciaConIdGenerado() {
        String roomId = manager.createRoom("owner", new RoomConfig(null, "Viernes"));

        assertEquals(8, roomId.length());
        RoomStateSnapshot state = manager.getRoomState(roomId);
        assertEquals(RoomState.IDLE, state.getState());
        assertEquals("Viernes", state.getName());
        assertEquals("owner", state.getOwnerId());
        assertEquals(0, state.getParticipantCount());
    }

    @Test
    void idRepetidoEsConflicto() {
        manager.createRoom("owner", RoomConfig.withId("r1"));

        assertThrows(AlreadyExistsException.class, () -> manager.createRoom("otro", RoomConfig.withId("r1")));
    }

    @Test
    void ownerVacioEsInvalido() {
        assertThrows(IllegalArgumentException.class, () -> manager.createRoom(" ", null));
    }

    // ========== MEMBRESÍA ==========

    @Test
    void joinEsIdempotente() throws Exception {
        manager.createRoom("owner", RoomConfig.withId("r1"));
        RecordingTransportHandle watcher = new RecordingTransportHandle("W");
        manager.attachConnection(connect("bob", watcher), "r1");

        assertTrue(manager.joinRoom("r1", "alice"));
        assertFalse(manager.joinRoom("r1", "alice"));

        assertEquals(2, manager.getRoomState("r1").getParticipantCount());
        assertEquals(1, count(watcher, "user_joined"));
    }

    @Test
    void joinEnSalaInexistenteFalla() {
        assertThrows(RoomNotFoundException.class, () -> manager.joinRoom("nope", "alice"));
    }

    @Test
    void unirseAOtraSalaAbandonaLaAnterior() {
        manager.createRoom("owner", RoomConfig.withId("r1"));
        manager.createRoom("owner", RoomConfig.withId("r2"));
        manager.joinRoom("r1", "alice");

        manager.joinRoom("r2", "alice");

        assertEquals(0, manager.getRoomState("r1").getParticipantCount());
        assertEquals(RoomState.IDLE, manager.getRoomState("r1").getState());
        assertEquals(1, manager.getRoomState("r2").getParticipantCount());
        assertEquals("r2", manager.currentRoomOf("alice").orElseThrow());
    }

    @Test
    void leaveDeUsuarioAusenteNoHaceNada() {
        manager.createRoom("owner", RoomConfig.withId("r1"));

        assertFalse(manager.leaveRoom("r1", "ghost"));
        assertThrows(RoomNotFoundException.class, () -> manager.leaveRoom("nope", "ghost"));
    }

    @Test
    void joinsConcurrentesNoPierdenParticipantes() throws Exception {
        manager.createRoom("owner", RoomConfig.withId("r1"));
        int users = 50;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Throwable> errors = new ArrayList<>();
        try {
            for (int i = 0; i < users; i++) {
                String userId = "user-" + i;
                pool.submit(() -> {
                    try {
                        start.await();
                        manager.joinRoom("r1", userId);
                    } catch (Throwable t) {
                        synchronized (errors) {
                            errors.add(t);
                        }
                    }
                });
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertTrue(errors.isEmpty(), () -> "errores: " + errors);
        assertEquals(users, manager.getRoomState("r1").getParticipantCount());
    }

    @Test
    void joinsSimultaneosDelMismoUsuarioLoDejanEnUnaSolaSala() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int i = 0; i < 300; i++) {
                String a = "a-" + i;
                String b = "b-" + i;
                String userId = "u-" + i;
                manager.createRoom("owner", RoomConfig.withId(a));
                manager.createRoom("owner", RoomConfig.withId(b));

                CyclicBarrier barrier = new CyclicBarrier(2);
                Future<Boolean> first = pool.submit(() -> {
                    barrier.await();
                    return manager.joinRoom(a, userId);
                });
                Future<Boolean> second = pool.submit(() -> {
                    barrier.await();
                    return manager.joinRoom(b, userId);
                });
                first.get(5, TimeUnit.SECONDS);
                second.get(5, TimeUnit.SECONDS);

                int inA = manager.getRoomState(a).getParticipantCount();
                int inB = manager.getRoomState(b).getParticipantCount();
                assertEquals(1, inA + inB, "usuario " + userId + " en ambas salas");
                assertEquals(inA == 1 ? a : b, manager.currentRoomOf(userId).orElse(null));

                assertTrue(manager.handleUserDisconnect(userId));
                assertEquals(0, manager.getRoomState(a).getParticipantCount());
                assertEquals(0, manager.getRoomState(b).getParticipantCount());
            }
        } finally {
            pool.shutdownNow();
        }
    }

    // ========== SNAPSHOTS ==========

    @Test
    void snapshotSeReutilizaHastaQueLaSalaCambia() {
        manager.createRoom("owner", RoomConfig.withId("r1"));

        RoomStateSnapshot first = manager.getRoomState("r1");
        assertSame(first, manager.getRoomState("r1"));

        manager.joinRoom("r1", "alice");
        RoomStateSnapshot afterJoin = manager.getRoomState("r1");
        assertNotSame(first, afterJoin);
        assertEquals(1, afterJoin.getParticipantCount());
    }

    @Test
    void notifyRoomChangedRefrescaDatosDelRepositorio() {
        manager.createRoom("owner", RoomConfig.withId("r1"));
        manager.getRoomState("r1");

        repository.saveQueue("r1", List.of(new TrackEntry("t1", "Song", "alice", 1L)));
        manager.notifyRoomChanged("r1");

        RoomStateSnapshot state = manager.getRoomState("r1");
        assertEquals(1, state.getTrackCount());
        assertEquals("t1", state.getQueue().get(0).trackId());
    }

    @Test
    void snapshotVencidoSeRecalcula() {
        manager.createRoom("owner", RoomConfig.withId("r1"));
        RoomStateSnapshot first = manager.getRoomState("r1");

        clock.advance(Duration.ofSeconds(6));

        assertNotSame(first, manager.getRoomState("r1"));
    }

    // ========== LIMPIEZA ==========

    @Test
    void salaVaciaSigueDisponibleHastaElTtl() {
        manager.createRoom("owner", RoomConfig.withId("r1"));
        manager.joinRoom("r1", "alice");
        manager.leaveRoom("r1", "alice");

        clock.advance(Duration.ofMinutes(59));
        assertEquals(0, manager.cleanupStaleData(Duration.ofHours(1)));
        assertEquals(RoomState.IDLE, manager.getRoomState("r1").getState());

        clock.advance(Duration.ofMinutes(2));
        assertEquals(1, manager.cleanupStaleData(Duration.ofHours(1)));
        assertThrows(RoomNotFoundException.class, () -> manager.getRoomState("r1"));
    }

    @Test
    void salaActivaNoSeDestruye() {
        manager.createRoom("owner", RoomConfig.withId("r1"));
        manager.joinRoom("r1", "alice");

        clock.advance(Duration.ofHours(3));

        assertEquals(0, manager.cleanupStaleData(Duration.ofHours(1)));
        assertEquals(RoomState.ACTIVE, manager.getRoomState("r1").getState());
    }

    @Test
    void destruirSalaLiberaConexionesYRepositorio() {
        manager.createRoom("owner", RoomConfig.withId("r1"));
        String conn = connect("alice");
        manager.attachConnection(conn, "r1");
        manager.leaveRoom("r1", "alice");
        repository.saveQueue("r1", List.of(new TrackEntry("t1", "Song", "alice", 1L)));

        clock.advance(Duration.ofHours(2));
        manager.cleanupStaleData(Duration.ofHours(1));

        assertTrue(registry.connectionsFor("r1").isEmpty());
        assertTrue(repository.findQueue("r1").isEmpty());
    }

    // ========== CONEXIONES ==========

    @Test
    void trackAgregadoLlegaATodosYSePuedeConfirmar() throws Exception {
        manager.createRoom("owner", RoomConfig.withId("R1"));
        RecordingTransportHandle handleA = new RecordingTransportHandle("A");
        RecordingTransportHandle handleB = new RecordingTransportHandle("B");
        String connA = connect("a", handleA);
        String connB = connect("b", handleB);
        manager.attachConnection(connA, "R1");
        manager.attachConnection(connB, "R1");

        assertTrue(broadcaster.broadcastToRoom("R1", EventType.TRACK_ADDED, Map.of("track", "t1")));

        assertEquals(1, count(handleA, "track_added"));
        assertEquals(1, count(handleB, "track_added"));
        JsonNode toA = findLast(handleA, "track_added");
        assertEquals("t1", toA.get("payload").get("track").asText());

        long confirmedBefore = broadcaster.getStatistics().getConfirmedDeliveries();
        assertTrue(broadcaster.confirmDelivery(toA.get("event_id").asText(), "a"));
        assertEquals(confirmedBefore + 1, broadcaster.getStatistics().getConfirmedDeliveries());
    }

    @Test
    void desconexionAvisaAlRestoDeLaSala() throws Exception {
        manager.createRoom("owner", RoomConfig.withId("r1"));
        RecordingTransportHandle handleB = new RecordingTransportHandle("B");
        String connA = connect("a");
        String connB = connect("b", handleB);
        manager.attachConnection(connA, "r1");
        manager.attachConnection(connB, "r1");

        manager.handleConnectionClosed(connA);

        assertNotNull(findLast(handleB, "user_left"));
        assertNotNull(findLast(handleB, "user_disconnected"));
        assertEquals(1, manager.getRoomState("r1").getParticipantCount());
        assertTrue(manager.currentRoomOf("a").isEmpty());
    }

    @Test
    void reconexionConservaLaSalaYSigueRecibiendoEventos() throws Exception {
        manager.createRoom("owner", RoomConfig.withId("r1"));
        String oldConn = connect("alice");
        manager.attachConnection(oldConn, "r1");

        RecordingTransportHandle fresh = new RecordingTransportHandle("nuevo");
        String newConn = connect("alice", fresh);
        manager.handleConnectionClosed(oldConn);

        assertEquals(1, manager.getRoomState("r1").getParticipantCount());
        assertEquals(Optional.of("r1"), manager.currentRoomOf("alice"));
        assertEquals(Set.of(newConn), registry.connectionsFor("r1"));

        assertTrue(broadcaster.broadcastToRoom("r1", EventType.TRACK_ADDED, Map.of("track", "t2")));
        assertEquals(1, count(fresh, "track_added"));
    }

    @Test
    void cierreDeConexionReemplazadaNoSacaAlUsuario() {
        manager.createRoom("owner", RoomConfig.withId("r1"));
        String oldConn = connect("alice");
        manager.attachConnection(oldConn, "r1");

        String newConn = registry.register(new RecordingTransportHandle("nueva"));
        registry.authenticate(newConn, "token-alice");
        manager.handleConnectionClosed(oldConn);

        assertEquals(1, manager.getRoomState("r1").getParticipantCount());
        assertEquals("r1", manager.currentRoomOf("alice").orElseThrow());
    }

    @Test
    void conexionesInactivasSacanAlUsuario() {
        manager.createRoom("owner", RoomConfig.withId("r1"));
        manager.attachConnection(connect("alice"), "r1");

        clock.advance(Duration.ofMinutes(6));
        assertEquals(1, manager.sweepStaleConnections(Duration.ofMinutes(5)));

        assertEquals(0, manager.getRoomState("r1").getParticipantCount());
    }

    @Test
    void handleUserDisconnectSinSalaDevuelveFalso() {
        assertFalse(manager.handleUserDisconnect("nadie"));
    }

    @Test
    void attachConnectionRequiereAutenticacion() {
        manager.createRoom("owner", RoomConfig.withId("r1"));
        String anonymous = registry.register(new RecordingTransportHandle("anon"));

        assertThrows(AuthException.class, () -> manager.attachConnection(anonymous, "r1"));
    }

    @Test
    void detachConnectionSacaAlUsuarioDeLaSala() {
        manager.createRoom("owner", RoomConfig.withId("r1"));
        String conn = connect("alice");
        manager.attachConnection(conn, "r1");

        assertEquals("r1", manager.detachConnection(conn).orElseThrow());

        assertEquals(0, manager.getRoomState("r1").getParticipantCount());
        assertTrue(manager.detachConnection(conn).isEmpty());
    }

    @Test
    void broadcastRoomStateEnviaSnapshot() throws Exception {
        manager.createRoom("owner", RoomConfig.withId("r1"));
        RecordingTransportHandle handle = new RecordingTransportHandle("A");
        manager.attachConnection(connect("alice", handle), "r1");

        assertTrue(manager.broadcastRoomState("r1", null));

        JsonNode event = findLast(handle, "room_state_updated");
        assertNotNull(event);
        assertEquals("high", event.get("priority").asText());
        assertEquals(1, event.get("payload").get("room").get("participantCount").asInt());
    }

    // ========== ESTADÍSTICAS ==========

    @Test
    void estadisticasGlobalesYPorSala() {
        manager.createRoom("owner", RoomConfig.withId("r1"));
        manager.createRoom("owner", RoomConfig.withId("r2"));
        manager.attachConnection(connect("alice"), "r1");
        manager.joinRoom("r1", "bob");

        GlobalStatistics global = manager.getGlobalStatistics();
        assertEquals(2, global.getTotalRooms());
        assertEquals(1, global.getActiveRooms());
        assertEquals(1, global.getIdleRooms());
        assertEquals(2, global.getTotalParticipants());
        assertEquals(1, global.getConnections().getAuthenticatedConnections());

        clock.advance(Duration.ofSeconds(90));
        RoomStatistics room = manager.getRoomStatistics("r1");
        assertEquals(2, room.getParticipantCount());
        assertEquals(1, room.getLiveConnections());
        assertEquals(90_000L, room.getUptimeMs());
    }

    private String connect(String userId) {
        return connect(userId, new RecordingTransportHandle("t-" + userId));
    }

    private String connect(String userId, RecordingTransportHandle handle) {
        String id = registry.register(handle);
        registry.authenticate(id, "token-" + userId);
        return id;
    }

    private int count(RecordingTransportHandle handle, String type) throws Exception {
        int count = 0;
        for (String json : handle.getSent()) {
            if (type.equals(mapper.readTree(json).get("type").asText()))
                count++;
        }
        return count;
    }

    private JsonNode findLast(RecordingTransportHandle handle, String type) throws Exception {
        JsonNode found = null;
        for (String json : handle.getSent()) {
            JsonNode node = mapper.readTree(json);
            if (type.equals(node.get("type").asText()))
                found = node;
        }
        return found;
    }
}
