package com.rebenew.listeningRooms.syncserver.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DeliveryRecordTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    private static final Duration RETENTION = Duration.ofSeconds(30);

    @Test
    void eventoCriticoEsperaConfirmacionTrasEnviarse() {
        DeliveryRecord record = record(EventPriority.CRITICAL);

        record.markSent(T0);

        assertEquals(DeliveryOutcome.PENDING, record.getOutcome());
        assertTrue(record.markConfirmed(T0.plusSeconds(1)));
        assertFalse(record.markFailed(T0.plusSeconds(2)));
        assertEquals(DeliveryOutcome.CONFIRMED, record.getOutcome());
    }

    @Test
    void eventoNormalQuedaEntregadoSinConfirmacion() {
        DeliveryRecord record = record(EventPriority.NORMAL);

        record.markSent(T0);

        assertEquals(DeliveryOutcome.DELIVERED, record.getOutcome());
        assertFalse(record.expireIfUnconfirmed(RETENTION, T0.plusSeconds(60)));
    }

    @Test
    void soloExpiraLoQueYaSeEnvio() {
        DeliveryRecord record = record(EventPriority.HIGH);

        assertFalse(record.expireIfUnconfirmed(RETENTION, T0.plusSeconds(60)));

        record.markSent(T0);
        assertFalse(record.expireIfUnconfirmed(RETENTION, T0.plusSeconds(30)));
        assertTrue(record.expireIfUnconfirmed(RETENTION, T0.plusSeconds(31)));
        assertFalse(record.isPurgeable(RETENTION, T0.plusSeconds(31)));
        assertTrue(record.isPurgeable(RETENTION, T0.plusSeconds(62)));
    }

    @Test
    void guardaSalaSoloParaEventosDeSala() {
        assertEquals("r1", record(EventPriority.LOW).getRoomId());
        BroadcastEvent userEvent = BroadcastEvent.create(EventType.ERROR, EventScope.user("alice"),
                EventPriority.CRITICAL, Map.of(), T0, RETENTION);
        assertNull(new DeliveryRecord(userEvent, "c1", "alice").getRoomId());
    }

    private static DeliveryRecord record(EventPriority priority) {
        BroadcastEvent event = BroadcastEvent.create(EventType.TRACK_ADDED, EventScope.room("r1"),
                priority, Map.of(), T0, RETENTION);
        return new DeliveryRecord(event, "c1", "alice");
    }
}
