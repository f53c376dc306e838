package com.rebenew.listeningRooms.syncserver.scheduler;

import com.rebenew.listeningRooms.syncserver.config.ListeningRoomsProperties;
import com.rebenew.listeningRooms.syncserver.core.EventBroadcaster;
import com.rebenew.listeningRooms.syncserver.core.RoomManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Tarea periódica de mantenimiento: conexiones inactivas, conexiones sin autenticar,
 * entregas sin confirmar y salas vacías. Cada paso falla por separado.
 */
@Component
public class MaintenanceScheduler {
    private static final Logger logger = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final RoomManager roomManager;
    private final EventBroadcaster broadcaster;
    private final ListeningRoomsProperties properties;

    public MaintenanceScheduler(RoomManager roomManager, EventBroadcaster broadcaster,
            ListeningRoomsProperties properties) {
        this.roomManager = roomManager;
        this.broadcaster = broadcaster;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${listening-rooms.maintenance.interval:PT30S}",
            initialDelayString = "${listening-rooms.maintenance.interval:PT30S}")
    public void runMaintenance() {
        int stale = 0;
        int unauthenticated = 0;
        int expired = 0;
        int destroyed = 0;

        try {
            stale = roomManager.sweepStaleConnections(properties.getConnections().getStaleTimeout());
        } catch (RuntimeException e) {
            logger.error("🚨 Error limpiando conexiones inactivas: {}", e.getMessage(), e);
        }
        try {
            unauthenticated = roomManager.reapUnauthenticated(properties.getConnections().getAuthTimeout());
        } catch (RuntimeException e) {
            logger.error("🚨 Error cerrando conexiones sin autenticar: {}", e.getMessage(), e);
        }
        try {
            expired = broadcaster.cleanupStaleEvents();
        } catch (RuntimeException e) {
            logger.error("🚨 Error limpiando entregas: {}", e.getMessage(), e);
        }
        try {
            destroyed = roomManager.cleanupStaleData(properties.getRooms().getEmptyRoomTtl());
        } catch (RuntimeException e) {
            logger.error("🚨 Error limpiando salas: {}", e.getMessage(), e);
        }

        if (stale + unauthenticated + expired + destroyed > 0) {
            logger.info("🧹 Mantenimiento: {} inactivas, {} sin autenticar, {} entregas expiradas, {} salas eliminadas",
                    stale, unauthenticated, expired, destroyed);
        } else {
            logger.debug("Mantenimiento sin cambios");
        }
    }
}
