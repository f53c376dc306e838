package com.rebenew.listeningRooms.syncserver.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Foto puntual de los contadores del broadcaster.
 */
@Getter
@AllArgsConstructor
public class BroadcastStatistics {
    private final long totalEvents;
    private final long successfulDeliveries;
    private final long failedDeliveries;
    private final long expiredDeliveries;
    private final long confirmedDeliveries;
    private final long retriedDeliveries;
    private final double successRate;
    private final Map<String, Long> eventsByType;
    private final Map<String, Long> eventsByRoom;
    private final int pendingEvents;
    private final long serverTime;

    // Porcentaje con dos decimales; 0 cuando todavía no hubo entregas
    public static double successRate(long successful, long failed) {
        long total = successful + failed;
        if (total == 0)
            return 0.0;
        return BigDecimal.valueOf(successful * 100.0 / total)
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
