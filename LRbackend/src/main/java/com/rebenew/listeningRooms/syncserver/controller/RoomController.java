package com.rebenew.listeningRooms.syncserver.controller;

import com.rebenew.listeningRooms.syncserver.core.RoomManager;
import com.rebenew.listeningRooms.syncserver.model.CreateRoomRequest;
import com.rebenew.listeningRooms.syncserver.model.GlobalStatistics;
import com.rebenew.listeningRooms.syncserver.model.RoomStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Superficie HTTP mínima del núcleo de salas.
 * Los errores del dominio los traduce GlobalExceptionHandler.
 *
 * Flujo principal:
 * 1. Se crea la sala → 2. Se comparte el roomId → 3. Los usuarios se unen vía WebSocket
 */
@RestController
@RequestMapping("/rooms")
public class RoomController {
    private static final Logger logger = LoggerFactory.getLogger(RoomController.class);

    private final RoomManager roomManager;

    public RoomController(RoomManager roomManager) {
        this.roomManager = roomManager;
    }

    /**
     * Crea una sala vacía.
     *
     * @param request {"senderId": "alice", "roomId": "opcional", "name": "opcional"}
     * @return {"roomId": "..."} con 201
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> create(@RequestBody CreateRoomRequest request) {
        logger.info("📝 Solicitud de creación de sala para senderId: {}", request.getSenderId());
        String roomId = roomManager.createRoom(request.getSenderId(), request.toConfig());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("roomId", roomId));
    }

    // Snapshot actual de la sala (participantes, cola y reproducción)
    @GetMapping("/{roomId}/state")
    public ResponseEntity<Map<String, Object>> state(@PathVariable String roomId) {
        return ResponseEntity.ok(roomManager.getRoomState(roomId).toSummary());
    }

    @GetMapping("/{roomId}/stats")
    public ResponseEntity<RoomStatistics> stats(@PathVariable String roomId) {
        return ResponseEntity.ok(roomManager.getRoomStatistics(roomId));
    }

    /**
     * Estado global del servicio: salas, conexiones y contadores de entrega.
     */
    @GetMapping("/status")
    public ResponseEntity<GlobalStatistics> status() {
        return ResponseEntity.ok(roomManager.getGlobalStatistics());
    }
}
