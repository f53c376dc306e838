package com.rebenew.listeningRooms.syncserver.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuración del servidor de salas, prefijo {@code listening-rooms}.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "listening-rooms")
public class ListeningRoomsProperties {

    @Valid
    private Connections connections = new Connections();
    @Valid
    private Events events = new Events();
    @Valid
    private Rooms rooms = new Rooms();
    @Valid
    private Maintenance maintenance = new Maintenance();
    @Valid
    private Auth auth = new Auth();
    @Valid
    private Websocket websocket = new Websocket();
    @Valid
    private Cors cors = new Cors();

    @Getter
    @Setter
    public static class Connections {
        @NotNull
        private Duration staleTimeout = Duration.ofMinutes(5);
        // también es la gracia para autenticarse tras conectar
        @NotNull
        private Duration authTimeout = Duration.ofSeconds(5);
    }

    @Getter
    @Setter
    public static class Events {
        @NotNull
        private Duration retention = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Rooms {
        @NotNull
        private Duration emptyRoomTtl = Duration.ofHours(1);
        @NotNull
        private Duration snapshotTtl = Duration.ofSeconds(5);
    }

    @Getter
    @Setter
    public static class Maintenance {
        @NotNull
        private Duration interval = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Auth {
        // token → identidad, solo para el validador por defecto
        private Map<String, TokenEntry> tokens = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class TokenEntry {
        @NotBlank
        private String userId;
        private String displayName;
    }

    @Getter
    @Setter
    public static class Websocket {
        @NotBlank
        private String path = "/ws/rooms";
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
        private int maxTextMessageBufferSize = 8192;
    }

    @Getter
    @Setter
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:4200", "http://localhost:8080"));
    }
}
