package com.rebenew.listeningRooms.syncserver.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebenew.listeningRooms.syncserver.auth.ConfiguredTokenValidator;
import com.rebenew.listeningRooms.syncserver.auth.TokenValidator;
import com.rebenew.listeningRooms.syncserver.core.ConnectionRegistry;
import com.rebenew.listeningRooms.syncserver.core.EventBroadcaster;
import com.rebenew.listeningRooms.syncserver.core.RoomManager;
import com.rebenew.listeningRooms.syncserver.model.AuthPrincipal;
import com.rebenew.listeningRooms.syncserver.repository.InMemoryRoomRepository;
import com.rebenew.listeningRooms.syncserver.repository.RoomRepository;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;

// Cablea los tres servicios del núcleo con sus colaboradores explícitos.

@Configuration
public class RealtimeCoreConfig {

    @Bean
    @ConditionalOnMissingBean(TokenValidator.class)
    public TokenValidator tokenValidator(ListeningRoomsProperties properties) {
        Map<String, AuthPrincipal> principals = new LinkedHashMap<>();
        properties.getAuth().getTokens().forEach((token, entry) ->
                principals.put(token, new AuthPrincipal(entry.getUserId(), entry.getDisplayName())));
        return new ConfiguredTokenValidator(principals);
    }

    @Bean
    @ConditionalOnMissingBean(RoomRepository.class)
    public RoomRepository roomRepository() {
        return new InMemoryRoomRepository();
    }

    @Bean(destroyMethod = "shutdown")
    public ConnectionRegistry connectionRegistry(TokenValidator tokenValidator,
            @Qualifier("authExecutor") ExecutorService authExecutor, ListeningRoomsProperties properties, Clock clock) {
        return new ConnectionRegistry(tokenValidator, authExecutor,
                properties.getConnections().getAuthTimeout(), clock);
    }

    @Bean(destroyMethod = "shutdown")
    public EventBroadcaster eventBroadcaster(ConnectionRegistry registry, ObjectMapper objectMapper,
            Clock clock, ListeningRoomsProperties properties) {
        return new EventBroadcaster(registry, objectMapper, clock, properties.getEvents().getRetention());
    }

    @Bean(destroyMethod = "shutdown")
    public RoomManager roomManager(ConnectionRegistry registry, EventBroadcaster broadcaster,
            RoomRepository repository, Clock clock, ListeningRoomsProperties properties) {
        return new RoomManager(registry, broadcaster, repository, clock, properties.getRooms().getSnapshotTtl());
    }
}
