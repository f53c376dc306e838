package com.rebenew.listeningRooms.syncserver.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableConfigurationProperties(ListeningRoomsProperties.class)
public class AppConfig {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // Validación de tokens fuera de los hilos del transporte, con espera acotada
    @Bean(destroyMethod = "shutdown")
    public ExecutorService authExecutor() {
        return Executors.newFixedThreadPool(2);
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer(ListeningRoomsProperties properties) {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(properties.getWebsocket().getMaxTextMessageBufferSize());
        container.setMaxBinaryMessageBufferSize(8192);
        container.setMaxSessionIdleTimeout(properties.getConnections().getStaleTimeout().toMillis());
        return container;
    }
}
