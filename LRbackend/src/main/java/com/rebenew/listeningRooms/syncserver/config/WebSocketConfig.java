package com.rebenew.listeningRooms.syncserver.config;

import com.rebenew.listeningRooms.syncserver.websocket.RoomSyncWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final RoomSyncWebSocketHandler roomSyncWebSocketHandler;
    private final ListeningRoomsProperties properties;

    public WebSocketConfig(RoomSyncWebSocketHandler roomSyncWebSocketHandler, ListeningRoomsProperties properties) {
        this.roomSyncWebSocketHandler = roomSyncWebSocketHandler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        ListeningRoomsProperties.Websocket websocket = properties.getWebsocket();
        registry.addHandler(roomSyncWebSocketHandler, websocket.getPath())
                .setAllowedOriginPatterns(websocket.getAllowedOrigins().toArray(new String[0]));
    }
}
