package com.ai.intake.config;

import com.ai.intake.websocket.MediaStreamHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Exposes the Twilio media stream socket. Twilio connects from its own hosts, so any origin is accepted.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final MediaStreamHandler mediaStreamHandler;
    private final String mediaStreamPath;

    public WebSocketConfig(MediaStreamHandler mediaStreamHandler,
                           @Value("${twilio.media-stream-path:/media-stream}") String mediaStreamPath) {
        this.mediaStreamHandler = mediaStreamHandler;
        this.mediaStreamPath = mediaStreamPath;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(mediaStreamHandler, mediaStreamPath)
                .setAllowedOrigins("*");
    }
}
