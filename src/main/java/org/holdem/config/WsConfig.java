package org.holdem.config;

import org.holdem.security.JwtChannelInterceptor;
import org.holdem.security.JwtHandshakeInterceptor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.ChannelRegistration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.config.annotation.*;

/**
 * STOMP over WebSocket. Browsers connect to {@code /ws} (SockJS), bots and
 * native clients to {@code /ws-native}. Both authenticate with the JWT.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WsConfig implements WebSocketMessageBrokerConfigurer {

    private final JwtChannelInterceptor jwtChannelInterceptor;
    private final JwtHandshakeInterceptor jwtHandshakeInterceptor;

    @Value("${app.cors.allowed-origins:http://localhost:4200}")
    private String allowedOrigins;

    @Value("${app.ws.heartbeat-ms:10000}")
    private long heartbeatMs;

    public WsConfig(JwtChannelInterceptor ch, JwtHandshakeInterceptor hs) {
        this.jwtChannelInterceptor = ch;
        this.jwtHandshakeInterceptor = hs;
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        String[] origins = allowedOrigins.split("\\s*,\\s*");
        registry.addEndpoint("/ws")
                .addInterceptors(jwtHandshakeInterceptor)
                .setAllowedOriginPatterns(origins)
                .withSockJS();
        registry.addEndpoint("/ws-native")
                .addInterceptors(jwtHandshakeInterceptor)
                .setAllowedOriginPatterns(origins);
    }

    @Override
    public void configureWebSocketTransport(WebSocketTransportRegistration registry) {
        // a full table snapshot with ten seats stays well under this
        registry.setMessageSizeLimit(64 * 1024)
                .setSendBufferSizeLimit(1024 * 1024)
                .setSendTimeLimit(15_000);
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        ThreadPoolTaskScheduler heartbeat = new ThreadPoolTaskScheduler();
        heartbeat.setPoolSize(1);
        heartbeat.setThreadNamePrefix("ws-heartbeat-");
        heartbeat.initialize();

        registry.enableSimpleBroker("/topic", "/queue")
                .setTaskScheduler(heartbeat)
                .setHeartbeatValue(new long[]{heartbeatMs, heartbeatMs});
        registry.setApplicationDestinationPrefixes("/app");
        registry.setUserDestinationPrefix("/user");
    }

    @Override
    public void configureClientInboundChannel(ChannelRegistration registration) {
        registration.interceptors(jwtChannelInterceptor);
    }
}
