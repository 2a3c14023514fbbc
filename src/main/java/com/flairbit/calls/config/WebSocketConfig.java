package com.flairbit.calls.config;

import com.flairbit.calls.security.FlairbitTokenVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.config.ChannelRegistration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

import java.util.Objects;

/**
 * STOMP endpoint used by call clients for signaling pushes ({@code /user/queue/signals}) and by
 * dashboards for lifecycle events ({@code /topic/calls.*}) and role alerts
 * ({@code /topic/escalations.*}). The CONNECT frame carries the bearer token; its subject
 * becomes the session principal that user destinations resolve against.
 */
@Slf4j
@Configuration
@EnableWebSocketMessageBroker
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    private final FlairbitTokenVerifier tokenVerifier;

    @Value("${app.websocket.broker-type:embedded}")
    private String brokerType;

    @Value("${stomp.relay.host:localhost}")
    private String relayHost;

    @Value("${stomp.relay.port:61613}")
    private int relayPort;

    @Value("${stomp.relay.client-login:guest}")
    private String relayLogin;

    @Value("${stomp.relay.client-passcode:guest}")
    private String relayPasscode;

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        if ("relay".equalsIgnoreCase(brokerType)) {
            registry.enableStompBrokerRelay("/topic", "/queue")
                    .setRelayHost(relayHost)
                    .setRelayPort(relayPort)
                    .setClientLogin(relayLogin)
                    .setClientPasscode(relayPasscode);
        } else {
            registry.enableSimpleBroker("/topic", "/queue");
        }
        registry.setApplicationDestinationPrefixes("/app");
        registry.setUserDestinationPrefix("/user");
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws").setAllowedOriginPatterns("*").withSockJS();
    }

    @Override
    public void configureClientInboundChannel(ChannelRegistration registration) {
        registration.interceptors(new ChannelInterceptor() {
            @Override
            public Message<?> preSend(Message<?> message, MessageChannel channel) {
                StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
                if (Objects.isNull(accessor) || accessor.getCommand() != StompCommand.CONNECT) {
                    return message;
                }
                String header = accessor.getFirstNativeHeader("Authorization");
                if (Objects.isNull(header) || !header.startsWith("Bearer ")) {
                    throw new MessageDeliveryException("STOMP CONNECT without bearer token");
                }
                try {
                    accessor.setUser(tokenVerifier.authenticate(header.substring(7)));
                } catch (SecurityException e) {
                    log.debug("Rejected STOMP CONNECT: {}", e.getMessage());
                    throw new MessageDeliveryException("STOMP authentication failed: " + e.getMessage());
                }
                return message;
            }
        });
    }
}
