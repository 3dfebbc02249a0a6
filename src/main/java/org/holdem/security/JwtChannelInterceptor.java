package org.holdem.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Authenticates STOMP CONNECT frames. The principal name is the player id, so
 * {@code convertAndSendToUser(playerId, ...)} reaches the right sessions.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtChannelInterceptor implements ChannelInterceptor {

    private final JwtUtil jwtUtil;

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor acc = StompHeaderAccessor.wrap(message);
        acc.setLeaveMutable(true);

        if (StompCommand.CONNECT.equals(acc.getCommand())) {
            String token = extractToken(acc);
            if (token == null || !jwtUtil.validateToken(token)) {
                // fails the CONNECT; the broker answers with an ERROR frame
                throw new IllegalArgumentException("Invalid or missing JWT token");
            }
            String playerId = jwtUtil.extractSubject(token);
            Authentication auth = new UsernamePasswordAuthenticationToken(playerId, null, List.of());
            acc.setUser(auth);
            SecurityContextHolder.getContext().setAuthentication(auth);
            log.info("ws CONNECT session={} player={}", acc.getSessionId(), playerId);
        } else if (acc.getUser() instanceof Authentication a) {
            SecurityContextHolder.getContext().setAuthentication(a);
        } else {
            SecurityContextHolder.clearContext();
        }
        return MessageBuilder.createMessage(message.getPayload(), acc.getMessageHeaders());
    }

    String extractToken(StompHeaderAccessor acc) {
        List<String> auths = acc.getNativeHeader("Authorization");
        if (auths != null && !auths.isEmpty()) {
            String t = JwtFilter.bearer(auths.get(0));
            if (t != null) return t;
        }
        List<String> toks = acc.getNativeHeader("token");
        if (toks != null && !toks.isEmpty()) return toks.get(0);

        Map<String, Object> attrs = acc.getSessionAttributes();
        if (attrs != null && attrs.get(JwtHandshakeInterceptor.TOKEN_ATTR) instanceof String s && !s.isBlank()) {
            return s;
        }
        return null;
    }
}
