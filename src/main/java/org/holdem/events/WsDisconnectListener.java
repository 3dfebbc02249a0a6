package org.holdem.events;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.holdem.service.PokerTableService;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.security.Principal;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Feeds socket presence into seating. A player may have several sessions
 * (tabs); the seat counts as disconnected only when the last one closes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WsDisconnectListener {

    private final PokerTableService service;
    private final Map<String, Integer> sessions = new ConcurrentHashMap<>();

    @EventListener
    public void onConnected(SessionConnectedEvent e) {
        Principal p = e.getUser();
        if (p == null) return;
        int open = sessions.merge(p.getName(), 1, Integer::sum);
        if (open == 1) service.markReconnected(p.getName());
    }

    @EventListener
    public void onDisconnect(SessionDisconnectEvent e) {
        Principal p = e.getUser();
        if (p == null) return;
        Integer left = sessions.computeIfPresent(p.getName(), (k, n) -> n <= 1 ? null : n - 1);
        if (left == null) {
            log.debug("{} has no open session left", p.getName());
            service.markDisconnected(p.getName());
        }
    }
}
