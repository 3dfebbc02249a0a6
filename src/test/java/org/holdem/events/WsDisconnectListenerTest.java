package org.holdem.events;

import org.holdem.service.PokerTableService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.Message;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.security.Principal;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WsDisconnectListenerTest {

    @Mock
    private PokerTableService service;

    @InjectMocks
    private WsDisconnectListener listener;

    private final Principal alice = new UsernamePasswordAuthenticationToken("alice", null);
    private final Message<byte[]> frame = MessageBuilder.withPayload(new byte[0]).build();

    private SessionConnectedEvent connected(Principal p) {
        return new SessionConnectedEvent(this, frame, p);
    }

    private SessionDisconnectEvent closed(String session, Principal p) {
        return new SessionDisconnectEvent(this, frame, session, CloseStatus.NORMAL, p);
    }

    @Test
    void firstSession_marksReconnected() {
        listener.onConnected(connected(alice));
        listener.onConnected(connected(alice));

        verify(service, times(1)).markReconnected("alice");
    }

    @Test
    void disconnect_onlyWhenLastSessionCloses() {
        listener.onConnected(connected(alice));
        listener.onConnected(connected(alice));

        listener.onDisconnect(closed("s1", alice));
        verify(service, never()).markDisconnected(any());

        listener.onDisconnect(closed("s2", alice));
        verify(service).markDisconnected("alice");
    }

    @Test
    void anonymousSessions_areIgnored() {
        listener.onConnected(connected(null));
        listener.onDisconnect(closed("s1", null));

        verifyNoInteractions(service);
    }
}
