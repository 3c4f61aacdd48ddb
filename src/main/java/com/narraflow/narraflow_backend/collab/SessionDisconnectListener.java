package com.narraflow.narraflow_backend.collab;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

/** Frees the leases of a WebSocket session as soon as its connection closes. */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionDisconnectListener {

    private final CollaborationService collaborationService;

    @EventListener
    public void onDisconnect(SessionDisconnectEvent event) {
        log.debug("WebSocket session {} closed ({})", event.getSessionId(), event.getCloseStatus());
        collaborationService.disconnect(event.getSessionId());
    }
}
