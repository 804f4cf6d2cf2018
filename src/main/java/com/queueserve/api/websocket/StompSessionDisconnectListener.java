package com.queueserve.api.websocket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

/**
 * Clears subscription bookkeeping when a STOMP session ends, including abrupt
 * disconnects (tab closed, network drop) that never send a DISCONNECT frame.
 */
@Component
public class StompSessionDisconnectListener {

    private static final Logger log = LoggerFactory.getLogger(StompSessionDisconnectListener.class);

    private final QueueSubscriptionInterceptor queueSubscriptionInterceptor;

    public StompSessionDisconnectListener(QueueSubscriptionInterceptor queueSubscriptionInterceptor) {
        this.queueSubscriptionInterceptor = queueSubscriptionInterceptor;
    }

    @EventListener
    public void onSessionDisconnect(SessionDisconnectEvent event) {
        String sessionId = event.getSessionId();
        log.debug("STOMP session disconnected: {}", sessionId);
        queueSubscriptionInterceptor.handleDisconnect(sessionId);
    }
}
