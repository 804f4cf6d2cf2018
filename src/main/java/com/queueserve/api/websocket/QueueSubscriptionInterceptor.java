package com.queueserve.api.websocket;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.stereotype.Component;

/**
 * Watches STOMP SUBSCRIBE/UNSUBSCRIBE/DISCONNECT frames on the inbound channel and keeps
 * a per-session record of which queue topics each client follows.
 *
 * <p>Bookkeeping only: the broker delivers to subscribers regardless of this state, and
 * every frame is passed through unchanged.
 *
 * <p>Abrupt disconnects never send a DISCONNECT frame, so
 * {@link StompSessionDisconnectListener} also calls {@link #handleDisconnect(String)}.
 */
@Component
public class QueueSubscriptionInterceptor implements ChannelInterceptor {

    private static final Logger log = LoggerFactory.getLogger(QueueSubscriptionInterceptor.class);

    /**
     * sessionId -> (subscriptionId -> destination). UNSUBSCRIBE frames only carry the
     * subscription id.
     */
    private final Map<String, Map<String, String>> sessionSubscriptions = new ConcurrentHashMap<>();

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(message);
        StompCommand command = accessor.getCommand();
        if (command == null) {
            return message;
        }

        switch (command) {
            case SUBSCRIBE -> handleSubscribe(accessor);
            case UNSUBSCRIBE -> handleUnsubscribe(accessor);
            case DISCONNECT -> {
                String sessionId = accessor.getSessionId();
                if (sessionId != null) {
                    handleDisconnect(sessionId);
                }
            }
            default -> {
                // other frames are not tracked
            }
        }
        return message;
    }

    private void handleSubscribe(StompHeaderAccessor accessor) {
        String destination = accessor.getDestination();
        String sessionId = accessor.getSessionId();
        String subscriptionId = accessor.getSubscriptionId();
        if (!isQueueTopic(destination) || sessionId == null || subscriptionId == null) {
            return;
        }

        sessionSubscriptions
                .computeIfAbsent(sessionId, k -> new ConcurrentHashMap<>())
                .put(subscriptionId, destination);
        log.debug("STOMP SUBSCRIBE: session={}, destination={}", sessionId, destination);
    }

    private void handleUnsubscribe(StompHeaderAccessor accessor) {
        String sessionId = accessor.getSessionId();
        String subscriptionId = accessor.getSubscriptionId();
        if (sessionId == null || subscriptionId == null) {
            return;
        }

        Map<String, String> subscriptions = sessionSubscriptions.get(sessionId);
        if (subscriptions == null) {
            return;
        }
        String destination = subscriptions.remove(subscriptionId);
        if (subscriptions.isEmpty()) {
            sessionSubscriptions.remove(sessionId);
        }
        if (destination != null) {
            log.debug("STOMP UNSUBSCRIBE: session={}, destination={}", sessionId, destination);
        }
    }

    /**
     * Drops every subscription recorded for the session. Safe to call more than once.
     */
    public void handleDisconnect(String sessionId) {
        Map<String, String> subscriptions = sessionSubscriptions.remove(sessionId);
        if (subscriptions != null && !subscriptions.isEmpty()) {
            log.info("STOMP DISCONNECT: session={}, cleaned up {} subscriptions", sessionId, subscriptions.size());
        }
    }

    /** Number of live subscriptions to the given destination across all sessions. */
    public long countSubscribers(String destination) {
        return sessionSubscriptions.values().stream()
                .flatMap(subscriptions -> subscriptions.values().stream())
                .filter(destination::equals)
                .count();
    }

    /** Copy of all session -> destination mappings, for diagnostics. */
    public Map<String, Map<String, String>> getSessionSubscriptions() {
        return Map.copyOf(sessionSubscriptions);
    }

    private boolean isQueueTopic(String destination) {
        return destination != null
                && (destination.equals(StompQueueTransport.QUEUE_TOPIC)
                        || destination.equals(StompQueueTransport.KITCHEN_TOPIC)
                        || destination.startsWith(StompQueueTransport.ORDER_TOPIC_PREFIX));
    }
}
