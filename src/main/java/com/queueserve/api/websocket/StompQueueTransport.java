package com.queueserve.api.websocket;

import com.queueserve.exception.NotificationDeliveryException;
import com.queueserve.queue.QueueChannel;
import com.queueserve.queue.QueueTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * {@link QueueTransport} over the STOMP simple broker.
 *
 * <p>Channel keys map to destinations:
 * <ul>
 *   <li>{@code global} -> {@code /topic/queue}</li>
 *   <li>{@code kitchen} -> {@code /topic/kitchen}</li>
 *   <li>{@code order:{id}} -> {@code /topic/orders/{id}}</li>
 * </ul>
 */
@Component
public class StompQueueTransport implements QueueTransport {

    private static final Logger log = LoggerFactory.getLogger(StompQueueTransport.class);

    public static final String QUEUE_TOPIC = "/topic/queue";
    public static final String KITCHEN_TOPIC = "/topic/kitchen";
    public static final String ORDER_TOPIC_PREFIX = "/topic/orders/";

    private final SimpMessagingTemplate simpMessagingTemplate;

    public StompQueueTransport(SimpMessagingTemplate simpMessagingTemplate) {
        this.simpMessagingTemplate = simpMessagingTemplate;
    }

    @Override
    public void publish(String channelKey, String messageType, Object payload) {
        String destination = destinationFor(channelKey);
        try {
            simpMessagingTemplate.convertAndSend(destination, WebSocketMessage.of(messageType, payload));
            log.debug("Sent {} to {}", messageType, destination);
        } catch (Exception e) {
            throw new NotificationDeliveryException(channelKey, e);
        }
    }

    static String destinationFor(String channelKey) {
        if (QueueChannel.GLOBAL.equals(channelKey)) {
            return QUEUE_TOPIC;
        }
        if (QueueChannel.KITCHEN.equals(channelKey)) {
            return KITCHEN_TOPIC;
        }
        return ORDER_TOPIC_PREFIX + QueueChannel.orderIdOf(channelKey);
    }
}
