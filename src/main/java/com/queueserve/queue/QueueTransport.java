package com.queueserve.queue;

/**
 * Publish side of the realtime channel. The broadcaster only knows channel keys
 * ({@link QueueChannel}) and message types; how they reach clients is up to the implementation.
 */
public interface QueueTransport {

    /**
     * Publishes one message to a channel.
     *
     * @param channelKey  {@code global}, {@code kitchen} or {@code order:{id}}
     * @param messageType discriminator the client routes on (e.g. "QUEUE_UPDATE")
     * @param payload     message body, serialized by the transport
     * @throws com.queueserve.exception.NotificationDeliveryException if the publish fails
     */
    void publish(String channelKey, String messageType, Object payload);
}
