package com.queueserve.exception;

/**
 * Raised by a {@link com.queueserve.queue.QueueTransport} when a publish fails.
 * Always caught by the broadcaster; never surfaces to the request that triggered the broadcast.
 */
public class NotificationDeliveryException extends BaseException {

    public NotificationDeliveryException(String channelKey, Throwable cause) {
        super(ErrorCode.NOTIFICATION_DELIVERY_FAILED, "Failed to publish to channel " + channelKey, cause);
    }
}
