package com.queueserve.queue;

/**
 * Routing keys understood by {@link QueueTransport}.
 *
 * <ul>
 *   <li>{@code global} -- every connected observer (live queue board)</li>
 *   <li>{@code order:{id}} -- subscribers watching one order</li>
 *   <li>{@code kitchen} -- the staff display</li>
 * </ul>
 */
public final class QueueChannel {

    public static final String GLOBAL = "global";
    public static final String KITCHEN = "kitchen";
    public static final String ORDER_PREFIX = "order:";

    private QueueChannel() {}

    public static String forOrder(String orderId) {
        return ORDER_PREFIX + orderId;
    }

    public static boolean isOrderChannel(String channelKey) {
        return channelKey != null && channelKey.startsWith(ORDER_PREFIX);
    }

    public static String orderIdOf(String channelKey) {
        if (!isOrderChannel(channelKey)) {
            throw new IllegalArgumentException("Not an order channel: " + channelKey);
        }
        return channelKey.substring(ORDER_PREFIX.length());
    }
}
