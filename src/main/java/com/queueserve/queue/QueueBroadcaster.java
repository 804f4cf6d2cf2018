package com.queueserve.queue;

import com.queueserve.domain.enums.OrderStatus;
import com.queueserve.domain.model.Order;
import com.queueserve.domain.model.QueueEntry;
import com.queueserve.domain.model.QueueSnapshot;
import com.queueserve.event.OrderEvent;
import com.queueserve.event.OrderEventType;
import com.queueserve.exception.NotificationDeliveryException;
import com.queueserve.observability.QueueMetricsService;
import com.queueserve.repository.OrderRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Fans the live queue out to every audience after anything that can change it.
 *
 * <p>Each cycle reads the active orders once, ranks them, and publishes that single
 * snapshot to:
 * <ul>
 *   <li>{@code global} -- full board as {@code QUEUE_UPDATE}</li>
 *   <li>{@code order:{id}} -- each active order's own position as {@code QUEUE_POSITION}</li>
 *   <li>{@code kitchen} -- full board as {@code KITCHEN_QUEUE}</li>
 * </ul>
 * When an order has just become READY, its channel first gets a one-shot
 * {@code ORDER_READY} notice and a final {@code QUEUE_POSITION} with a null position;
 * after that it is absent from snapshots.
 *
 * <p>Runs on the bounded {@code broadcastExecutor} after the triggering transaction commits,
 * so the snapshot sees the change and the request thread never waits on delivery. Workers
 * take turns: one cycle at a time, so publishes leave in the order their snapshots were read.
 * Snapshots are complete and supersede each other, so a dropped or failed publish is
 * corrected by the next cycle. Delivery failures are logged and counted, never rethrown.
 */
@Component
public class QueueBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(QueueBroadcaster.class);

    public static final String QUEUE_UPDATE = "QUEUE_UPDATE";
    public static final String QUEUE_POSITION = "QUEUE_POSITION";
    public static final String KITCHEN_QUEUE = "KITCHEN_QUEUE";
    public static final String ORDER_READY = "ORDER_READY";

    private final OrderRepository orderRepository;
    private final QueuePositionCalculator queuePositionCalculator;
    private final QueueTransport queueTransport;
    private final QueueMetricsService queueMetricsService;
    private final Clock clock;

    /** Held for a whole cycle: ready notice, read, rank and publish. */
    private final ReentrantLock broadcastLock = new ReentrantLock();

    public QueueBroadcaster(
            OrderRepository orderRepository,
            QueuePositionCalculator queuePositionCalculator,
            QueueTransport queueTransport,
            QueueMetricsService queueMetricsService,
            Clock clock) {
        this.orderRepository = orderRepository;
        this.queuePositionCalculator = queuePositionCalculator;
        this.queueTransport = queueTransport;
        this.queueMetricsService = queueMetricsService;
        this.clock = clock;
    }

    @Async("broadcastExecutor")
    @TransactionalEventListener(fallbackExecution = true)
    public void onOrderEvent(OrderEvent orderEvent) {
        Order order = orderEvent.getOrder();
        log.debug("Queue broadcast triggered by {} on order {}", orderEvent.getEventType(), order.getId());

        broadcastLock.lock();
        try {
            if (orderEvent.getEventType() == OrderEventType.READY) {
                announceReady(order);
            }
            broadcast();
        } finally {
            broadcastLock.unlock();
        }
    }

    /**
     * Reads the active set once and publishes it to all three audiences. Cycles never
     * interleave, so a snapshot read before a change cannot be published after one read
     * after it.
     *
     * @return the snapshot that was published
     */
    public QueueSnapshot broadcast() {
        broadcastLock.lock();
        try {
            return publishSnapshot();
        } finally {
            broadcastLock.unlock();
        }
    }

    private QueueSnapshot publishSnapshot() {
        List<Order> activeOrders = orderRepository.findActive();
        QueueSnapshot snapshot = queuePositionCalculator.snapshot(activeOrders, LocalDateTime.now(clock));
        List<QueueEntry> board = snapshot.getEntries();

        publishQuietly(QueueChannel.GLOBAL, QUEUE_UPDATE, board);
        for (QueueEntry entry : board) {
            publishQuietly(
                    QueueChannel.forOrder(entry.getOrderId()),
                    QUEUE_POSITION,
                    positionPayload(entry.getOrderId(), entry.getStatus(), entry.getQueuePosition()));
        }
        publishQuietly(QueueChannel.KITCHEN, KITCHEN_QUEUE, board);

        queueMetricsService.recordBroadcast(snapshot.size());
        log.debug("Queue snapshot published: {} active orders", snapshot.size());
        return snapshot;
    }

    private void announceReady(Order order) {
        String channelKey = QueueChannel.forOrder(order.getId());

        Map<String, Object> notice = new LinkedHashMap<>();
        notice.put("orderId", order.getId());
        notice.put("displayName", order.getDisplayName());
        publishQuietly(channelKey, ORDER_READY, notice);

        publishQuietly(channelKey, QUEUE_POSITION, positionPayload(order.getId(), order.getStatus(), null));
        log.info("Order {} ready for pickup ({})", order.getId(), order.getDisplayName());
    }

    private Map<String, Object> positionPayload(String orderId, OrderStatus status, Integer queuePosition) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("orderId", orderId);
        payload.put("status", status != null ? status.name() : null);
        payload.put("queuePosition", queuePosition);
        return payload;
    }

    private void publishQuietly(String channelKey, String messageType, Object payload) {
        try {
            queueTransport.publish(channelKey, messageType, payload);
        } catch (NotificationDeliveryException e) {
            queueMetricsService.recordBroadcastFailure();
            log.warn("Failed to publish {} to {}: {}", messageType, channelKey, e.getMessage());
        }
    }
}
