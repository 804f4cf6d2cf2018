package com.queueserve.observability;

import com.queueserve.domain.enums.OrderStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Service;

/**
 * Custom Micrometer metrics for the order queue.
 *
 * <ul>
 *   <li><b>orders.created.count</b> (counter)</li>
 *   <li><b>orders.transitions.count</b> (counter, tag {@code to})</li>
 *   <li><b>queue.broadcast.count</b> (counter): completed broadcast cycles</li>
 *   <li><b>queue.broadcast.failures.count</b> (counter): individual publishes that failed</li>
 *   <li><b>queue.active.size</b> (gauge): active orders in the latest broadcast snapshot</li>
 * </ul>
 */
@Service
public class QueueMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter ordersCreatedCounter;
    private final Counter broadcastCounter;
    private final Counter broadcastFailureCounter;
    private final AtomicInteger activeQueueSize = new AtomicInteger();

    public QueueMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.ordersCreatedCounter = Counter.builder("orders.created.count")
                .description("Orders accepted into the queue")
                .register(meterRegistry);

        this.broadcastCounter = Counter.builder("queue.broadcast.count")
                .description("Queue snapshots published")
                .register(meterRegistry);

        this.broadcastFailureCounter = Counter.builder("queue.broadcast.failures.count")
                .description("Realtime publishes that failed and were dropped")
                .register(meterRegistry);

        meterRegistry.gauge("queue.active.size", activeQueueSize);
    }

    public void recordOrderCreated() {
        ordersCreatedCounter.increment();
    }

    public void recordTransition(OrderStatus to) {
        Counter.builder("orders.transitions.count")
                .description("Applied order status transitions")
                .tag("to", to.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordBroadcast(int activeOrders) {
        broadcastCounter.increment();
        activeQueueSize.set(activeOrders);
    }

    public void recordBroadcastFailure() {
        broadcastFailureCounter.increment();
    }

    public int getActiveQueueSize() {
        return activeQueueSize.get();
    }
}
