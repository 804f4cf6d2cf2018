package com.queueserve.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.queueserve.domain.enums.OrderStatus;
import com.queueserve.observability.QueueMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QueueMetricsServiceTest {

    private SimpleMeterRegistry registry;
    private QueueMetricsService metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new QueueMetricsService(registry);
    }

    @Test
    void countsCreatedOrders() {
        metrics.recordOrderCreated();
        metrics.recordOrderCreated();

        assertThat(registry.get("orders.created.count").counter().count()).isEqualTo(2.0);
    }

    @Test
    void tagsTransitionsByTargetStatus() {
        metrics.recordTransition(OrderStatus.PREPARING);
        metrics.recordTransition(OrderStatus.READY);
        metrics.recordTransition(OrderStatus.READY);

        assertThat(registry.get("orders.transitions.count").tag("to", "READY").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("orders.transitions.count").tag("to", "PREPARING").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void broadcastUpdatesGaugeToLatestSnapshotSize() {
        metrics.recordBroadcast(5);
        metrics.recordBroadcast(3);

        assertThat(registry.get("queue.broadcast.count").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("queue.active.size").gauge().value()).isEqualTo(3.0);
        assertThat(metrics.getActiveQueueSize()).isEqualTo(3);
    }

    @Test
    void countsBroadcastFailures() {
        metrics.recordBroadcastFailure();

        assertThat(registry.get("queue.broadcast.failures.count").counter().count()).isEqualTo(1.0);
    }
}
