package com.queueserve.unit.queue;

import static org.assertj.core.api.Assertions.assertThat;

import com.queueserve.domain.enums.OrderStatus;
import com.queueserve.domain.model.Order;
import com.queueserve.domain.model.QueueEntry;
import com.queueserve.domain.model.QueueSnapshot;
import com.queueserve.queue.QueuePositionCalculator;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for QueuePositionCalculator ranking and snapshots.
 */
class QueuePositionCalculatorTest {

    private final QueuePositionCalculator calculator = new QueuePositionCalculator();

    private static Order order(String id, long key, OrderStatus status) {
        return Order.builder().id(id).displayName("name-" + id).creationKey(key).status(status).build();
    }

    @Test
    @DisplayName("rank is one plus the number of active orders created earlier")
    void rank_countsEarlierActiveOrders() {
        Order a = order("A", 10, OrderStatus.PENDING);
        Order b = order("B", 20, OrderStatus.PREPARING);
        Order c = order("C", 30, OrderStatus.PENDING);
        List<Order> active = List.of(a, b, c);

        assertThat(calculator.rank(a, active)).hasValue(1);
        assertThat(calculator.rank(b, active)).hasValue(2);
        assertThat(calculator.rank(c, active)).hasValue(3);
    }

    @Test
    @DisplayName("READY and COMPLETED orders have no position and do not count")
    void inactiveOrders_noPosition() {
        Order ready = order("R", 5, OrderStatus.READY);
        Order done = order("D", 6, OrderStatus.COMPLETED);
        Order pending = order("P", 7, OrderStatus.PENDING);
        List<Order> mixed = List.of(ready, done, pending);

        assertThat(calculator.rank(ready, mixed)).isEmpty();
        assertThat(calculator.positionOrNull(done, mixed)).isNull();
        assertThat(calculator.rank(pending, mixed)).hasValue(1);
    }

    @Test
    @DisplayName("status of earlier orders does not change rank as long as they are active")
    void preparingAndPending_rankedTogether() {
        Order a = order("A", 1, OrderStatus.PREPARING);
        Order b = order("B", 2, OrderStatus.PENDING);

        assertThat(calculator.rank(b, List.of(a, b))).hasValue(2);
    }

    @Test
    @DisplayName("snapshot ranks are 1..n in creation order regardless of input order")
    void snapshot_isPermutationInvariant() {
        List<Order> orders = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            orders.add(order("o" + i, 1000 + i * 7L, i % 2 == 0 ? OrderStatus.PENDING : OrderStatus.PREPARING));
        }
        List<String> expectedOrder = orders.stream().map(Order::getId).collect(Collectors.toList());

        Random random = new Random(42);
        for (int round = 0; round < 10; round++) {
            List<Order> shuffled = new ArrayList<>(orders);
            Collections.shuffle(shuffled, random);

            QueueSnapshot snapshot = calculator.snapshot(shuffled, LocalDateTime.now());

            assertThat(snapshot.getEntries()).extracting(QueueEntry::getOrderId).containsExactlyElementsOf(expectedOrder);
            for (int i = 0; i < snapshot.size(); i++) {
                assertThat(snapshot.getEntries().get(i).getQueuePosition()).isEqualTo(i + 1);
            }
        }
    }

    @Test
    @DisplayName("snapshot skips inactive orders without leaving gaps")
    void snapshot_skipsInactive() {
        List<Order> orders = List.of(
                order("A", 1, OrderStatus.PENDING),
                order("B", 2, OrderStatus.READY),
                order("C", 3, OrderStatus.PREPARING));

        QueueSnapshot snapshot = calculator.snapshot(orders, LocalDateTime.now());

        assertThat(snapshot.size()).isEqualTo(2);
        assertThat(snapshot.entryFor("C")).get().extracting(QueueEntry::getQueuePosition).isEqualTo(2);
        assertThat(snapshot.entryFor("B")).isEmpty();
    }

    @Test
    @DisplayName("empty active set gives an empty snapshot")
    void snapshot_empty() {
        QueueSnapshot snapshot = calculator.snapshot(List.of(), LocalDateTime.now());

        assertThat(snapshot.getEntries()).isEmpty();
    }
}
