package com.queueserve.queue;

import com.queueserve.domain.model.Order;
import com.queueserve.domain.model.QueueEntry;
import com.queueserve.domain.model.QueueSnapshot;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalInt;
import org.springframework.stereotype.Component;

/**
 * Derives queue positions from a set of active orders.
 *
 * <p>Position is never stored. rank(o) = 1 + number of active orders with a smaller
 * creation key. Because creation keys are unique, ranks over a snapshot are exactly
 * 1..n with no gaps or ties.
 */
@Component
public class QueuePositionCalculator {

    /**
     * Returns the 1-based rank of {@code order} among {@code activeOrders}, or empty if the
     * order itself is no longer active (READY or COMPLETED orders have no position).
     */
    public OptionalInt rank(Order order, Collection<Order> activeOrders) {
        if (!order.isActive()) {
            return OptionalInt.empty();
        }
        long ahead = activeOrders.stream()
                .filter(Order::isActive)
                .filter(other -> other.getCreationKey() < order.getCreationKey())
                .count();
        return OptionalInt.of((int) ahead + 1);
    }

    /**
     * Same as {@link #rank} but boxed, with null for "no position". Used for API payloads.
     */
    public Integer positionOrNull(Order order, Collection<Order> activeOrders) {
        OptionalInt rank = rank(order, activeOrders);
        return rank.isPresent() ? rank.getAsInt() : null;
    }

    /**
     * Ranks every active order in one pass and returns them in ascending rank order.
     * Inactive orders in the input are ignored.
     */
    public QueueSnapshot snapshot(Collection<Order> activeOrders, LocalDateTime takenAt) {
        List<Order> sorted = activeOrders.stream()
                .filter(Order::isActive)
                .sorted(Comparator.comparingLong(Order::getCreationKey))
                .toList();

        List<QueueEntry> entries = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            Order order = sorted.get(i);
            entries.add(QueueEntry.builder()
                    .orderId(order.getId())
                    .status(order.getStatus())
                    .displayName(order.getDisplayName())
                    .queuePosition(i + 1)
                    .build());
        }
        return QueueSnapshot.builder()
                .entries(List.copyOf(entries))
                .takenAt(takenAt)
                .build();
    }
}
