package com.queueserve.domain.model;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Value;

/**
 * The active queue as read in one pass: every PENDING/PREPARING order ranked
 * 1..n by creation key, in ascending rank order.
 *
 * <p>All channels of one broadcast cycle are derived from the same snapshot.
 */
@Value
@Builder
public class QueueSnapshot {

    List<QueueEntry> entries;
    LocalDateTime takenAt;

    public int size() {
        return entries.size();
    }

    public Optional<QueueEntry> entryFor(String orderId) {
        return entries.stream().filter(e -> e.getOrderId().equals(orderId)).findFirst();
    }
}
