package com.queueserve.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.queueserve.domain.enums.OrderStatus;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * A customer order placed against the menu.
 *
 * <p>Line items are a price snapshot taken from the menu when the order was created,
 * and totalAmount is computed once from that snapshot. Later menu edits (price changes,
 * deletions) never reach an existing order.
 *
 * <p>The creationKey is the only ordering key for queue position. It is assigned by
 * {@link com.queueserve.queue.CreationKeySequencer} and is strictly increasing in
 * creation order; createdAt/updatedAt are informational only.
 */
@Data
@Builder(toBuilder = true)
public class Order {

    private String id;

    /** Registered customer who placed the order. Null for guest orders. */
    private String ownerRef;

    /** Name shown on the queue board and the kitchen display. */
    private String displayName;

    @Builder.Default
    private List<LineItem> lineItems = List.of();

    private BigDecimal totalAmount;

    private OrderStatus status;

    private long creationKey;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    /** True while the order holds a queue position (PENDING or PREPARING). */
    @JsonIgnore
    public boolean isActive() {
        return status != null && status.isActive();
    }
}
