package com.queueserve.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Cart populated with current menu data, as shown to the customer before checkout.
 *
 * <p>Totals use live menu prices. The order created from this cart takes its own
 * price snapshot at creation time, so these figures are only a preview.
 */
@Value
@Builder
public class CartSummary {

    String ownerRef;
    List<Line> items;
    BigDecimal grandTotal;
    int itemCount;
    LocalDateTime updatedAt;

    @Value
    @Builder
    public static class Line {
        MenuItem menuItem;
        int quantity;
        BigDecimal lineTotal;
    }
}
