package com.queueserve.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One line of an order: the menu item's name and price as they were at order time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LineItem {

    private String menuItemId;
    private String name;
    private int quantity;
    private BigDecimal unitPrice;

    public BigDecimal lineTotal() {
        return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }
}
