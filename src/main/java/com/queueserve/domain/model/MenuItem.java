package com.queueserve.domain.model;

import com.queueserve.domain.enums.MenuCategory;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * A catalog entry. Only available items can be ordered or added to a cart.
 */
@Data
@Builder(toBuilder = true)
public class MenuItem {

    private String id;
    private String name;
    private String description;
    private BigDecimal price;
    private MenuCategory category;

    @Builder.Default
    private boolean available = true;

    private String imageUrl;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
