package com.queueserve.api.dto.request;

import com.queueserve.domain.enums.MenuCategory;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update of a menu item. Null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MenuItemUpdateRequest {

    @Size(max = 100, message = "Name must be 100 characters or less")
    private String name;

    private String description;

    @DecimalMin(value = "0.0", message = "Price must be a non-negative number")
    private BigDecimal price;

    private MenuCategory category;
    private Boolean available;
    private String imageUrl;
}
