package com.queueserve.api.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartItemRequest {

    @NotBlank(message = "menuItemId is required")
    private String menuItemId;

    @Min(value = 1, message = "Quantity must be at least 1")
    private int quantity;
}
