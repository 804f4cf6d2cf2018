package com.queueserve.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartCheckoutRequest {

    /** Name shown on the queue board; supplied by the identity layer on the client. */
    @NotBlank(message = "Customer name is required")
    @Size(max = 100, message = "Customer name must be 100 characters or less")
    private String customerName;
}
