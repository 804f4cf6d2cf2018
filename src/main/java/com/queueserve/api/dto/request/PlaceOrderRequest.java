package com.queueserve.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Guest checkout: the customer's name for the queue board plus the lines to order.
 * An empty {@code items} list is rejected by the service as EMPTY_ORDER, not here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaceOrderRequest {

    @NotBlank(message = "Customer name is required")
    @Size(max = 100, message = "Customer name must be 100 characters or less")
    private String customerName;

    @Valid
    @Builder.Default
    private List<OrderLineRequest> items = new ArrayList<>();
}
