package com.queueserve.api.dto.response;

import com.queueserve.domain.enums.OrderStatus;
import com.queueserve.domain.model.LineItem;
import com.queueserve.domain.model.Order;
import com.queueserve.domain.model.QueuedOrder;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * REST view of an order. {@code queuePosition} is the live 1-based rank while the order
 * is PENDING or PREPARING and null otherwise; history listings leave it null.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderResponse {

    private String id;
    private String ownerRef;
    private String customerName;
    private List<LineItem> items;
    private BigDecimal totalAmount;
    private OrderStatus status;
    private Integer queuePosition;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static OrderResponse from(QueuedOrder queuedOrder) {
        OrderResponse response = from(queuedOrder.getOrder());
        response.setQueuePosition(queuedOrder.getQueuePosition());
        return response;
    }

    public static OrderResponse from(Order order) {
        return OrderResponse.builder()
                .id(order.getId())
                .ownerRef(order.getOwnerRef())
                .customerName(order.getDisplayName())
                .items(order.getLineItems())
                .totalAmount(order.getTotalAmount())
                .status(order.getStatus())
                .createdAt(order.getCreatedAt())
                .updatedAt(order.getUpdatedAt())
                .build();
    }
}
