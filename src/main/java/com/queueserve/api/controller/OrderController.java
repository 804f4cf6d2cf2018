package com.queueserve.api.controller;

import com.queueserve.api.dto.request.CartCheckoutRequest;
import com.queueserve.api.dto.request.OrderLineRequest;
import com.queueserve.api.dto.request.PlaceOrderRequest;
import com.queueserve.api.dto.request.StatusUpdateRequest;
import com.queueserve.api.dto.response.OrderResponse;
import com.queueserve.domain.enums.OrderStatus;
import com.queueserve.domain.model.ItemSelection;
import com.queueserve.domain.model.QueueSnapshot;
import com.queueserve.service.OrderService;
import jakarta.validation.Valid;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for placing and tracking orders.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/orders} -- guest checkout</li>
 *   <li>{@code POST /api/orders/from-cart} -- checkout the caller's cart</li>
 *   <li>{@code GET /api/orders/active} -- active orders in queue order (staff)</li>
 *   <li>{@code GET /api/orders/queue} -- current queue snapshot</li>
 *   <li>{@code GET /api/orders/history} -- past orders, optional status/date filter (staff)</li>
 *   <li>{@code GET /api/orders/my} -- the caller's orders with live positions</li>
 *   <li>{@code GET /api/orders/{id}} -- one order with its live position</li>
 *   <li>{@code PATCH /api/orders/{id}/status} -- advance an order (staff)</li>
 * </ul>
 *
 * <p>The caller's customer id arrives in the {@value #CUSTOMER_HEADER} header, set by the
 * identity layer in front of this service.
 */
@RestController
@RequestMapping("/api/orders")
public class OrderController {

    public static final String CUSTOMER_HEADER = "X-Customer-Id";

    private final OrderService orderService;

    public OrderController(OrderService orderService) {
        this.orderService = orderService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public OrderResponse placeOrder(
            @RequestHeader(value = CUSTOMER_HEADER, required = false) String customerId,
            @RequestBody @Valid PlaceOrderRequest request) {
        List<ItemSelection> selections = request.getItems() == null
                ? List.of()
                : request.getItems().stream().map(OrderController::toSelection).collect(Collectors.toList());
        return OrderResponse.from(orderService.placeOrder(request.getCustomerName(), customerId, selections));
    }

    @PostMapping("/from-cart")
    @ResponseStatus(HttpStatus.CREATED)
    public OrderResponse placeOrderFromCart(
            @RequestHeader(CUSTOMER_HEADER) String customerId, @RequestBody @Valid CartCheckoutRequest request) {
        return OrderResponse.from(orderService.placeOrderFromCart(customerId, request.getCustomerName()));
    }

    @GetMapping("/active")
    public List<OrderResponse> getActiveOrders() {
        return orderService.listActive().stream().map(OrderResponse::from).collect(Collectors.toList());
    }

    @GetMapping("/queue")
    public QueueSnapshot getQueue() {
        return orderService.getQueueSnapshot();
    }

    @GetMapping("/history")
    public List<OrderResponse> getHistory(
            @RequestParam(required = false) OrderStatus status,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return orderService.listHistory(status, date).stream()
                .map(OrderResponse::from)
                .collect(Collectors.toList());
    }

    @GetMapping("/my")
    public List<OrderResponse> getMyOrders(
            @RequestHeader(CUSTOMER_HEADER) String customerId, @RequestParam(required = false) OrderStatus status) {
        return orderService.listByOwner(customerId, status).stream()
                .map(OrderResponse::from)
                .collect(Collectors.toList());
    }

    @GetMapping("/{id}")
    public OrderResponse getOrder(@PathVariable String id) {
        return OrderResponse.from(orderService.getOrder(id));
    }

    @PatchMapping("/{id}/status")
    public OrderResponse updateStatus(@PathVariable String id, @RequestBody @Valid StatusUpdateRequest request) {
        return OrderResponse.from(orderService.advanceStatus(id, request.getStatus()));
    }

    private static ItemSelection toSelection(OrderLineRequest line) {
        return ItemSelection.of(line.getMenuItemId(), line.getQuantity());
    }
}
