package com.queueserve.unit.controller;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.queueserve.api.controller.OrderController;
import com.queueserve.config.ApiResponseAdvice;
import com.queueserve.domain.enums.OrderStatus;
import com.queueserve.domain.model.LineItem;
import com.queueserve.domain.model.Order;
import com.queueserve.domain.model.QueuedOrder;
import com.queueserve.exception.EmptyOrderException;
import com.queueserve.exception.GlobalExceptionHandler;
import com.queueserve.exception.InvalidTransitionException;
import com.queueserve.exception.OrderConflictException;
import com.queueserve.exception.ResourceNotFoundException;
import com.queueserve.exception.UnavailableItemException;
import com.queueserve.service.OrderService;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for OrderController: response envelope, queue positions,
 * and the HTTP mapping of every order failure.
 */
@ExtendWith(MockitoExtension.class)
class OrderControllerTest {

    private MockMvc mockMvc;

    @Mock
    private OrderService orderService;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new OrderController(orderService))
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
    }

    private Order order(String id, OrderStatus status) {
        return Order.builder()
                .id(id)
                .displayName("Ana")
                .lineItems(List.of(new LineItem("burger", "Burger", 2, new BigDecimal("8.50"))))
                .totalAmount(new BigDecimal("17.00"))
                .status(status)
                .creationKey(42L)
                .createdAt(LocalDateTime.of(2026, 3, 1, 12, 0))
                .build();
    }

    @Nested
    @DisplayName("POST /api/orders")
    class PlaceOrder {

        @Test
        @DisplayName("returns 201 with the order and its queue position")
        void placeOrder_created() throws Exception {
            when(orderService.placeOrder(eq("Ana"), isNull(), anyList()))
                    .thenReturn(QueuedOrder.of(order("o1", OrderStatus.PENDING), 3));

            mockMvc.perform(post("/api/orders")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"customerName\":\"Ana\",\"items\":[{\"menuItemId\":\"burger\",\"quantity\":2}]}"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data.id").value("o1"))
                    .andExpect(jsonPath("$.data.customerName").value("Ana"))
                    .andExpect(jsonPath("$.data.status").value("PENDING"))
                    .andExpect(jsonPath("$.data.queuePosition").value(3))
                    .andExpect(jsonPath("$.data.items[0].unitPrice").value(8.50))
                    .andExpect(jsonPath("$.data.totalAmount").value(17.00));
        }

        @Test
        @DisplayName("blank customer name is a validation error")
        void blankName_validationError() throws Exception {
            mockMvc.perform(post("/api/orders")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"customerName\":\"\",\"items\":[{\"menuItemId\":\"burger\",\"quantity\":1}]}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));

            verifyNoInteractions(orderService);
        }

        @Test
        @DisplayName("zero quantity is a validation error")
        void zeroQuantity_validationError() throws Exception {
            mockMvc.perform(post("/api/orders")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"customerName\":\"Ana\",\"items\":[{\"menuItemId\":\"burger\",\"quantity\":0}]}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
        }

        @Test
        @DisplayName("empty order maps to 422 EMPTY_ORDER")
        void emptyOrder_unprocessable() throws Exception {
            when(orderService.placeOrder(eq("Ana"), isNull(), anyList()))
                    .thenThrow(new EmptyOrderException("Order must contain at least one item."));

            mockMvc.perform(post("/api/orders")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"customerName\":\"Ana\",\"items\":[]}"))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.error.code").value("EMPTY_ORDER"));
        }

        @Test
        @DisplayName("unavailable item maps to 422 ITEM_UNAVAILABLE with the item name")
        void unavailableItem_unprocessable() throws Exception {
            when(orderService.placeOrder(eq("Ana"), isNull(), anyList()))
                    .thenThrow(new UnavailableItemException("soup", "Soup"));

            mockMvc.perform(post("/api/orders")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"customerName\":\"Ana\",\"items\":[{\"menuItemId\":\"soup\",\"quantity\":1}]}"))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.error.code").value("ITEM_UNAVAILABLE"))
                    .andExpect(jsonPath("$.error.details.name").value("Soup"));
        }
    }

    @Nested
    @DisplayName("POST /api/orders/from-cart")
    class PlaceFromCart {

        @Test
        @DisplayName("uses the customer header as owner")
        void fromCart_usesHeader() throws Exception {
            when(orderService.placeOrderFromCart("cust-1", "Ana"))
                    .thenReturn(QueuedOrder.of(order("o2", OrderStatus.PENDING), 1));

            mockMvc.perform(post("/api/orders/from-cart")
                            .header(OrderController.CUSTOMER_HEADER, "cust-1")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"customerName\":\"Ana\"}"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.data.id").value("o2"));
        }

        @Test
        @DisplayName("missing customer header is a bad request")
        void missingHeader_badRequest() throws Exception {
            mockMvc.perform(post("/api/orders/from-cart")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"customerName\":\"Ana\"}"))
                    .andExpect(status().isBadRequest());

            verifyNoInteractions(orderService);
        }
    }

    @Nested
    @DisplayName("Reads")
    class Reads {

        @Test
        @DisplayName("GET /{id} returns a null position for a READY order")
        void getOrder_readyHasNullPosition() throws Exception {
            when(orderService.getOrder("o1")).thenReturn(QueuedOrder.of(order("o1", OrderStatus.READY), null));

            mockMvc.perform(get("/api/orders/o1"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.status").value("READY"))
                    .andExpect(jsonPath("$.data.queuePosition").value(nullValue()));
        }

        @Test
        @DisplayName("GET /{id} for an unknown order is 404")
        void getOrder_notFound() throws Exception {
            when(orderService.getOrder("nope")).thenThrow(new ResourceNotFoundException("Order", "nope"));

            mockMvc.perform(get("/api/orders/nope"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error.code").value("NOT_FOUND"))
                    .andExpect(jsonPath("$.error.path").value("/api/orders/nope"));
        }

        @Test
        @DisplayName("GET /active lists orders with positions")
        void getActive() throws Exception {
            when(orderService.listActive())
                    .thenReturn(List.of(
                            QueuedOrder.of(order("o1", OrderStatus.PREPARING), 1),
                            QueuedOrder.of(order("o2", OrderStatus.PENDING), 2)));

            mockMvc.perform(get("/api/orders/active"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data", hasSize(2)))
                    .andExpect(jsonPath("$.data[1].queuePosition").value(2));
        }

        @Test
        @DisplayName("GET /history passes status and date filters through")
        void getHistory_filters() throws Exception {
            when(orderService.listHistory(OrderStatus.COMPLETED, LocalDate.of(2026, 3, 1)))
                    .thenReturn(List.of(order("o1", OrderStatus.COMPLETED)));

            mockMvc.perform(get("/api/orders/history").param("status", "COMPLETED").param("date", "2026-03-01"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data[0].status").value("COMPLETED"));
        }

        @Test
        @DisplayName("GET /history with an unknown status is a validation error")
        void getHistory_badStatus() throws Exception {
            mockMvc.perform(get("/api/orders/history").param("status", "COOKING"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
        }

        @Test
        @DisplayName("GET /my lists the caller's orders")
        void getMine() throws Exception {
            when(orderService.listByOwner("cust-1", null))
                    .thenReturn(List.of(QueuedOrder.of(order("o1", OrderStatus.PENDING), 4)));

            mockMvc.perform(get("/api/orders/my").header(OrderController.CUSTOMER_HEADER, "cust-1"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data[0].queuePosition").value(4));
        }
    }

    @Nested
    @DisplayName("PATCH /api/orders/{id}/status")
    class UpdateStatus {

        @Test
        @DisplayName("valid move returns the updated order")
        void validMove_ok() throws Exception {
            when(orderService.advanceStatus("o1", OrderStatus.PREPARING))
                    .thenReturn(QueuedOrder.of(order("o1", OrderStatus.PREPARING), 1));

            mockMvc.perform(patch("/api/orders/o1/status")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"status\":\"PREPARING\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.status").value("PREPARING"));
        }

        @Test
        @DisplayName("invalid move is 409 with current and allowed statuses")
        void invalidMove_conflict() throws Exception {
            when(orderService.advanceStatus("o1", OrderStatus.READY))
                    .thenThrow(new InvalidTransitionException(
                            "o1", OrderStatus.PENDING, OrderStatus.READY, Set.of(OrderStatus.PREPARING)));

            mockMvc.perform(patch("/api/orders/o1/status")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"status\":\"READY\"}"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.error.code").value("INVALID_TRANSITION"))
                    .andExpect(jsonPath("$.error.details.currentStatus").value("PENDING"))
                    .andExpect(jsonPath("$.error.details.allowedNextStatuses[0]").value("PREPARING"));
        }

        @Test
        @DisplayName("exhausted conflict retries are 409 CONFLICT")
        void conflict_surfaces() throws Exception {
            when(orderService.advanceStatus("o1", OrderStatus.PREPARING))
                    .thenThrow(new OrderConflictException("o1", OrderStatus.PENDING));

            mockMvc.perform(patch("/api/orders/o1/status")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"status\":\"PREPARING\"}"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.error.code").value("CONFLICT"));
        }

        @Test
        @DisplayName("missing status is a validation error")
        void missingStatus_validationError() throws Exception {
            mockMvc.perform(patch("/api/orders/o1/status")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{}"))
                    .andExpect(status().isBadRequest());

            verify(orderService, never()).advanceStatus(any(), any());
        }
    }
}
