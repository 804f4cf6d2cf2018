package com.queueserve.exception;

import com.queueserve.domain.enums.OrderStatus;
import java.util.Map;

/**
 * Thrown by the order repository when a compare-and-set status update finds that the
 * stored status no longer matches the expected one: another request advanced the order first.
 *
 * <p>OrderService retries these a bounded number of times (re-read, re-check). Only
 * when every attempt loses the race does it reach the API caller.
 */
public class OrderConflictException extends BaseException {

    public OrderConflictException(String orderId, OrderStatus expectedStatus) {
        super(
                ErrorCode.CONFLICT,
                String.format("Order %s was modified concurrently (expected status %s)", orderId, expectedStatus),
                Map.of("orderId", orderId, "expectedStatus", expectedStatus.name()));
    }
}
