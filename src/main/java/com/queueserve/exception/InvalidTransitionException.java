package com.queueserve.exception;

import com.queueserve.domain.enums.OrderStatus;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Thrown when a requested status is not reachable from the order's current status.
 *
 * <p>Carries the current status and the statuses that would have been legal, so the
 * caller can explain the rejection. For a COMPLETED order the allowed set is empty.
 */
@Getter
public class InvalidTransitionException extends BaseException {

    private final OrderStatus currentStatus;
    private final OrderStatus requestedStatus;
    private final Set<OrderStatus> allowedNextStatuses;

    public InvalidTransitionException(
            String orderId, OrderStatus currentStatus, OrderStatus requestedStatus, Set<OrderStatus> allowedNextStatuses) {
        super(
                ErrorCode.INVALID_TRANSITION,
                buildMessage(currentStatus, requestedStatus, allowedNextStatuses),
                buildDetails(orderId, currentStatus, requestedStatus, allowedNextStatuses));
        this.currentStatus = currentStatus;
        this.requestedStatus = requestedStatus;
        this.allowedNextStatuses = Set.copyOf(allowedNextStatuses);
    }

    private static String buildMessage(OrderStatus current, OrderStatus requested, Set<OrderStatus> allowed) {
        String allowedText = allowed.isEmpty()
                ? "none (order is completed)"
                : allowed.stream().map(Enum::name).sorted().collect(Collectors.joining(", "));
        return String.format(
                "Cannot transition from %s to %s. Allowed next status: %s", current, requested, allowedText);
    }

    private static Map<String, Object> buildDetails(
            String orderId, OrderStatus current, OrderStatus requested, Set<OrderStatus> allowed) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("orderId", orderId);
        details.put("currentStatus", current.name());
        details.put("requestedStatus", requested != null ? requested.name() : null);
        List<String> allowedNames = allowed.stream().map(Enum::name).sorted().toList();
        details.put("allowedNextStatuses", allowedNames);
        return details;
    }
}
