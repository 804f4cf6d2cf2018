package com.queueserve.domain.model;

import com.queueserve.domain.enums.OrderStatus;
import lombok.Builder;
import lombok.Value;

/**
 * One active order's place in a {@link QueueSnapshot}.
 */
@Value
@Builder
public class QueueEntry {

    String orderId;
    OrderStatus status;
    String displayName;
    int queuePosition;
}
