package com.queueserve.domain.model;

import lombok.Value;

/**
 * An order together with its live queue position.
 * The position is null when the order is READY or COMPLETED.
 */
@Value(staticConstructor = "of")
public class QueuedOrder {

    Order order;
    Integer queuePosition;
}
