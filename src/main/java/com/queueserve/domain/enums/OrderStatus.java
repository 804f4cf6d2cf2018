package com.queueserve.domain.enums;

/**
 * Preparation pipeline status of an order.
 * Orders only move forward: PENDING -> PREPARING -> READY -> COMPLETED.
 * PENDING and PREPARING orders are "active" and hold a place in the service queue.
 */
public enum OrderStatus {
    PENDING,
    PREPARING,
    READY,
    COMPLETED;

    public boolean isActive() {
        return this == PENDING || this == PREPARING;
    }
}
