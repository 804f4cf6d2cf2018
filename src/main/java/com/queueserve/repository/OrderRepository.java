package com.queueserve.repository;

import com.queueserve.domain.enums.OrderStatus;
import com.queueserve.domain.model.Order;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Durable order storage as seen by the queue core.
 *
 * <p>The only shared mutable state in the system. The core reads through it for every
 * request and never caches orders beyond one snapshot computation.
 */
public interface OrderRepository {

    Order insert(Order order);

    Optional<Order> findById(String id);

    /** PENDING and PREPARING orders, ascending by creation key. */
    List<Order> findActive();

    /**
     * Orders placed by one owner, most recent first.
     *
     * @param status optional filter; null for all statuses
     */
    List<Order> findByOwner(String ownerRef, OrderStatus status, int limit);

    /**
     * Order history, most recent first.
     *
     * @param status optional status filter
     * @param date   optional local calendar day the order was created on
     */
    List<Order> findHistory(OrderStatus status, LocalDate date, int limit);

    /**
     * Atomically moves an order from {@code expectedStatus} to {@code newStatus}.
     *
     * @return the order as stored after the update
     * @throws com.queueserve.exception.ResourceNotFoundException if no order has this id
     * @throws com.queueserve.exception.OrderConflictException if the stored status is no
     *         longer {@code expectedStatus}
     */
    Order updateStatus(String id, OrderStatus expectedStatus, OrderStatus newStatus);

    /** Highest creation key ever stored, if any. */
    OptionalLong findMaxCreationKey();
}
