package com.queueserve.queue;

import com.queueserve.domain.enums.OrderStatus;
import com.queueserve.domain.model.Order;
import com.queueserve.event.EventPublisherHelper;
import com.queueserve.exception.InvalidTransitionException;
import com.queueserve.repository.OrderRepository;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Authority on order lifecycle moves.
 *
 * <p>Transition table:
 * <ul>
 *   <li>PENDING -> PREPARING</li>
 *   <li>PREPARING -> READY</li>
 *   <li>READY -> COMPLETED</li>
 *   <li>COMPLETED -> (terminal)</li>
 * </ul>
 *
 * <p>The legality check is a pure function of (current, requested). Applying a legal move
 * goes through {@link OrderRepository#updateStatus} as a compare-and-set against the status
 * that was checked, so two concurrent requests can never both succeed from the same status.
 *
 * <p>Every applied move publishes an order event, which drives a queue broadcast. A move
 * into READY is published as {@code READY} so the broadcaster also sends the one-shot
 * pickup notice to that order's channel.
 */
@Component
public class OrderStateMachine {

    private static final Logger log = LoggerFactory.getLogger(OrderStateMachine.class);

    private static final Map<OrderStatus, Set<OrderStatus>> TRANSITIONS = new EnumMap<>(OrderStatus.class);

    static {
        TRANSITIONS.put(OrderStatus.PENDING, Collections.unmodifiableSet(EnumSet.of(OrderStatus.PREPARING)));
        TRANSITIONS.put(OrderStatus.PREPARING, Collections.unmodifiableSet(EnumSet.of(OrderStatus.READY)));
        TRANSITIONS.put(OrderStatus.READY, Collections.unmodifiableSet(EnumSet.of(OrderStatus.COMPLETED)));
        TRANSITIONS.put(OrderStatus.COMPLETED, Collections.unmodifiableSet(EnumSet.noneOf(OrderStatus.class)));
    }

    private final OrderRepository orderRepository;
    private final EventPublisherHelper eventPublisherHelper;

    public OrderStateMachine(OrderRepository orderRepository, EventPublisherHelper eventPublisherHelper) {
        this.orderRepository = orderRepository;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /** Statuses reachable in one step from {@code current}. Empty for COMPLETED. */
    public Set<OrderStatus> allowedNext(OrderStatus current) {
        return TRANSITIONS.get(current);
    }

    public boolean canTransition(OrderStatus current, OrderStatus requested) {
        return requested != null && allowedNext(current).contains(requested);
    }

    /**
     * Validates a move without applying it.
     *
     * @throws InvalidTransitionException if {@code requested} is not reachable from the order's status
     */
    public void check(Order order, OrderStatus requested) {
        OrderStatus current = order.getStatus();
        if (!canTransition(current, requested)) {
            throw new InvalidTransitionException(order.getId(), current, requested, allowedNext(current));
        }
    }

    /**
     * Validates and applies a move, then signals the broadcaster.
     *
     * @param order     the order as just read from the repository (authoritative current status)
     * @param requested the status to move to
     * @return the updated order
     * @throws InvalidTransitionException if the move is illegal; the stored order is untouched
     * @throws com.queueserve.exception.OrderConflictException if the stored status changed since
     *         {@code order} was read
     */
    public Order transition(Order order, OrderStatus requested) {
        check(order, requested);

        OrderStatus previous = order.getStatus();
        Order updated = orderRepository.updateStatus(order.getId(), previous, requested);
        log.info("Order {} moved {} -> {}", updated.getId(), previous, requested);

        if (requested == OrderStatus.READY) {
            eventPublisherHelper.publishOrderReady(this, updated, previous);
        } else {
            eventPublisherHelper.publishOrderAdvanced(this, updated, previous);
        }
        return updated;
    }
}
