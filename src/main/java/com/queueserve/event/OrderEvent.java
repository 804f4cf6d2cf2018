package com.queueserve.event;

import com.queueserve.domain.enums.OrderStatus;
import com.queueserve.domain.model.Order;
import org.springframework.context.ApplicationEvent;

/**
 * Published after an order is created or its status moves.
 *
 * <p>Carries the order as stored after the change and the previous status
 * (null for CREATED). The queue broadcaster is the main listener; it treats the
 * event only as a trigger and always rereads the active set itself.
 */
public class OrderEvent extends ApplicationEvent {

    private final Order order;
    private final OrderEventType eventType;
    private final OrderStatus previousStatus;

    public OrderEvent(Object source, Order order, OrderEventType eventType, OrderStatus previousStatus) {
        super(source);
        this.order = order;
        this.eventType = eventType;
        this.previousStatus = previousStatus;
    }

    public OrderEvent(Object source, Order order, OrderEventType eventType) {
        this(source, order, eventType, null);
    }

    public Order getOrder() {
        return order;
    }

    public OrderEventType getEventType() {
        return eventType;
    }

    /** The status before this change. Null for CREATED events. */
    public OrderStatus getPreviousStatus() {
        return previousStatus;
    }
}
