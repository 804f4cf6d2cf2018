package com.queueserve.event;

import com.queueserve.domain.enums.OrderStatus;
import com.queueserve.domain.model.Order;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher} for order events.
 *
 * <p>Publishing is synchronous; listeners decide whether to run async
 * (the queue broadcaster does, on the broadcast executor).
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public void publishOrderCreated(Object source, Order order) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.CREATED));
    }

    public void publishOrderAdvanced(Object source, Order order, OrderStatus previousStatus) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.ADVANCED, previousStatus));
    }

    public void publishOrderReady(Object source, Order order, OrderStatus previousStatus) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.READY, previousStatus));
    }
}
