package com.queueserve.service;

import com.queueserve.config.OrderQueueConfig;
import com.queueserve.domain.enums.OrderStatus;
import com.queueserve.domain.model.ItemSelection;
import com.queueserve.domain.model.LineItem;
import com.queueserve.domain.model.MenuItem;
import com.queueserve.domain.model.Order;
import com.queueserve.domain.model.QueueSnapshot;
import com.queueserve.domain.model.QueuedOrder;
import com.queueserve.event.EventPublisherHelper;
import com.queueserve.exception.EmptyOrderException;
import com.queueserve.exception.OrderConflictException;
import com.queueserve.exception.ResourceNotFoundException;
import com.queueserve.exception.UnavailableItemException;
import com.queueserve.observability.QueueMetricsService;
import com.queueserve.queue.CreationKeySequencer;
import com.queueserve.queue.OrderStateMachine;
import com.queueserve.queue.QueuePositionCalculator;
import com.queueserve.repository.OrderRepository;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Order placement, lookup and lifecycle.
 *
 * <p>Placement freezes each line's name and unit price from the menu, assigns the
 * creation key that fixes the order's place in the queue, stores the order as PENDING
 * and publishes a CREATED event (which triggers a queue broadcast once the insert commits).
 *
 * <p>Queue positions are never stored. Every read that returns a position derives it
 * from one fresh read of the active set.
 *
 * <p>Status changes go through {@link OrderStateMachine}. A lost compare-and-set race
 * ({@link OrderConflictException}) is retried with a fresh read a bounded number of times,
 * after which it surfaces as CONFLICT.
 */
@Service
public class OrderService {

    private static final Logger log = LoggerFactory.getLogger(OrderService.class);

    private final OrderRepository orderRepository;
    private final MenuCatalog menuCatalog;
    private final CustomerCart customerCart;
    private final CreationKeySequencer creationKeySequencer;
    private final OrderStateMachine orderStateMachine;
    private final QueuePositionCalculator queuePositionCalculator;
    private final EventPublisherHelper eventPublisherHelper;
    private final QueueMetricsService queueMetricsService;
    private final OrderQueueConfig orderQueueConfig;
    private final Clock clock;
    private final Retry transitionRetry;

    public OrderService(
            OrderRepository orderRepository,
            MenuCatalog menuCatalog,
            CustomerCart customerCart,
            CreationKeySequencer creationKeySequencer,
            OrderStateMachine orderStateMachine,
            QueuePositionCalculator queuePositionCalculator,
            EventPublisherHelper eventPublisherHelper,
            QueueMetricsService queueMetricsService,
            OrderQueueConfig orderQueueConfig,
            Clock clock) {
        this.orderRepository = orderRepository;
        this.menuCatalog = menuCatalog;
        this.customerCart = customerCart;
        this.creationKeySequencer = creationKeySequencer;
        this.orderStateMachine = orderStateMachine;
        this.queuePositionCalculator = queuePositionCalculator;
        this.eventPublisherHelper = eventPublisherHelper;
        this.queueMetricsService = queueMetricsService;
        this.orderQueueConfig = orderQueueConfig;
        this.clock = clock;
        this.transitionRetry = Retry.of(
                "orderTransition",
                RetryConfig.custom()
                        .maxAttempts(Math.max(1, orderQueueConfig.getTransitionMaxAttempts()))
                        .waitDuration(Duration.ofMillis(orderQueueConfig.getTransitionRetryWaitMs()))
                        .retryExceptions(OrderConflictException.class)
                        .build());
    }

    /**
     * Keeps new creation keys above everything already stored, even if the clock
     * is behind the previous run's.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void seedSequencer() {
        orderRepository.findMaxCreationKey().ifPresent(creationKeySequencer::advancePast);
    }

    /**
     * Places an order from explicit lines (guest checkout).
     *
     * @param ownerRef registered customer, or null for a guest
     * @throws EmptyOrderException if there are no lines
     * @throws ResourceNotFoundException if a line references a menu item that does not exist
     * @throws UnavailableItemException if a line references an unavailable item
     */
    @Transactional
    public QueuedOrder placeOrder(String displayName, String ownerRef, List<ItemSelection> selections) {
        if (selections == null || selections.isEmpty()) {
            throw new EmptyOrderException("Order must contain at least one item.");
        }

        List<LineItem> lineItems = new ArrayList<>(selections.size());
        for (ItemSelection selection : selections) {
            lineItems.add(snapshotLine(selection));
        }
        BigDecimal totalAmount = lineItems.stream().map(LineItem::lineTotal).reduce(BigDecimal.ZERO, BigDecimal::add);

        LocalDateTime now = LocalDateTime.now(clock);
        Order order = Order.builder()
                .id(UUID.randomUUID().toString())
                .ownerRef(ownerRef)
                .displayName(displayName)
                .lineItems(List.copyOf(lineItems))
                .totalAmount(totalAmount)
                .status(OrderStatus.PENDING)
                .creationKey(creationKeySequencer.next())
                .createdAt(now)
                .updatedAt(now)
                .build();

        Order saved = orderRepository.insert(order);
        queueMetricsService.recordOrderCreated();
        log.info(
                "Order placed: id={}, name={}, items={}, total={}, key={}",
                saved.getId(),
                saved.getDisplayName(),
                lineItems.size(),
                saved.getTotalAmount(),
                saved.getCreationKey());

        eventPublisherHelper.publishOrderCreated(this, saved);
        return withPosition(saved);
    }

    /**
     * Places an order from everything in the owner's cart, then empties the cart.
     * Both happen in one transaction: a rejected order leaves the cart intact.
     *
     * @throws EmptyOrderException if the cart is empty or missing
     */
    @Transactional
    public QueuedOrder placeOrderFromCart(String ownerRef, String displayName) {
        List<ItemSelection> selections = customerCart.drain(ownerRef).stream()
                .map(line -> ItemSelection.of(line.getMenuItemId(), line.getQuantity()))
                .collect(Collectors.toList());
        if (selections.isEmpty()) {
            throw new EmptyOrderException("Cart is empty.");
        }

        QueuedOrder placed = placeOrder(displayName, ownerRef, selections);
        customerCart.clear(ownerRef);
        return placed;
    }

    public QueuedOrder getOrder(String orderId) {
        return withPosition(findOrder(orderId));
    }

    /**
     * Active orders in queue order, each with its position (1..n).
     */
    public List<QueuedOrder> listActive() {
        List<Order> active = orderRepository.findActive();
        List<QueuedOrder> result = new ArrayList<>(active.size());
        for (int i = 0; i < active.size(); i++) {
            result.add(QueuedOrder.of(active.get(i), i + 1));
        }
        return result;
    }

    public QueueSnapshot getQueueSnapshot() {
        return queuePositionCalculator.snapshot(orderRepository.findActive(), LocalDateTime.now(clock));
    }

    /**
     * Most recent first, capped at the configured history limit.
     *
     * @param status optional status filter
     * @param date   optional day the orders were created on
     */
    public List<Order> listHistory(OrderStatus status, LocalDate date) {
        return orderRepository.findHistory(status, date, orderQueueConfig.getHistoryLimit());
    }

    /**
     * The owner's orders, most recent first, each with its live position (null unless active).
     */
    public List<QueuedOrder> listByOwner(String ownerRef, OrderStatus status) {
        List<Order> orders = orderRepository.findByOwner(ownerRef, status, orderQueueConfig.getOwnerLimit());
        List<Order> active = orderRepository.findActive();
        return orders.stream()
                .map(order -> QueuedOrder.of(order, queuePositionCalculator.positionOrNull(order, active)))
                .collect(Collectors.toList());
    }

    /**
     * Moves an order to {@code requested}.
     *
     * @throws ResourceNotFoundException if the order does not exist
     * @throws com.queueserve.exception.InvalidTransitionException if the move is not allowed
     *         from the order's current status
     * @throws OrderConflictException if every attempt lost a concurrent update race
     */
    public QueuedOrder advanceStatus(String orderId, OrderStatus requested) {
        Order updated = Retry.decorateSupplier(transitionRetry, () -> {
                    Order current = findOrder(orderId);
                    return orderStateMachine.transition(current, requested);
                })
                .get();
        queueMetricsService.recordTransition(requested);
        return withPosition(updated);
    }

    private LineItem snapshotLine(ItemSelection selection) {
        MenuItem menuItem = menuCatalog
                .lookup(selection.getMenuItemId())
                .orElseThrow(() -> new ResourceNotFoundException("MenuItem", selection.getMenuItemId()));
        if (!menuItem.isAvailable()) {
            throw new UnavailableItemException(menuItem.getId(), menuItem.getName());
        }
        return LineItem.builder()
                .menuItemId(menuItem.getId())
                .name(menuItem.getName())
                .quantity(selection.getQuantity())
                .unitPrice(menuItem.getPrice())
                .build();
    }

    private Order findOrder(String orderId) {
        return orderRepository.findById(orderId).orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
    }

    private QueuedOrder withPosition(Order order) {
        if (!order.isActive()) {
            return QueuedOrder.of(order, null);
        }
        return QueuedOrder.of(order, queuePositionCalculator.positionOrNull(order, orderRepository.findActive()));
    }
}
