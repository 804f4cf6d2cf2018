package com.queueserve.repository.jpa;

import com.queueserve.domain.enums.OrderStatus;
import com.queueserve.domain.model.Order;
import com.queueserve.entity.OrderEntity;
import com.queueserve.exception.OrderConflictException;
import com.queueserve.exception.ResourceNotFoundException;
import com.queueserve.mapper.OrderMapper;
import com.queueserve.repository.OrderRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link OrderRepository} backed by the orders table.
 *
 * <p>Status updates are a single conditional UPDATE ({@code WHERE id = ? AND status = ?}),
 * which gives the per-order compare-and-set the state machine relies on without holding
 * row locks across the request.
 */
@Repository
public class JpaOrderRepository implements OrderRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaOrderRepository.class);

    private static final EnumSet<OrderStatus> ACTIVE_STATUSES = EnumSet.of(OrderStatus.PENDING, OrderStatus.PREPARING);

    private final OrderJpaRepository orderJpaRepository;
    private final OrderMapper orderMapper;
    private final Clock clock;

    public JpaOrderRepository(OrderJpaRepository orderJpaRepository, OrderMapper orderMapper, Clock clock) {
        this.orderJpaRepository = orderJpaRepository;
        this.orderMapper = orderMapper;
        this.clock = clock;
    }

    @Override
    @Transactional
    public Order insert(Order order) {
        OrderEntity saved = orderJpaRepository.save(orderMapper.toEntity(order));
        return orderMapper.toDomain(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Order> findById(String id) {
        return orderJpaRepository.findById(id).map(orderMapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Order> findActive() {
        return orderMapper.toDomainList(orderJpaRepository.findByStatusInOrderByCreationKeyAsc(ACTIVE_STATUSES));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Order> findByOwner(String ownerRef, OrderStatus status, int limit) {
        PageRequest page = PageRequest.of(0, limit);
        List<OrderEntity> entities = status == null
                ? orderJpaRepository.findByOwnerRefOrderByCreationKeyDesc(ownerRef, page)
                : orderJpaRepository.findByOwnerRefAndStatusOrderByCreationKeyDesc(ownerRef, status, page);
        return orderMapper.toDomainList(entities);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Order> findHistory(OrderStatus status, LocalDate date, int limit) {
        LocalDateTime from = date != null ? date.atStartOfDay() : null;
        LocalDateTime to = date != null ? date.plusDays(1).atStartOfDay() : null;
        return orderMapper.toDomainList(orderJpaRepository.findHistory(status, from, to, PageRequest.of(0, limit)));
    }

    @Override
    @Transactional
    public Order updateStatus(String id, OrderStatus expectedStatus, OrderStatus newStatus) {
        int updated = orderJpaRepository.compareAndSetStatus(id, expectedStatus, newStatus, LocalDateTime.now(clock));
        if (updated == 0) {
            if (!orderJpaRepository.existsById(id)) {
                throw new ResourceNotFoundException("Order", id);
            }
            log.debug("Status CAS lost for order {}: expected {}", id, expectedStatus);
            throw new OrderConflictException(id, expectedStatus);
        }
        return orderJpaRepository
                .findById(id)
                .map(orderMapper::toDomain)
                .orElseThrow(() -> new ResourceNotFoundException("Order", id));
    }

    @Override
    @Transactional(readOnly = true)
    public OptionalLong findMaxCreationKey() {
        return orderJpaRepository.findMaxCreationKey().map(OptionalLong::of).orElseGet(OptionalLong::empty);
    }
}
