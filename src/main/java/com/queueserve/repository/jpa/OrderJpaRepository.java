package com.queueserve.repository.jpa;

import com.queueserve.domain.enums.OrderStatus;
import com.queueserve.entity.OrderEntity;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * Spring Data repository for the orders table.
 * Wrapped by {@link JpaOrderRepository}; nothing outside the repository package uses it directly.
 */
@Repository
public interface OrderJpaRepository extends JpaRepository<OrderEntity, String> {

    List<OrderEntity> findByStatusInOrderByCreationKeyAsc(Collection<OrderStatus> statuses);

    List<OrderEntity> findByOwnerRefOrderByCreationKeyDesc(String ownerRef, Pageable pageable);

    List<OrderEntity> findByOwnerRefAndStatusOrderByCreationKeyDesc(
            String ownerRef, OrderStatus status, Pageable pageable);

    @Query("SELECT o FROM OrderEntity o WHERE (:status IS NULL OR o.status = :status) "
            + "AND (:from IS NULL OR o.createdAt >= :from) AND (:to IS NULL OR o.createdAt < :to) "
            + "ORDER BY o.creationKey DESC")
    List<OrderEntity> findHistory(
            @Param("status") OrderStatus status,
            @Param("from") LocalDateTime from,
            @Param("to") LocalDateTime to,
            Pageable pageable);

    /**
     * Compare-and-set on status. Returns the number of rows updated: 1 on success,
     * 0 if the order is missing or its status is no longer {@code expected}.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE OrderEntity o SET o.status = :next, o.updatedAt = :updatedAt "
            + "WHERE o.id = :id AND o.status = :expected")
    int compareAndSetStatus(
            @Param("id") String id,
            @Param("expected") OrderStatus expected,
            @Param("next") OrderStatus next,
            @Param("updatedAt") LocalDateTime updatedAt);

    @Query("SELECT MAX(o.creationKey) FROM OrderEntity o")
    Optional<Long> findMaxCreationKey();
}
