package com.queueserve.entity;

import com.queueserve.domain.enums.OrderStatus;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.domain.Persistable;

/**
 * JPA entity for the orders table.
 * creation_key is unique; the (status, creation_key) index serves the active-queue scan.
 *
 * <p>Implements {@link Persistable} so that saving a freshly built entity always INSERTs:
 * an id collision fails instead of merging over the stored order.
 */
@Entity
@Table(
        name = "orders",
        indexes = {
            @Index(name = "idx_orders_status_key", columnList = "status, creation_key"),
            @Index(name = "idx_orders_owner", columnList = "owner_ref")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderEntity implements Persistable<String> {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "owner_ref", length = 64)
    private String ownerRef;

    @Column(name = "display_name", length = 100, nullable = false)
    private String displayName;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "order_line_items", joinColumns = @JoinColumn(name = "order_id"))
    @OrderColumn(name = "line_no")
    @Builder.Default
    private List<LineItemEmbeddable> lineItems = new ArrayList<>();

    @Column(name = "total_amount", precision = 12, scale = 2, nullable = false)
    private BigDecimal totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(20)", nullable = false)
    private OrderStatus status;

    @Column(name = "creation_key", nullable = false, unique = true)
    private long creationKey;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /** Ids are assigned before insert, so newness cannot be derived from a null id. */
    @Transient
    private boolean persisted;

    @Override
    public boolean isNew() {
        return !persisted;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.persisted = true;
    }
}
