package com.queueserve.entity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for customer carts. Keyed by owner: one cart per customer.
 */
@Entity
@Table(name = "carts")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CartEntity {

    @Id
    @Column(name = "owner_ref", length = 64)
    private String ownerRef;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "cart_lines", joinColumns = @JoinColumn(name = "owner_ref"))
    @OrderColumn(name = "line_no")
    @Builder.Default
    private List<CartLineEmbeddable> lines = new ArrayList<>();

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
