package com.queueserve.domain.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * A registered customer's accumulated cart. One cart per owner.
 */
@Data
@Builder
public class Cart {

    private String ownerRef;

    @Builder.Default
    private List<CartLine> lines = new ArrayList<>();

    private LocalDateTime updatedAt;
}
