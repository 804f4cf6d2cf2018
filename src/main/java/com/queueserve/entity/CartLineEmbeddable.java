package com.queueserve.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CartLineEmbeddable {

    @Column(name = "menu_item_id", length = 36, nullable = false)
    private String menuItemId;

    private int quantity;
}
