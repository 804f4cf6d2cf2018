package com.queueserve.domain.model;

import lombok.Value;

/**
 * A requested order line before pricing: which menu item, how many.
 */
@Value(staticConstructor = "of")
public class ItemSelection {

    String menuItemId;
    int quantity;
}
