package com.queueserve.exception;

import java.util.Map;

/**
 * Thrown when an order or cart references a menu item that is currently switched off.
 * Order creation is rejected as a whole; no partial orders are stored.
 */
public class UnavailableItemException extends BaseException {

    public UnavailableItemException(String menuItemId, String name) {
        super(
                ErrorCode.ITEM_UNAVAILABLE,
                String.format("\"%s\" is currently unavailable.", name),
                Map.of("menuItemId", menuItemId, "name", name));
    }
}
