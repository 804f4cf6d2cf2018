package com.queueserve.service;

import com.queueserve.domain.model.MenuItem;
import java.util.Optional;

/**
 * Read side of the menu as seen by order creation. Consulted only while building the
 * line-item snapshot of a new order.
 */
public interface MenuCatalog {

    Optional<MenuItem> lookup(String menuItemId);
}
