package com.queueserve.service;

import com.queueserve.domain.model.CartLine;
import java.util.List;

/**
 * Cart operations used by "create order from cart".
 */
public interface CustomerCart {

    /** Current cart lines of the owner, in insertion order. Empty if there is no cart. */
    List<CartLine> drain(String ownerRef);

    /** Empties the owner's cart. No-op if there is none. */
    void clear(String ownerRef);
}
