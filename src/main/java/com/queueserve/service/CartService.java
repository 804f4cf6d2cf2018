package com.queueserve.service;

import com.queueserve.domain.model.Cart;
import com.queueserve.domain.model.CartLine;
import com.queueserve.domain.model.CartSummary;
import com.queueserve.domain.model.MenuItem;
import com.queueserve.entity.CartEntity;
import com.queueserve.exception.ResourceNotFoundException;
import com.queueserve.exception.UnavailableItemException;
import com.queueserve.mapper.CartMapper;
import com.queueserve.repository.jpa.CartJpaRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Per-customer cart. Holds menu item references and quantities only; prices are read
 * from the menu every time the cart is viewed and frozen only when an order is placed.
 */
@Service
public class CartService implements CustomerCart {

    private static final Logger log = LoggerFactory.getLogger(CartService.class);

    private final CartJpaRepository cartJpaRepository;
    private final CartMapper cartMapper;
    private final MenuCatalog menuCatalog;
    private final Clock clock;

    public CartService(CartJpaRepository cartJpaRepository, CartMapper cartMapper, MenuCatalog menuCatalog, Clock clock) {
        this.cartJpaRepository = cartJpaRepository;
        this.cartMapper = cartMapper;
        this.menuCatalog = menuCatalog;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public CartSummary getCartSummary(String ownerRef) {
        return summarize(requireCart(ownerRef));
    }

    /**
     * Adds {@code quantity} of an item, merging with an existing line for the same item.
     * Creates the cart on first use.
     */
    @Transactional
    public CartSummary addItem(String ownerRef, String menuItemId, int quantity) {
        MenuItem menuItem =
                menuCatalog.lookup(menuItemId).orElseThrow(() -> new ResourceNotFoundException("MenuItem", menuItemId));
        if (!menuItem.isAvailable()) {
            throw new UnavailableItemException(menuItem.getId(), menuItem.getName());
        }

        Cart cart = findCart(ownerRef)
                .orElseGet(() -> Cart.builder().ownerRef(ownerRef).build());

        Optional<CartLine> existing = cart.getLines().stream()
                .filter(line -> line.getMenuItemId().equals(menuItemId))
                .findFirst();
        if (existing.isPresent()) {
            existing.get().setQuantity(existing.get().getQuantity() + quantity);
        } else {
            cart.getLines().add(new CartLine(menuItemId, quantity));
        }

        Cart saved = save(cart);
        log.debug("Cart {}: added {} x {}", ownerRef, quantity, menuItemId);
        return summarize(saved);
    }

    @Transactional
    public CartSummary setQuantity(String ownerRef, String menuItemId, int quantity) {
        Cart cart = requireCart(ownerRef);
        CartLine line = cart.getLines().stream()
                .filter(l -> l.getMenuItemId().equals(menuItemId))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("CartItem", menuItemId));
        line.setQuantity(quantity);
        return summarize(save(cart));
    }

    @Transactional
    public CartSummary removeItem(String ownerRef, String menuItemId) {
        Cart cart = requireCart(ownerRef);
        boolean removed = cart.getLines().removeIf(line -> line.getMenuItemId().equals(menuItemId));
        if (!removed) {
            throw new ResourceNotFoundException("CartItem", menuItemId);
        }
        return summarize(save(cart));
    }

    /**
     * Empties the cart and returns the (empty) summary.
     */
    @Transactional
    public CartSummary clearCart(String ownerRef) {
        Cart cart = requireCart(ownerRef);
        cart.getLines().clear();
        return summarize(save(cart));
    }

    @Override
    @Transactional(readOnly = true)
    public List<CartLine> drain(String ownerRef) {
        return findCart(ownerRef).map(cart -> List.copyOf(cart.getLines())).orElse(List.of());
    }

    @Override
    @Transactional
    public void clear(String ownerRef) {
        findCart(ownerRef).ifPresent(cart -> {
            cart.getLines().clear();
            save(cart);
            log.debug("Cart {} cleared", ownerRef);
        });
    }

    private Optional<Cart> findCart(String ownerRef) {
        return cartJpaRepository.findById(ownerRef).map(cartMapper::toDomain);
    }

    private Cart requireCart(String ownerRef) {
        return findCart(ownerRef).orElseThrow(() -> new ResourceNotFoundException("Cart", ownerRef));
    }

    private Cart save(Cart cart) {
        cart.setUpdatedAt(LocalDateTime.now(clock));
        CartEntity saved = cartJpaRepository.save(cartMapper.toEntity(cart));
        return cartMapper.toDomain(saved);
    }

    /**
     * Populates lines with current menu data. Lines whose menu item has been deleted
     * are left out of the totals and the item list.
     */
    private CartSummary summarize(Cart cart) {
        List<CartSummary.Line> lines = new ArrayList<>();
        BigDecimal grandTotal = BigDecimal.ZERO;
        int itemCount = 0;

        for (CartLine cartLine : cart.getLines()) {
            Optional<MenuItem> menuItem = menuCatalog.lookup(cartLine.getMenuItemId());
            if (menuItem.isEmpty()) {
                continue;
            }
            BigDecimal lineTotal = menuItem.get().getPrice().multiply(BigDecimal.valueOf(cartLine.getQuantity()));
            grandTotal = grandTotal.add(lineTotal);
            itemCount += cartLine.getQuantity();
            lines.add(CartSummary.Line.builder()
                    .menuItem(menuItem.get())
                    .quantity(cartLine.getQuantity())
                    .lineTotal(lineTotal)
                    .build());
        }

        return CartSummary.builder()
                .ownerRef(cart.getOwnerRef())
                .items(lines)
                .grandTotal(grandTotal.setScale(2, RoundingMode.HALF_UP))
                .itemCount(itemCount)
                .updatedAt(cart.getUpdatedAt())
                .build();
    }
}
