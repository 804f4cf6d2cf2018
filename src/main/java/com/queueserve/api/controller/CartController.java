package com.queueserve.api.controller;

import com.queueserve.api.dto.request.CartItemRequest;
import com.queueserve.api.dto.request.CartQuantityRequest;
import com.queueserve.domain.model.CartSummary;
import com.queueserve.service.CartService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for the caller's cart. Every endpoint requires the
 * {@value OrderController#CUSTOMER_HEADER} header.
 */
@RestController
@RequestMapping("/api/cart")
public class CartController {

    private final CartService cartService;

    public CartController(CartService cartService) {
        this.cartService = cartService;
    }

    @GetMapping
    public CartSummary getCart(@RequestHeader(OrderController.CUSTOMER_HEADER) String customerId) {
        return cartService.getCartSummary(customerId);
    }

    @PostMapping("/items")
    public CartSummary addItem(
            @RequestHeader(OrderController.CUSTOMER_HEADER) String customerId,
            @RequestBody @Valid CartItemRequest request) {
        return cartService.addItem(customerId, request.getMenuItemId(), request.getQuantity());
    }

    @PutMapping("/items/{menuItemId}")
    public CartSummary setQuantity(
            @RequestHeader(OrderController.CUSTOMER_HEADER) String customerId,
            @PathVariable String menuItemId,
            @RequestBody @Valid CartQuantityRequest request) {
        return cartService.setQuantity(customerId, menuItemId, request.getQuantity());
    }

    @DeleteMapping("/items/{menuItemId}")
    public CartSummary removeItem(
            @RequestHeader(OrderController.CUSTOMER_HEADER) String customerId, @PathVariable String menuItemId) {
        return cartService.removeItem(customerId, menuItemId);
    }

    @DeleteMapping
    public CartSummary clearCart(@RequestHeader(OrderController.CUSTOMER_HEADER) String customerId) {
        return cartService.clearCart(customerId);
    }
}
