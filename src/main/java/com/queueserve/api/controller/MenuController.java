package com.queueserve.api.controller;

import com.queueserve.api.dto.request.MenuItemRequest;
import com.queueserve.api.dto.request.MenuItemUpdateRequest;
import com.queueserve.domain.model.MenuItem;
import com.queueserve.service.MenuService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for the menu.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /api/menu} -- orderable items, by category then name</li>
 *   <li>{@code GET /api/menu/all} -- every item including unavailable ones (staff)</li>
 *   <li>{@code GET /api/menu/{id}} -- one item</li>
 *   <li>{@code POST /api/menu} -- create an item</li>
 *   <li>{@code PUT /api/menu/{id}} -- partial update</li>
 *   <li>{@code DELETE /api/menu/{id}} -- delete an item</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/menu")
public class MenuController {

    private final MenuService menuService;

    public MenuController(MenuService menuService) {
        this.menuService = menuService;
    }

    @GetMapping
    public List<MenuItem> getAvailableItems() {
        return menuService.listAvailable();
    }

    @GetMapping("/all")
    public List<MenuItem> getAllItems() {
        return menuService.listAll();
    }

    @GetMapping("/{id}")
    public MenuItem getItem(@PathVariable String id) {
        return menuService.getItem(id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public MenuItem createItem(@RequestBody @Valid MenuItemRequest request) {
        MenuItem menuItem = MenuItem.builder()
                .name(request.getName().trim())
                .description(request.getDescription())
                .price(request.getPrice())
                .category(request.getCategory())
                .available(request.getAvailable() == null || request.getAvailable())
                .imageUrl(request.getImageUrl())
                .build();
        return menuService.createItem(menuItem);
    }

    @PutMapping("/{id}")
    public MenuItem updateItem(@PathVariable String id, @RequestBody @Valid MenuItemUpdateRequest request) {
        MenuItem updates = MenuItem.builder()
                .name(request.getName())
                .description(request.getDescription())
                .price(request.getPrice())
                .category(request.getCategory())
                .imageUrl(request.getImageUrl())
                .build();
        return menuService.updateItem(id, updates, request.getAvailable());
    }

    @DeleteMapping("/{id}")
    public Map<String, String> deleteItem(@PathVariable String id) {
        menuService.deleteItem(id);
        return Map.of("message", "Menu item deleted");
    }
}
