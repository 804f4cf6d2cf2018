package com.queueserve.service;

import com.queueserve.domain.model.MenuItem;
import com.queueserve.entity.MenuItemEntity;
import com.queueserve.exception.ResourceNotFoundException;
import com.queueserve.mapper.MenuItemMapper;
import com.queueserve.repository.jpa.MenuItemJpaRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Menu catalog management.
 *
 * <p>Editing or deleting an item only affects future orders and carts. Orders carry their
 * own copy of name and unit price, taken when they were placed.
 */
@Service
public class MenuService implements MenuCatalog {

    private static final Logger log = LoggerFactory.getLogger(MenuService.class);

    private final MenuItemJpaRepository menuItemJpaRepository;
    private final MenuItemMapper menuItemMapper;
    private final Clock clock;

    public MenuService(MenuItemJpaRepository menuItemJpaRepository, MenuItemMapper menuItemMapper, Clock clock) {
        this.menuItemJpaRepository = menuItemJpaRepository;
        this.menuItemMapper = menuItemMapper;
        this.clock = clock;
    }

    /**
     * Items customers can order, sorted by category then name.
     */
    @Transactional(readOnly = true)
    public List<MenuItem> listAvailable() {
        return menuItemMapper.toDomainList(menuItemJpaRepository.findByAvailableTrueOrderByCategoryAscNameAsc());
    }

    /**
     * Every item including unavailable ones, for staff.
     */
    @Transactional(readOnly = true)
    public List<MenuItem> listAll() {
        return menuItemMapper.toDomainList(menuItemJpaRepository.findAllByOrderByCategoryAscNameAsc());
    }

    @Transactional(readOnly = true)
    public MenuItem getItem(String id) {
        return lookup(id).orElseThrow(() -> new ResourceNotFoundException("MenuItem", id));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<MenuItem> lookup(String menuItemId) {
        return menuItemJpaRepository.findById(menuItemId).map(menuItemMapper::toDomain);
    }

    @Transactional
    public MenuItem createItem(MenuItem menuItem) {
        LocalDateTime now = LocalDateTime.now(clock);
        MenuItem toSave = menuItem.toBuilder()
                .id(UUID.randomUUID().toString())
                .createdAt(now)
                .updatedAt(now)
                .build();
        MenuItemEntity saved = menuItemJpaRepository.save(menuItemMapper.toEntity(toSave));
        log.info("Menu item created: id={}, name={}, price={}", saved.getId(), saved.getName(), saved.getPrice());
        return menuItemMapper.toDomain(saved);
    }

    /**
     * Applies the non-null fields of {@code updates} to the stored item.
     *
     * @param available new availability, or null to leave it unchanged
     */
    @Transactional
    public MenuItem updateItem(String id, MenuItem updates, Boolean available) {
        MenuItemEntity entity =
                menuItemJpaRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("MenuItem", id));

        if (updates.getName() != null) {
            entity.setName(updates.getName());
        }
        if (updates.getDescription() != null) {
            entity.setDescription(updates.getDescription());
        }
        if (updates.getPrice() != null) {
            entity.setPrice(updates.getPrice());
        }
        if (updates.getCategory() != null) {
            entity.setCategory(updates.getCategory());
        }
        if (updates.getImageUrl() != null) {
            entity.setImageUrl(updates.getImageUrl());
        }
        if (available != null) {
            entity.setAvailable(available);
        }
        entity.setUpdatedAt(LocalDateTime.now(clock));

        MenuItemEntity saved = menuItemJpaRepository.save(entity);
        log.info("Menu item updated: id={}, available={}", saved.getId(), saved.isAvailable());
        return menuItemMapper.toDomain(saved);
    }

    @Transactional
    public void deleteItem(String id) {
        if (!menuItemJpaRepository.existsById(id)) {
            throw new ResourceNotFoundException("MenuItem", id);
        }
        menuItemJpaRepository.deleteById(id);
        log.info("Menu item deleted: id={}", id);
    }
}
