package com.nile.betaskca.service;

import com.nile.betaskca.dto.DTOs.AllItemsResponse;
import com.nile.betaskca.dto.DTOs.CreateItemRequest;
import com.nile.betaskca.dto.DTOs.ItemDto;
import com.nile.betaskca.model.Item;
import com.nile.betaskca.repository.ItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Service for managing the item catalog.
 */
@Service
public class ItemService {

    private static final Logger log = LoggerFactory.getLogger(ItemService.class);

    public static final String ITEMS_CACHE = "items";

    private final ItemRepository itemRepository;

    public ItemService(ItemRepository itemRepository) {
        this.itemRepository = itemRepository;
    }

    /**
     * Create a catalog item. Item names are unique.
     *
     * @throws IllegalStateException if an item with the same name exists
     * @throws IllegalArgumentException if price or quantity is negative
     */
    @Transactional
    @CacheEvict(value = ITEMS_CACHE, allEntries = true)
    public ItemDto createItem(CreateItemRequest req) {
        if (itemRepository.findByName(req.name()).isPresent()) {
            log.warn("Rejected item creation: name '{}' already taken", req.name());
            throw new IllegalStateException("An item with this name already exists");
        }

        Item item = new Item(
                UUID.randomUUID(),
                req.name(),
                req.description(),
                req.price(),
                req.quantity() != null ? req.quantity() : 0
        );
        Item saved = itemRepository.save(item);
        log.info("Created item {} '{}' (qty {})", saved.id(), saved.name(), saved.quantity());
        return ItemDto.from(saved);
    }

    /** List the whole catalog. */
    @Cacheable(ITEMS_CACHE)
    public AllItemsResponse listItems() {
        return new AllItemsResponse(itemRepository.findAll().stream()
                .map(ItemDto::from)
                .toList());
    }
}
