package com.nile.betaskca.repository;

import com.nile.betaskca.model.Item;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence contract for catalog items.
 */
public interface ItemRepository {

    /**
     * Inserts the item, or overwrites the stored one with the same id.
     *
     * @param item The item to save.
     * @return The item as stored.
     */
    Item save(Item item);

    Optional<Item> findById(UUID id);

    /**
     * Finds an item by its exact name. Names are unique across the catalog.
     */
    Optional<Item> findByName(String name);

    List<Item> findAll();
}
