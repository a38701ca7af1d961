package com.nile.betaskca.service;

import com.nile.betaskca.dto.DTOs.ItemDto;

import java.util.Optional;
import java.util.UUID;

/**
 * What the cart needs to know about the catalog: whether an item exists
 * and whether enough of it is in stock.
 */
public interface ItemInventory {

    Optional<ItemDto> getItem(UUID itemId);

    /**
     * @return true if the item exists and at least {@code quantity} units are on hand
     */
    boolean checkStock(UUID itemId, int quantity);
}
