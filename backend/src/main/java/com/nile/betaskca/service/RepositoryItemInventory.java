package com.nile.betaskca.service;

import com.nile.betaskca.dto.DTOs.ItemDto;
import com.nile.betaskca.repository.ItemRepository;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * {@link ItemInventory} reading straight from the item store.
 */
@Service
public class RepositoryItemInventory implements ItemInventory {

    private final ItemRepository itemRepository;

    public RepositoryItemInventory(ItemRepository itemRepository) {
        this.itemRepository = itemRepository;
    }

    @Override
    public Optional<ItemDto> getItem(UUID itemId) {
        return itemRepository.findById(itemId).map(ItemDto::from);
    }

    @Override
    public boolean checkStock(UUID itemId, int quantity) {
        return itemRepository.findById(itemId)
                .map(item -> item.hasStock(quantity))
                .orElse(false);
    }
}
