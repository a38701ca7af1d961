package com.nile.betaskca.controller;

import com.nile.betaskca.dto.DTOs.AllItemsResponse;
import com.nile.betaskca.dto.DTOs.CreateItemRequest;
import com.nile.betaskca.dto.DTOs.ItemDto;
import com.nile.betaskca.service.ItemService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for the item catalog.
 *
 *   POST   /items   : create item (409 if the name is taken)
 *   GET    /items   : list all items
 */
@RestController
@RequestMapping("/items")
public class ItemController {

    private final ItemService itemService;

    public ItemController(ItemService itemService) {
        this.itemService = itemService;
    }

    @PostMapping({"", "/"})
    public ItemDto createItem(@Valid @RequestBody CreateItemRequest request) {
        return itemService.createItem(request);
    }

    @GetMapping({"", "/"})
    public AllItemsResponse listItems() {
        return itemService.listItems();
    }
}
