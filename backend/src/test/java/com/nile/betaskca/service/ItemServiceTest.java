package com.nile.betaskca.service;

import com.nile.betaskca.dto.DTOs.AllItemsResponse;
import com.nile.betaskca.dto.DTOs.CreateItemRequest;
import com.nile.betaskca.dto.DTOs.ItemDto;
import com.nile.betaskca.model.Item;
import com.nile.betaskca.repository.ItemRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ItemServiceTest {

    private ItemRepository itemRepository;
    private ItemService service;

    @BeforeEach
    void setUp() {
        itemRepository = mock(ItemRepository.class);
        service = new ItemService(itemRepository);
    }

    private static CreateItemRequest request() {
        return new CreateItemRequest("Test Item", null, new BigDecimal("10.0"), 5);
    }

    @Test
    void createItemPersistsNewItem() {
        when(itemRepository.findByName("Test Item")).thenReturn(Optional.empty());
        when(itemRepository.save(any(Item.class))).thenAnswer(inv -> inv.getArgument(0));

        ItemDto result = service.createItem(request());

        ArgumentCaptor<Item> saved = ArgumentCaptor.forClass(Item.class);
        verify(itemRepository).save(saved.capture());
        assertThat(saved.getValue().id()).isNotNull();
        assertThat(result.id()).isEqualTo(saved.getValue().id());
        assertThat(result.name()).isEqualTo("Test Item");
        assertThat(result.price()).isEqualByComparingTo("10.0");
        assertThat(result.quantity()).isEqualTo(5);
    }

    @Test
    void createItemRejectsDuplicateName() {
        when(itemRepository.findByName("Test Item")).thenReturn(Optional.of(
                new Item(UUID.randomUUID(), "Test Item", null, BigDecimal.TEN, 5)));

        assertThatThrownBy(() -> service.createItem(request()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("An item with this name already exists");
        verify(itemRepository, never()).save(any());
    }

    @Test
    void createItemRejectsNegativePrice() {
        when(itemRepository.findByName(any())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.createItem(
                new CreateItemRequest("Bad", null, new BigDecimal("-1"), 1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Price cannot be negative");
        verify(itemRepository, never()).save(any());
    }

    @Test
    void listItemsMapsEveryItem() {
        when(itemRepository.findAll()).thenReturn(List.of(
                new Item(UUID.randomUUID(), "Item 1", null, new BigDecimal("10.0"), 5),
                new Item(UUID.randomUUID(), "Item 2", "Desc", new BigDecimal("20.0"), 3)));

        AllItemsResponse result = service.listItems();

        assertThat(result.items()).extracting(ItemDto::name).containsExactly("Item 1", "Item 2");
        verify(itemRepository).findAll();
    }

    @Test
    void listItemsEmptyCatalog() {
        when(itemRepository.findAll()).thenReturn(List.of());

        assertThat(service.listItems().items()).isEmpty();
    }
}
