package com.nile.betaskca.config;

import com.nile.betaskca.dto.DTOs.CreateItemRequest;
import com.nile.betaskca.model.Item;
import com.nile.betaskca.repository.ItemRepository;
import com.nile.betaskca.service.ItemService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.interceptor.SimpleKey;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.EnableTransactionManagement;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Item creation must evict the catalog listing only once its transaction has committed.
 */
@SpringJUnitConfig
class CacheConfigTest {

    @Configuration
    @EnableTransactionManagement
    @Import({CacheConfig.class, ItemService.class})
    static class Config {

        @Bean
        PlatformTransactionManager transactionManager() {
            return mock(PlatformTransactionManager.class);
        }

        @Bean
        ItemRepository itemRepository() {
            return mock(ItemRepository.class);
        }
    }

    @Autowired
    ItemService itemService;

    @Autowired
    ItemRepository itemRepository;

    @Autowired
    PlatformTransactionManager transactionManager;

    @Autowired
    CacheManager cacheManager;

    @Test
    void listingIsEvictedAfterCommit() {
        Cache items = cacheManager.getCache(ItemService.ITEMS_CACHE);
        when(itemRepository.findAll()).thenReturn(List.of(
                new Item(UUID.randomUUID(), "Mug", null, BigDecimal.ONE, 1)));
        when(itemRepository.findByName(any())).thenReturn(Optional.empty());
        when(itemRepository.save(any(Item.class))).thenAnswer(inv -> inv.getArgument(0));
        when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        List<Boolean> cachedAtCommit = new ArrayList<>();
        doAnswer(inv -> cachedAtCommit.add(items.get(SimpleKey.EMPTY) != null))
                .when(transactionManager).commit(any());

        itemService.listItems();
        assertThat(items.get(SimpleKey.EMPTY)).isNotNull();

        itemService.createItem(new CreateItemRequest("Plate", null, BigDecimal.TEN, 2));

        assertThat(cachedAtCommit).containsExactly(true);
        assertThat(items.get(SimpleKey.EMPTY)).isNull();
    }
}
