package com.nile.betaskca.repository.memory;

import com.nile.betaskca.model.Item;
import com.nile.betaskca.repository.ItemRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed item store, used with {@code app-config.storage=memory} and in tests.
 * Insertion order is not preserved.
 */
@Repository
@ConditionalOnProperty(prefix = "app-config", name = "storage", havingValue = "memory")
public class InMemoryItemRepository implements ItemRepository {

    private final Map<UUID, Item> items = new ConcurrentHashMap<>();

    @Override
    public Item save(Item item) {
        items.put(item.id(), item);
        return item;
    }

    @Override
    public Optional<Item> findById(UUID id) {
        return Optional.ofNullable(items.get(id));
    }

    @Override
    public Optional<Item> findByName(String name) {
        return items.values().stream()
                .filter(i -> i.name().equals(name))
                .findFirst();
    }

    @Override
    public List<Item> findAll() {
        return List.copyOf(items.values());
    }
}
