package com.nile.betaskca.repository.memory;

import com.nile.betaskca.model.CartItem;
import com.nile.betaskca.model.User;
import com.nile.betaskca.repository.UserRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed user store. {@link User} is immutable, so the stored instance
 * can be handed out directly.
 *
 * There are no transactions here, so {@link #findByIdForUpdate} takes no lock.
 */
@Repository
@ConditionalOnProperty(prefix = "app-config", name = "storage", havingValue = "memory")
public class InMemoryUserRepository implements UserRepository {

    private final Map<UUID, User> users = new ConcurrentHashMap<>();

    @Override
    public User save(User user) {
        users.put(user.id(), user);
        return user;
    }

    @Override
    public Optional<User> findById(UUID userId) {
        return Optional.ofNullable(users.get(userId));
    }

    @Override
    public Optional<User> findByIdForUpdate(UUID userId) {
        return findById(userId);
    }

    @Override
    public Optional<User> findByEmail(String email) {
        return users.values().stream()
                .filter(u -> u.email().equals(email))
                .findFirst();
    }

    @Override
    public List<CartItem> findCartItems(UUID userId) {
        User user = users.get(userId);
        return user != null ? user.cartItems() : List.of();
    }
}
