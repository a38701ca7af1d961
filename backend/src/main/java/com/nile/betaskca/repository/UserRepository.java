package com.nile.betaskca.repository;

import com.nile.betaskca.model.CartItem;
import com.nile.betaskca.model.User;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence contract for users and their carts.
 */
public interface UserRepository {

    /**
     * Inserts or updates the user by id. The stored cart is replaced by
     * the cart lines carried on {@code user}.
     *
     * @param user The user to save.
     * @return The user as stored.
     */
    User save(User user);

    Optional<User> findById(UUID userId);

    /**
     * Like {@link #findById} but locks the user until the surrounding transaction
     * ends, so cart updates of one user run one after another.
     */
    Optional<User> findByIdForUpdate(UUID userId);

    Optional<User> findByEmail(String email);

    /**
     * Cart lines of the given user, empty when the user has none or does not exist.
     */
    List<CartItem> findCartItems(UUID userId);
}
