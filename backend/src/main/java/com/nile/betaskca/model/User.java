package com.nile.betaskca.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A registered shopper together with the current contents of their cart.
 * Instances are immutable; cart changes produce a new {@code User}.
 */
public record User(
        UUID id,
        String email,
        String firstName,
        String lastName,
        String hashedPassword,
        String shippingAddress,
        List<CartItem> cartItems
) {
    public User {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(email, "email");
        cartItems = cartItems == null ? List.of() : List.copyOf(cartItems);
    }

    public boolean hasInCart(UUID itemId) {
        return cartItems.stream().anyMatch(ci -> ci.itemId().equals(itemId));
    }

    /** Copy of this user with {@code line} appended to the cart. */
    public User withCartItem(CartItem line) {
        if (!line.userId().equals(id)) {
            throw new IllegalArgumentException("Cart item belongs to another user");
        }
        List<CartItem> next = new ArrayList<>(cartItems);
        next.add(line);
        return new User(id, email, firstName, lastName, hashedPassword, shippingAddress, next);
    }
}
