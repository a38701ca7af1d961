package com.nile.betaskca.model;

import java.util.Objects;
import java.util.UUID;

/**
 * One line of a user's cart. A user holds at most one line per item.
 */
public record CartItem(
        UUID userId,
        UUID itemId,
        int quantity
) {
    public CartItem {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(itemId, "itemId");
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive");
        }
    }
}
