package com.nile.betaskca.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.UUID;

/**
 * A catalog item. {@code quantity} is the stock on hand.
 *
 * Prices are held at scale {@value #PRICE_SCALE} with at most
 * {@value #PRICE_INTEGER_DIGITS} integer digits, matching the {@code items.price} column.
 */
public record Item(
        UUID id,
        String name,
        String description,
        BigDecimal price,
        int quantity
) {
    public Item {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(price, "price");
        if (price.signum() < 0) {
            throw new IllegalArgumentException("Price cannot be negative");
        }
        BigDecimal stripped = price.stripTrailingZeros();
        if (stripped.scale() > PRICE_SCALE) {
            throw new IllegalArgumentException("Price must have at most 2 decimal places");
        }
        if (stripped.precision() - stripped.scale() > PRICE_INTEGER_DIGITS) {
            throw new IllegalArgumentException("Price must be below 10000000000");
        }
        price = price.setScale(PRICE_SCALE, RoundingMode.UNNECESSARY);
        if (quantity < 0) {
            throw new IllegalArgumentException("Quantity cannot be negative");
        }
    }

    public static final int PRICE_SCALE = 2;
    public static final int PRICE_INTEGER_DIGITS = 10;

    /** True if at least {@code requested} units are on hand. */
    public boolean hasStock(int requested) {
        return quantity >= requested;
    }
}
