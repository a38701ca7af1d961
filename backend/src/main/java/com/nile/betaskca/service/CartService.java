package com.nile.betaskca.service;

import com.nile.betaskca.dto.DTOs.AddToCartRequest;
import com.nile.betaskca.dto.DTOs.CartResponse;
import com.nile.betaskca.model.CartItem;
import com.nile.betaskca.model.User;
import com.nile.betaskca.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Service for user shopping carts.
 *
 * Adding to a cart checks, in order: the user exists, the item exists,
 * enough stock is on hand, and the item is not already in the cart.
 * Stock is checked but not reserved. The user row is locked for the
 * duration of the update.
 */
@Service
public class CartService {

    private static final Logger log = LoggerFactory.getLogger(CartService.class);

    private final UserRepository userRepository;
    private final ItemInventory itemInventory;

    public CartService(UserRepository userRepository, ItemInventory itemInventory) {
        this.userRepository = userRepository;
        this.itemInventory = itemInventory;
    }

    /**
     * Add an item to the user's cart and return the whole cart.
     *
     * @throws IllegalStateException if any of the checks above fails
     */
    @Transactional
    public CartResponse addItemToCart(UUID userId, AddToCartRequest req) {
        User user = userRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> rejected(userId, "User does not exists"));

        if (itemInventory.getItem(req.itemId()).isEmpty()) {
            throw rejected(userId, "Item does not exists");
        }
        if (!itemInventory.checkStock(req.itemId(), req.quantity())) {
            throw rejected(userId, "Not enough items in stock");
        }
        if (user.hasInCart(req.itemId())) {
            throw rejected(userId, "Item already in cart");
        }

        User updated = user.withCartItem(new CartItem(userId, req.itemId(), req.quantity()));
        userRepository.save(updated);
        log.info("User {} added {} x {} to cart", userId, req.quantity(), req.itemId());
        return CartResponse.of(updated.cartItems());
    }

    /** Cart contents; empty for an unknown user. */
    public CartResponse listCartItems(UUID userId) {
        return CartResponse.of(userRepository.findCartItems(userId));
    }

    private static IllegalStateException rejected(UUID userId, String reason) {
        log.warn("Cart update rejected for user {}: {}", userId, reason);
        return new IllegalStateException(reason);
    }
}
