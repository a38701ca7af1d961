package com.nile.betaskca.dto;

import com.nile.betaskca.model.CartItem;
import com.nile.betaskca.model.Item;
import com.nile.betaskca.model.User;
import jakarta.validation.constraints.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Request and response bodies of the HTTP API. Field names go over the wire
 * in snake_case (see {@code spring.jackson.property-naming-strategy}).
 */
public class DTOs {

    // ── Items ──

    public record CreateItemRequest(
            @NotBlank(message = "Name is required")
            @Size(max = 255, message = "Name must be 255 characters or fewer")
            String name,

            @Size(max = 2000, message = "Description must be 2000 characters or fewer")
            String description,

            @NotNull(message = "Price is required")
            @PositiveOrZero(message = "Price cannot be negative")
            @Digits(integer = 10, fraction = 2, message = "Price must have at most 10 integer digits and 2 decimal places")
            BigDecimal price,

            @NotNull(message = "Quantity is required")
            @PositiveOrZero(message = "Quantity cannot be negative")
            Integer quantity
    ) {}

    public record ItemDto(
            UUID id,
            String name,
            String description,
            BigDecimal price,
            int quantity
    ) {
        public static ItemDto from(Item item) {
            return new ItemDto(item.id(), item.name(), item.description(), item.price(), item.quantity());
        }
    }

    public record AllItemsResponse(List<ItemDto> items) {}

    // ── Users ──

    public record CreateUserRequest(
            @NotBlank(message = "First name is required")
            @Size(max = 100, message = "First name must be 100 characters or fewer")
            String firstName,

            @NotBlank(message = "Last name is required")
            @Size(max = 100, message = "Last name must be 100 characters or fewer")
            String lastName,

            @NotBlank(message = "Email is required")
            @Email(message = "Email must be a valid address")
            String email,

            @NotBlank(message = "Password is required")
            String password,

            @Size(max = 1000, message = "Shipping address must be 1000 characters or fewer")
            String shippingAddress
    ) {}

    /** A user as returned to clients. The password hash is never exposed. */
    public record UserDto(
            UUID id,
            String firstName,
            String lastName,
            String email,
            String shippingAddress
    ) {
        public static UserDto from(User user) {
            return new UserDto(user.id(), user.firstName(), user.lastName(), user.email(), user.shippingAddress());
        }
    }

    // ── Cart ──

    public record AddToCartRequest(
            @NotNull(message = "Item id is required")
            UUID itemId,

            @NotNull(message = "Quantity is required")
            @Positive(message = "Quantity must be positive")
            Integer quantity
    ) {}

    public record CartLineDto(UUID itemId, int quantity) {
        public static CartLineDto from(CartItem line) {
            return new CartLineDto(line.itemId(), line.quantity());
        }
    }

    public record CartResponse(List<CartLineDto> items) {
        public static CartResponse of(List<CartItem> lines) {
            return new CartResponse(lines.stream().map(CartLineDto::from).toList());
        }
    }
}
