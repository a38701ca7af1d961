package com.nile.betaskca.controller;

import com.nile.betaskca.dto.DTOs.AddToCartRequest;
import com.nile.betaskca.dto.DTOs.CartResponse;
import com.nile.betaskca.dto.DTOs.CreateUserRequest;
import com.nile.betaskca.dto.DTOs.UserDto;
import com.nile.betaskca.service.CartService;
import com.nile.betaskca.service.UserService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * REST API for users and their carts.
 *
 *   POST   /users                 : register user (409 if the email is taken)
 *   POST   /users/{user_id}/cart  : add item to cart (409 on unknown user/item, low stock, duplicate line)
 *   GET    /users/{user_id}/cart  : list cart contents
 */
@RestController
@RequestMapping("/users")
public class UserController {

    private final UserService userService;
    private final CartService cartService;

    public UserController(UserService userService, CartService cartService) {
        this.userService = userService;
        this.cartService = cartService;
    }

    @PostMapping({"", "/"})
    public UserDto createUser(@Valid @RequestBody CreateUserRequest request) {
        return userService.createUser(request);
    }

    @PostMapping("/{userId}/cart")
    public CartResponse addToCart(
            @PathVariable UUID userId,
            @Valid @RequestBody AddToCartRequest request
    ) {
        return cartService.addItemToCart(userId, request);
    }

    @GetMapping("/{userId}/cart")
    public CartResponse getCart(@PathVariable UUID userId) {
        return cartService.listCartItems(userId);
    }
}
