package com.nile.betaskca.service;

import com.nile.betaskca.dto.DTOs.CreateUserRequest;
import com.nile.betaskca.dto.DTOs.UserDto;
import com.nile.betaskca.model.User;
import com.nile.betaskca.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    public UserService(UserRepository userRepository, PasswordEncoder passwordEncoder) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
    }

    /**
     * Register a new user with an empty cart. Emails are unique.
     *
     * @throws IllegalStateException if the email is already registered
     */
    @Transactional
    public UserDto createUser(CreateUserRequest req) {
        if (userRepository.findByEmail(req.email()).isPresent()) {
            log.warn("Rejected registration: email already registered");
            throw new IllegalStateException("An user with this email already exists");
        }

        User user = new User(
                UUID.randomUUID(),
                req.email(),
                req.firstName(),
                req.lastName(),
                passwordEncoder.encode(req.password()),
                req.shippingAddress(),
                List.of()
        );
        User saved = userRepository.save(user);
        log.info("Registered user {}", saved.id());
        return UserDto.from(saved);
    }
}
