package com.satyammall.inventoryservice.service;

import com.satyammall.inventoryservice.dto.response.LoginResponse;
import com.satyammall.inventoryservice.dto.response.UserResponse;
import com.satyammall.inventoryservice.model.AppUser;
import com.satyammall.inventoryservice.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Checks staff credentials against the user accounts in the store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    static final String INVALID_CREDENTIALS = "Invalid email or password";

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    public LoginResponse validateCredentials(String email, String password) {
        String trimmedEmail = email == null ? "" : email.trim();
        String trimmedPassword = password == null ? "" : password.trim();
        if (trimmedEmail.isEmpty() || trimmedPassword.isEmpty()) {
            return LoginResponse.rejected("Email and password are required");
        }

        Optional<AppUser> user = userRepository.findByEmail(trimmedEmail);
        if (user.isEmpty() || user.get().getPasswordHash() == null
                || !passwordEncoder.matches(trimmedPassword, user.get().getPasswordHash())) {
            log.info("Rejected login for {}", trimmedEmail);
            return LoginResponse.rejected(INVALID_CREDENTIALS);
        }
        return LoginResponse.ok(UserResponse.from(user.get()));
    }
}
