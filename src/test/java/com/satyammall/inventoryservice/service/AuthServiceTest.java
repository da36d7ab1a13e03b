package com.satyammall.inventoryservice.service;

import com.satyammall.inventoryservice.dto.response.LoginResponse;
import com.satyammall.inventoryservice.model.AppUser;
import com.satyammall.inventoryservice.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    private final PasswordEncoder encoder = new BCryptPasswordEncoder(4);

    @Mock
    private UserRepository userRepository;

    private AuthService authService;

    @BeforeEach
    void setUp() {
        authService = new AuthService(userRepository, encoder);
    }

    @Test
    void validCredentialsReturnTheUser() {
        when(userRepository.findByEmail("manager@satyammall.in")).thenReturn(Optional.of(user("s3cret")));

        LoginResponse response = authService.validateCredentials("  manager@satyammall.in ", "s3cret ");

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getUser().getName()).isEqualTo("Store Manager");
        assertThat(response.getUser().getRole()).isEqualTo("admin");
        assertThat(response.getMessage()).isNull();
        verify(userRepository).findByEmail("manager@satyammall.in");
    }

    @Test
    void wrongPasswordIsRejected() {
        when(userRepository.findByEmail(anyString())).thenReturn(Optional.of(user("s3cret")));

        LoginResponse response = authService.validateCredentials("manager@satyammall.in", "guess");

        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getUser()).isNull();
        assertThat(response.getMessage()).isEqualTo(AuthService.INVALID_CREDENTIALS);
    }

    @Test
    void unknownEmailGetsTheSameMessage() {
        when(userRepository.findByEmail(anyString())).thenReturn(Optional.empty());

        assertThat(authService.validateCredentials("nobody@satyammall.in", "x").getMessage())
                .isEqualTo(AuthService.INVALID_CREDENTIALS);
    }

    @Test
    void blankInputNeverReachesTheStore() {
        assertThat(authService.validateCredentials("   ", "pw").getMessage()).isEqualTo("Email and password are required");
        assertThat(authService.validateCredentials("a@b.c", null).isSuccess()).isFalse();
        verifyNoInteractions(userRepository);
    }

    private AppUser user(String password) {
        return AppUser.builder()
                .email("manager@satyammall.in")
                .name("Store Manager")
                .role("admin")
                .passwordHash(encoder.encode(password))
                .build();
    }
}
