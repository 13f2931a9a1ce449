package com.chatter.chatbackend.auth;

import com.chatter.chatbackend.user.CurrentUserService;
import com.chatter.chatbackend.user.User;
import com.chatter.chatbackend.user.UserRepository;
import com.chatter.chatbackend.user.UserStatus;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDateTime;

import static com.chatter.chatbackend.util.TimeFormat.EAST_8;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
@Slf4j
public class AuthController {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwtService;
    private final SessionRegistry sessionRegistry;
    private final CurrentUserService currentUserService;

    @PostMapping("/login")
    public LoginResponse login(@Valid @RequestBody LoginRequest request) {
        User user = userRepository.findByName(request.name())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Wrong user name or password"));

        if (!passwordEncoder.matches(request.password(), user.getPassword())) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Wrong user name or password");
        }
        if (user.getStatus() == UserStatus.FREEZE) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "This account has been frozen");
        }

        sessionRegistry.register(user.getId(), user.getName());
        log.info("User {} logged in", user.getId());
        return issue(user);
    }

    @DeleteMapping("/logout")
    public ResponseEntity<Void> logout() {
        long uid = currentUserService.currentUid();
        sessionRegistry.invalidate(uid);
        log.info("User {} logged out", uid);
        return ResponseEntity.noContent().build();
    }

    /** New token for a user whose session is still alive. */
    @PostMapping("/renew")
    public LoginResponse renew() {
        long uid = currentUserService.currentUid();
        User user = userRepository.findById(uid)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Unknown user"));
        return issue(user);
    }

    private LoginResponse issue(User user) {
        String token = jwtService.generateToken(user);
        LocalDateTime expires = LocalDateTime.ofInstant(jwtService.expiresAt(token), EAST_8);
        return new LoginResponse(token, expires);
    }
}
