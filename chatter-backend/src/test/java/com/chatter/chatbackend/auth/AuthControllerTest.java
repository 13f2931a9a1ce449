package com.chatter.chatbackend.auth;

import com.chatter.chatbackend.user.User;
import com.chatter.chatbackend.user.UserRepository;
import com.chatter.chatbackend.user.UserStatus;
import com.chatter.chatbackend.util.TestCleanupService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.web.servlet.MockMvc;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
public class AuthControllerTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;
    @Autowired private UserRepository userRepository;
    @Autowired private PasswordEncoder passwordEncoder;
    @Autowired private SessionRegistry sessionRegistry;
    @Autowired private TestCleanupService testCleanupService;

    private User user;

    @BeforeEach
    void setUp() {
        testCleanupService.cleanAll();
        user = new User();
        user.setName("test-dave");
        user.setPassword(passwordEncoder.encode("secret"));
        user = userRepository.save(user);
    }

    private String login(String name, String password) throws Exception {
        String body = mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"%s\",\"password\":\"%s\"}".formatted(name, password)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accessTokenExpires").exists())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(body).get("accessToken").asText();
    }

    @Test
    void loginTokenWorksUntilLogout() throws Exception {
        String token = login("test-dave", "secret");
        assertTrue(sessionRegistry.isActive(user.getId()));

        mockMvc.perform(get("/api/chat/list").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk());

        // EventSource style: token in the query string
        mockMvc.perform(get("/api/chat/sync").param("token", token))
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/auth/renew").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accessToken").isNotEmpty());

        mockMvc.perform(delete("/api/auth/logout").header("Authorization", "Bearer " + token))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/chat/list").header("Authorization", "Bearer " + token))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void wrongPasswordIsRejected() throws Exception {
        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"test-dave\",\"password\":\"nope\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Wrong user name or password"));
    }

    @Test
    void frozenAccountCannotLogIn() throws Exception {
        user.setStatus(UserStatus.FREEZE);
        userRepository.save(user);

        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"test-dave\",\"password\":\"secret\"}"))
                .andExpect(status().isForbidden());
    }

    @Test
    void garbageTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/api/chat/list").header("Authorization", "Bearer not-a-jwt"))
                .andExpect(status().isUnauthorized());
    }
}
