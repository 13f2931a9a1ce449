package com.chatter.chatbackend.chat;

import com.chatter.chatbackend.friend.FakeFriendGraph;
import com.chatter.chatbackend.group.ChatGroup;
import com.chatter.chatbackend.group.GroupService;
import com.chatter.chatbackend.readindex.ReadIndex;
import com.chatter.chatbackend.readindex.ReadIndexRepository;
import com.chatter.chatbackend.user.CustomUserDetails;
import com.chatter.chatbackend.user.User;
import com.chatter.chatbackend.user.UserRepository;
import com.chatter.chatbackend.util.TestCleanupService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
public class ChatControllerTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;
    @Autowired private UserRepository userRepository;
    @Autowired private PasswordEncoder passwordEncoder;
    @Autowired private GroupService groupService;
    @Autowired private ReadIndexRepository readIndexRepository;
    @Autowired private FakeFriendGraph friendGraph;
    @Autowired private TestCleanupService testCleanupService;

    private User alice;
    private User bob;
    private User carol;

    @BeforeEach
    void setUp() {
        testCleanupService.cleanAll();
        friendGraph.clear();
        alice = createUser("test-alice");
        bob = createUser("test-bob");
        carol = createUser("test-carol");
        friendGraph.befriend(alice.getId(), bob.getId());
    }

    private User createUser(String name) {
        User user = new User();
        user.setName(name);
        user.setPassword(passwordEncoder.encode("secret"));
        return userRepository.save(user);
    }

    private static RequestPostProcessor as(User user) {
        CustomUserDetails details = new CustomUserDetails(user);
        return SecurityMockMvcRequestPostProcessors.authentication(
                new UsernamePasswordAuthenticationToken(details, null, details.getAuthorities()));
    }

    private JsonNode sendDm(User from, User to, String text) throws Exception {
        String body = mockMvc.perform(post("/api/chat/user/{uid}", to.getId())
                        .with(as(from))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("msg", text))))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(body);
    }

    @Test
    void sendDmThenReadHistoryFromTheOtherSide() throws Exception {
        JsonNode sent = sendDm(alice, bob, "hi");

        assertEquals(alice.getId().longValue(), sent.at("/payload/fromUid").asLong());
        assertEquals(bob.getId().longValue(), sent.at("/payload/target/User/uid").asLong());
        assertEquals("hi", sent.at("/payload/detail/Normal/content").asText());
        long mid = sent.get("mid").asLong();

        mockMvc.perform(get("/api/chat/user/{uid}/history", alice.getId()).with(as(bob)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].mid").value(mid))
                .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    void conversationListShowsUnreadUntilAcknowledged() throws Exception {
        JsonNode first = sendDm(alice, bob, "one");
        sendDm(alice, bob, "two");

        mockMvc.perform(get("/api/chat/list").with(as(bob)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].target.User.uid").value(alice.getId()))
                .andExpect(jsonPath("$[0].uidOfLatestMsg").value(alice.getId()))
                .andExpect(jsonPath("$[0].unread").value("all"))
                .andExpect(jsonPath("$[0].latestMessage.payload.detail.Normal.content").value("two"));

        String ack = """
                {"User":{"targetUid":%d,"mid":%d}}
                """.formatted(alice.getId(), first.get("mid").asLong());
        mockMvc.perform(put("/api/read-index").with(as(bob))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(ack))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/chat/list").with(as(bob)))
                .andExpect(jsonPath("$[0].unread").value("1"));

        // the sender has read everything it sent
        mockMvc.perform(get("/api/chat/list").with(as(alice)))
                .andExpect(jsonPath("$[0].unread").doesNotExist());
    }

    @Test
    void dmToStrangerIsForbidden() throws Exception {
        mockMvc.perform(post("/api/chat/user/{uid}", carol.getId())
                        .with(as(alice))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"msg\":\"hello\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("You are not friends with this user"));
    }

    @Test
    void blankMessageIsRejected() throws Exception {
        mockMvc.perform(post("/api/chat/user/{uid}", bob.getId())
                        .with(as(alice))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"msg\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Message must not be empty"));
    }

    @Test
    void groupMessagesReachMembersOnly() throws Exception {
        ChatGroup group = groupService.createGroup(alice.getId(), "test-group", List.of(bob.getId()));

        mockMvc.perform(post("/api/chat/group/{gid}", group.getId())
                        .with(as(bob))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"msg\":\"hello group\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.payload.target.Group.gid").value(group.getId()));

        mockMvc.perform(get("/api/chat/group/{gid}/history", group.getId()).with(as(alice)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].payload.detail.Normal.content").value("hello group"));

        mockMvc.perform(post("/api/chat/group/{gid}", group.getId())
                        .with(as(carol))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"msg\":\"let me in\"}"))
                .andExpect(status().isForbidden());

        mockMvc.perform(get("/api/chat/group/{gid}/history", 999_999L).with(as(alice)))
                .andExpect(status().isNotFound());
    }

    @Test
    void mutedMemberCannotSend() throws Exception {
        ChatGroup group = groupService.createGroup(alice.getId(), "test-muted", List.of(bob.getId()));
        groupService.setForbid(alice.getId(), group.getId(), bob.getId(), true);

        mockMvc.perform(post("/api/chat/group/{gid}", group.getId())
                        .with(as(bob))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"msg\":\"shh\"}"))
                .andExpect(status().isForbidden());
    }

    @Test
    void syncReturnsFeedAfterCursor() throws Exception {
        long first = sendDm(alice, bob, "a").get("mid").asLong();
        long second = sendDm(bob, alice, "b").get("mid").asLong();

        mockMvc.perform(get("/api/chat/sync").param("after", String.valueOf(first)).with(as(bob)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].mid").value(second));
    }

    @Test
    void streamEndpointOpensAsyncEventStream() throws Exception {
        mockMvc.perform(get("/api/chat/stream").with(as(alice)))
                .andExpect(request().asyncStarted());
    }

    @Test
    void unauthenticatedRequestsGet401() throws Exception {
        mockMvc.perform(get("/api/chat/list"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void strangerCannotAckSomeoneElsesDm() throws Exception {
        long mid = sendDm(alice, bob, "private-to-bob").get("mid").asLong();

        String ack = """
                {"User":{"targetUid":%d,"mid":%d}}
                """.formatted(alice.getId(), mid);
        mockMvc.perform(put("/api/read-index").with(as(carol))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(ack))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/chat/list").with(as(carol)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
        mockMvc.perform(get("/api/chat/list").with(as(alice)))
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].target.User.uid").value(bob.getId()));
    }

    @Test
    void conversationListDoesNotRevealForeignLatestMessage() throws Exception {
        long mid = sendDm(alice, bob, "private-to-bob").get("mid").asLong();
        readIndexRepository.save(ReadIndex.builder()
                .uid(carol.getId())
                .targetUid(alice.getId())
                .latestMid(mid)
                .uidOfLatestMsg(alice.getId())
                .build());

        mockMvc.perform(get("/api/chat/list").with(as(carol)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].latestMid").value(mid))
                .andExpect(jsonPath("$[0].latestMessage").doesNotExist());
    }
}
