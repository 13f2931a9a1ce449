package com.chatter.chatbackend.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

public class ChatPayloadCodecTest {

    private final ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json().build();
    private final ChatPayloadCodec codec = new ChatPayloadCodec(objectMapper);

    @Test
    void encodesTaggedTargetAndDetail() throws Exception {
        ChatMessagePayload payload = new ChatMessagePayload(
                1,
                LocalDateTime.of(2024, 9, 1, 20, 5, 9),
                new MessageTarget.ToUser(2),
                new MessageDetail.Reply(41, "hi"));

        JsonNode json = objectMapper.readTree(codec.encode(payload));

        assertEquals(1, json.get("fromUid").asLong());
        assertEquals("2024-09-01 20:05:09", json.get("createdAt").asText());
        assertEquals(2, json.at("/target/User/uid").asLong());
        assertEquals(41, json.at("/detail/Reply/mid").asLong());
        assertEquals("hi", json.at("/detail/Reply/content").asText());
    }

    @Test
    void decodesGroupMessage() {
        String raw = """
                {"fromUid":3,"createdAt":"2024-09-01 08:00:00",
                 "target":{"Group":{"gid":7}},"detail":{"Normal":{"content":"hello"}}}
                """;

        ChatMessage message = codec.decode(12, raw.getBytes(StandardCharsets.UTF_8)).orElseThrow();

        assertEquals(12, message.mid());
        assertEquals(new MessageTarget.ToGroup(7), message.payload().target());
        assertEquals(new MessageDetail.Normal("hello"), message.payload().detail());
        assertNull(message.payload().detail().replyTo());
    }

    @Test
    void undecodablePayloadIsSkipped() {
        assertTrue(codec.decode(5, "not json".getBytes(StandardCharsets.UTF_8)).isEmpty());
    }
}
