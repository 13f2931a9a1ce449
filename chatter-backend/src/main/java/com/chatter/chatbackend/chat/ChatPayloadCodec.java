package com.chatter.chatbackend.chat;

import com.chatter.chatbackend.msg.StoredMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** JSON form of {@link ChatMessagePayload} as it sits in the message store. */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChatPayloadCodec {

    private final ObjectMapper objectMapper;

    public byte[] encode(ChatMessagePayload payload) {
        try {
            return objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize message payload", e);
        }
    }

    public Optional<ChatMessage> decode(long mid, byte[] bytes) {
        try {
            return Optional.of(new ChatMessage(mid, objectMapper.readValue(bytes, ChatMessagePayload.class)));
        } catch (IOException e) {
            log.warn("Skipping message {}: payload does not decode ({})", mid, e.getMessage());
            return Optional.empty();
        }
    }

    public List<ChatMessage> decodeAll(List<StoredMessage> stored) {
        List<ChatMessage> out = new ArrayList<>(stored.size());
        for (StoredMessage m : stored) {
            decode(m.mid(), m.payload()).ifPresent(out::add);
        }
        return out;
    }
}
