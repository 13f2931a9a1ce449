package com.chatter.chatbackend.chat.stream;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

@Slf4j
public class SseStreamSink implements StreamSink {

    private final SseEmitter emitter;

    public SseStreamSink(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void send(String event, Object data) throws IOException {
        try {
            emitter.send(SseEmitter.event().name(event).data(data, MediaType.APPLICATION_JSON));
        } catch (IllegalStateException e) {
            // emitter already completed by the container
            throw new IOException("Stream already closed", e);
        }
    }

    @Override
    public void complete() {
        try {
            emitter.complete();
        } catch (IllegalStateException e) {
            log.debug("Emitter was already completed: {}", e.getMessage());
        }
    }
}
