package com.chatter.chatbackend.chat.stream;

import java.io.IOException;

/** Write side of one push connection. */
public interface StreamSink {

    /** Pushes one named frame; an {@link IOException} means the client is gone. */
    void send(String event, Object data) throws IOException;

    void complete();
}
