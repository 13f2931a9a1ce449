package com.chatter.chatbackend.chat;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/** Where a message goes. Serialized as {@code {"User":{"uid":2}}} or {@code {"Group":{"gid":7}}}. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(value = MessageTarget.ToUser.class, name = "User"),
        @JsonSubTypes.Type(value = MessageTarget.ToGroup.class, name = "Group")
})
public interface MessageTarget {

    record ToUser(long uid) implements MessageTarget {
    }

    record ToGroup(long gid) implements MessageTarget {
    }
}
