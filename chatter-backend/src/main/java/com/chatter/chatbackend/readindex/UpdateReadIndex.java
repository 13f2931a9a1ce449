package com.chatter.chatbackend.readindex;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Request body of {@code PUT /api/read-index}:
 * {@code {"User":{"targetUid":2,"mid":100}}} or {@code {"Group":{"targetGid":7,"mid":200}}}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(value = UpdateReadIndex.User.class, name = "User"),
        @JsonSubTypes.Type(value = UpdateReadIndex.Group.class, name = "Group")
})
public interface UpdateReadIndex {

    Long mid();

    record User(@NotNull Long targetUid, @NotNull @Positive Long mid) implements UpdateReadIndex {
    }

    record Group(@NotNull Long targetGid, @NotNull @Positive Long mid) implements UpdateReadIndex {
    }
}
