package com.chatter.chatbackend.friend;

/** Friend-of edges held by the relationship graph service. */
public interface FriendGraph {

    /**
     * @throws com.chatter.chatbackend.shared.RecipientResolutionException when the graph service
     *         cannot be reached
     */
    boolean isFriend(long uid, long friendUid);
}
