package com.chatter.chatbackend.friend;

import com.chatter.chatbackend.shared.RecipientResolutionException;
import com.chatter.chatbackend.user.User;
import com.chatter.chatbackend.user.UserRepository;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Asks the graph service for the user's friend list with a DQL query and looks for the candidate
 * among the returned {@code user_id}s.
 */
@Service
@Slf4j
public class HttpFriendGraph implements FriendGraph {

    static final MediaType DQL = MediaType.parseMediaType("application/dql");

    private final RestClient restClient;
    private final UserRepository userRepository;

    public HttpFriendGraph(RestClient graphRestClient, UserRepository userRepository) {
        this.restClient = graphRestClient;
        this.userRepository = userRepository;
    }

    @Override
    public boolean isFriend(long uid, long friendUid) {
        String graphUid = userRepository.findById(uid).map(User::getGraphUid).orElse(null);
        if (graphUid == null || graphUid.isBlank()) {
            log.debug("User {} has no graph node, treating as friendless", uid);
            return false;
        }

        JsonNode body;
        try {
            body = restClient.post()
                    .uri("/query")
                    .contentType(DQL)
                    .body(friendsQuery(graphUid))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            log.error("Graph service query for user {} failed", uid, e);
            throw new RecipientResolutionException("Relationship service unavailable", e);
        }

        if (body == null) return false;
        JsonNode users = body.path("data").path("user");
        if (!users.isArray() || users.isEmpty()) return false;
        for (JsonNode friend : users.get(0).path("friend")) {
            if (friend.path("user_id").asLong(-1) == friendUid) return true;
        }
        return false;
    }

    static String friendsQuery(String graphUid) {
        String safe = graphUid.replace("\"", "");
        return """
                {
                    user(func: uid("%s")) {
                        uid
                        user_id
                        name
                        friend {
                            uid
                            user_id
                            name
                        }
                    }
                }
                """.formatted(safe);
    }
}
