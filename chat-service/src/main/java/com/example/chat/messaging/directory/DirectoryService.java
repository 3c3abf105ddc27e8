package com.example.chat.messaging.directory;

import com.example.chat.shared.model.ChatUser;
import com.example.chat.shared.util.Constants.PresenceStatus;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Identity and social-graph lookups the messaging core depends on.
 */
public interface DirectoryService {

    Optional<ChatUser> findUser(String userId);

    default boolean isActiveUser(String userId) {
        return findUser(userId).map(ChatUser::isActive).orElse(false);
    }

    /** True when either user has blocked the other. */
    boolean isBlockedBetween(String userA, String userB);

    /** Users with an accepted connection to {@code userId}. */
    List<String> acceptedConnections(String userId);

    void updatePresence(String userId, PresenceStatus status, OffsetDateTime lastActive);
}
