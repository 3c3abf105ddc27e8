package com.example.chat.messaging.directory;

import com.example.chat.shared.aspect.Monitored;
import com.example.chat.shared.model.ChatUser;
import com.example.chat.shared.repository.ChatUserRepository;
import com.example.chat.shared.repository.UserConnectionRepository;
import com.example.chat.shared.util.Constants.PresenceStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
@Monitored("directory")
public class DatabaseDirectoryService implements DirectoryService {

    private final ChatUserRepository chatUserRepository;
    private final UserConnectionRepository userConnectionRepository;

    @Override
    public Optional<ChatUser> findUser(String userId) {
        if (userId == null || userId.isBlank()) {
            return Optional.empty();
        }
        return chatUserRepository.findById(userId);
    }

    @Override
    public boolean isBlockedBetween(String userA, String userB) {
        return userConnectionRepository.countBlocksBetween(userA, userB) > 0;
    }

    @Override
    public List<String> acceptedConnections(String userId) {
        return userConnectionRepository.findAcceptedConnectionIds(userId);
    }

    @Override
    public void updatePresence(String userId, PresenceStatus status, OffsetDateTime lastActive) {
        int updated = chatUserRepository.updatePresence(userId, status.name(), lastActive);
        if (updated == 0) {
            log.warn("Presence update for unknown user {} ignored", userId);
        }
    }
}
