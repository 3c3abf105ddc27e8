package com.example.chat.messaging.auth;

import com.example.chat.messaging.directory.DirectoryService;
import com.example.chat.shared.exception.AuthenticationFailureException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Token check followed by a directory check that the user exists and is active.
 * The directory lookup blocks.
 */
@Component
@RequiredArgsConstructor
public class ChatAuthenticator {

    private final JwtTokenService tokenService;
    private final DirectoryService directoryService;

    public String authenticate(String token) {
        String userId = tokenService.verify(token);
        if (!directoryService.isActiveUser(userId)) {
            throw new AuthenticationFailureException("User " + userId + " is unknown or inactive");
        }
        return userId;
    }
}
