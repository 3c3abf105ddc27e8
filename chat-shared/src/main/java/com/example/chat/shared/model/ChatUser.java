package com.example.chat.shared.model;

import com.example.chat.shared.util.Constants.PresenceStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.domain.Persistable;
import org.springframework.data.annotation.Transient;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;

/**
 * Directory entry for a user, holding the fields the messaging core reads and the
 * presence it writes back.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("chat_users")
public class ChatUser implements Persistable<String> {
    @Id
    private String id;
    private String displayName;
    private boolean active;
    private PresenceStatus onlineStatus;
    private OffsetDateTime lastActiveAt;
    private String preferredLanguage;

    @Transient
    @Builder.Default
    private boolean newEntity = false;

    @Override
    public boolean isNew() {
        return newEntity;
    }
}
