package com.example.chat.shared.model;

import com.example.chat.shared.util.Constants.ConnectionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;

/**
 * Directed social link from {@code userId} to {@code connectionUserId}. An accepted link is
 * stored in both directions; a block is stored by the blocking user only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("user_connections")
public class UserConnection {
    @Id
    private Long id;
    private String userId;
    private String connectionUserId;
    private ConnectionStatus status;
    private OffsetDateTime createdAt;
}
