package com.example.chat.shared.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;

/** Keyed by the reacting user, so a user holds at most one reaction per message. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Table("message_reactions")
public class MessageReaction {
    private String emoji;
    private OffsetDateTime reactedAt;
}
