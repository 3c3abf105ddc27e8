package com.example.chat.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;

/**
 * Cached translation of a message; the target language is the key in {@link Message#getTranslations()}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("message_translations")
public class MessageTranslation {
    private String text;
    private double confidence;
    private OffsetDateTime translatedAt;
}
