package com.example.chat.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationSettings {
    @Builder.Default
    private boolean autoTranslate = true;
    @Builder.Default
    private boolean notifications = true;
}
