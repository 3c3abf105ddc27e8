package com.example.chat.messaging.store;

import lombok.Builder;
import lombok.Value;

/**
 * Partial update of conversation settings. Null fields are left unchanged; {@code muted} and
 * {@code blocked} apply to the caller's own participant record only.
 */
@Value
@Builder
public class SettingsUpdate {
    Boolean autoTranslate;
    Boolean notifications;
    Boolean muted;
    Boolean blocked;
}
