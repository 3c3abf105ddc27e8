package com.example.chat.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForwardInfo {
    private String fromUserId;
    private Long originalMessageId;
    private OffsetDateTime forwardedAt;
}
