package com.example.chat.shared.model;

import com.example.chat.shared.util.Constants.MessageType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LastMessage {
    private String text;
    private String senderId;
    private MessageType type;
    private OffsetDateTime timestamp;
}
