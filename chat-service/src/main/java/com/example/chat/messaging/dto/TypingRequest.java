package com.example.chat.messaging.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TypingRequest {
    @NotNull(message = "isTyping is required")
    @JsonProperty("isTyping")
    private Boolean typing;
}
