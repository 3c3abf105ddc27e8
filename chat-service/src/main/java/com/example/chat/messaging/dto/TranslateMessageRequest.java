package com.example.chat.messaging.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TranslateMessageRequest {
    @NotBlank(message = "Target language is required")
    private String targetLanguage;
}
