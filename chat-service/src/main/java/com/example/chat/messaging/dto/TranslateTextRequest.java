package com.example.chat.messaging.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TranslateTextRequest {
    @NotBlank(message = "Text is required")
    @Size(max = 10000, message = "Text must be at most 10000 characters")
    private String text;

    @NotBlank(message = "Target language is required")
    private String targetLanguage;

    @Builder.Default
    private String sourceLanguage = "auto";
}
