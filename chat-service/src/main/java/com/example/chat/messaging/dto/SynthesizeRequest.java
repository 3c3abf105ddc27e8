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
public class SynthesizeRequest {
    @NotBlank(message = "Text is required")
    @Size(max = 5000, message = "Text must be at most 5000 characters")
    private String text;

    @Builder.Default
    private String language = "hindi";

    private String voice;
}
