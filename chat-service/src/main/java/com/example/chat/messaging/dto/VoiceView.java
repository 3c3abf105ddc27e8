package com.example.chat.messaging.dto;

import com.example.chat.shared.util.Constants.TranscriptStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Voice part of a message with the waveform expanded to numbers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VoiceView {
    private String audioRef;
    private String mimeType;
    private double durationSeconds;
    private String transcriptText;
    private String transcriptLanguage;
    private Double transcriptConfidence;
    private TranscriptStatus transcriptStatus;
    private List<Double> waveform;
}
