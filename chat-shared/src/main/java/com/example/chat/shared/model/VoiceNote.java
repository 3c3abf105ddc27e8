package com.example.chat.shared.model;

import com.example.chat.shared.util.Constants.TranscriptStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Audio reference, transcript and amplitude envelope of a voice message.
 * The waveform is stored as a JSON number array.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VoiceNote {
    private String audioRef;
    private String mimeType;
    private double durationSeconds;
    private String transcriptText;
    private String transcriptLanguage;
    private Double transcriptConfidence;
    private TranscriptStatus transcriptStatus;
    private String waveform;
}
