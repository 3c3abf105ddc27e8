package com.example.chat.messaging.voice;

import java.util.List;

/**
 * Duration and normalized amplitude envelope of a clip.
 */
public record AudioProfile(double durationSeconds, List<Double> waveform) {
}
