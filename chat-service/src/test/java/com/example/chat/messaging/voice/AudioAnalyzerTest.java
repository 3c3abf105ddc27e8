package com.example.chat.messaging.voice;

import com.example.chat.shared.config.AppProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AudioAnalyzerTest {

    private final AudioAnalyzer analyzer = new AudioAnalyzer(new AppProperties());

    @Test
    void readsDurationFromWavHeader() {
        AudioProfile profile = analyzer.analyze(TestAudio.wav(8000, 3.0, 0.8));

        assertThat(profile.durationSeconds()).isEqualTo(3.0);
        assertThat(profile.waveform()).hasSize(100);
        assertThat(profile.waveform()).allSatisfy(point -> assertThat(point).isBetween(0.0, 1.0));
        assertThat(profile.waveform()).contains(1.0);
        // the test clip gets louder towards the end
        assertThat(profile.waveform().get(99)).isGreaterThan(profile.waveform().get(5));
    }

    @Test
    void estimatesDurationOfCompressedAudio() {
        byte[] compressed = new byte[24_000];
        compressed[10] = 64;

        AudioProfile profile = analyzer.analyze(compressed);

        assertThat(profile.durationSeconds()).isEqualTo(3.0);
        assertThat(profile.waveform()).hasSize(100);
    }

    @Test
    void shortClipsAreAtLeastOneSecond() {
        assertThat(analyzer.analyze(new byte[100]).durationSeconds()).isEqualTo(1.0);
    }

    @Test
    void silenceHasFlatEnvelope() {
        List<Double> envelope = AudioAnalyzer.envelope(new double[5_000]);

        assertThat(envelope).hasSize(100).containsOnly(0.0);
        assertThat(AudioAnalyzer.envelope(new double[0])).hasSize(100).containsOnly(0.0);
    }
}
