package com.example.chat.messaging.voice;

import com.example.chat.shared.config.AppProperties;
import com.example.chat.shared.util.Constants;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads duration and a peak envelope from raw audio. PCM WAV is parsed from its RIFF
 * header and samples; any other container is estimated from its size and treated as a
 * byte stream for the envelope.
 */
@Component
@RequiredArgsConstructor
public class AudioAnalyzer {

    private static final int PCM_FORMAT = 1;
    private static final double MIN_ESTIMATED_SECONDS = 1.0;

    private final AppProperties appProperties;

    public AudioProfile analyze(byte[] audio) {
        WavInfo wav = parseWav(audio);
        if (wav != null) {
            double duration = round((double) wav.dataLength / wav.byteRate);
            return new AudioProfile(duration, envelope(wavSamples(audio, wav)));
        }
        double estimated = (double) audio.length / appProperties.getMedia().getEstimatedBytesPerSecond();
        return new AudioProfile(round(Math.max(MIN_ESTIMATED_SECONDS, estimated)), envelope(byteSamples(audio)));
    }

    /**
     * Splits the samples into a fixed number of buckets, keeps each bucket's peak and scales
     * so the loudest bucket is 1.0. Silence stays all zeros.
     */
    static List<Double> envelope(double[] samples) {
        int points = Constants.WAVEFORM_POINTS;
        double[] peaks = new double[points];
        if (samples.length > 0) {
            for (int bucket = 0; bucket < points; bucket++) {
                int from = (int) ((long) bucket * samples.length / points);
                int to = (int) ((long) (bucket + 1) * samples.length / points);
                double peak = 0;
                for (int i = from; i < to; i++) {
                    peak = Math.max(peak, samples[i]);
                }
                peaks[bucket] = peak;
            }
        }
        double max = 0;
        for (double peak : peaks) {
            max = Math.max(max, peak);
        }
        List<Double> waveform = new ArrayList<>(points);
        for (double peak : peaks) {
            waveform.add(max > 0 ? round(peak / max) : 0.0);
        }
        return waveform;
    }

    private static WavInfo parseWav(byte[] audio) {
        if (audio.length < 44 || !ascii(audio, 0, "RIFF") || !ascii(audio, 8, "WAVE")) {
            return null;
        }
        ByteBuffer buffer = ByteBuffer.wrap(audio).order(ByteOrder.LITTLE_ENDIAN);
        int format = -1;
        int byteRate = 0;
        int bitsPerSample = 0;
        int offset = 12;
        while (offset + 8 <= audio.length) {
            long chunkSize = Integer.toUnsignedLong(buffer.getInt(offset + 4));
            int body = offset + 8;
            if (ascii(audio, offset, "fmt ") && body + 16 <= audio.length) {
                format = buffer.getShort(body) & 0xFFFF;
                byteRate = buffer.getInt(body + 8);
                bitsPerSample = buffer.getShort(body + 14) & 0xFFFF;
            } else if (ascii(audio, offset, "data")) {
                if (format != PCM_FORMAT || byteRate <= 0) {
                    return null;
                }
                int length = (int) Math.min(chunkSize, audio.length - body);
                return new WavInfo(body, length, byteRate, bitsPerSample);
            }
            // chunks are word aligned
            offset = (int) Math.min((long) body + chunkSize + (chunkSize & 1), Integer.MAX_VALUE);
        }
        return null;
    }

    private static double[] wavSamples(byte[] audio, WavInfo wav) {
        if (wav.bitsPerSample == 16) {
            ByteBuffer buffer = ByteBuffer.wrap(audio, wav.dataOffset, wav.dataLength).order(ByteOrder.LITTLE_ENDIAN);
            double[] samples = new double[wav.dataLength / 2];
            for (int i = 0; i < samples.length; i++) {
                samples[i] = Math.abs(buffer.getShort()) / 32768.0;
            }
            return samples;
        }
        if (wav.bitsPerSample == 8) {
            double[] samples = new double[wav.dataLength];
            for (int i = 0; i < samples.length; i++) {
                samples[i] = Math.abs((audio[wav.dataOffset + i] & 0xFF) - 128) / 128.0;
            }
            return samples;
        }
        return byteSamples(Arrays.copyOfRange(audio, wav.dataOffset, wav.dataOffset + wav.dataLength));
    }

    private static double[] byteSamples(byte[] audio) {
        double[] samples = new double[audio.length];
        for (int i = 0; i < audio.length; i++) {
            samples[i] = Math.abs(audio[i]) / 128.0;
        }
        return samples;
    }

    private static boolean ascii(byte[] data, int offset, String expected) {
        if (offset + expected.length() > data.length) {
            return false;
        }
        return new String(data, offset, expected.length(), StandardCharsets.US_ASCII).equals(expected);
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }

    private record WavInfo(int dataOffset, int dataLength, int byteRate, int bitsPerSample) {
    }
}
