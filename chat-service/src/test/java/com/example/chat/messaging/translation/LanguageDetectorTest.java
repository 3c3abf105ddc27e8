package com.example.chat.messaging.translation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class LanguageDetectorTest {

    private final LanguageDetector detector = new LanguageDetector();

    @ParameterizedTest
    @CsvSource({
            "नमस्ते दोस्त, HINDI",
            "வணக்கம், TAMIL",
            "ನಮಸ್ಕಾರ, KANNADA",
            "নমস্কার, BENGALI",
            "Hello there, ENGLISH",
            "OK 123 நன்றி, TAMIL"
    })
    void detectsByScript(String text, Language expected) {
        assertThat(detector.detect(text)).isEqualTo(expected);
    }

    @Test
    void blankTextDefaultsToEnglish() {
        assertThat(detector.detect(null)).isEqualTo(Language.ENGLISH);
        assertThat(detector.detect("   ")).isEqualTo(Language.ENGLISH);
        assertThat(detector.detect("👍")).isEqualTo(Language.ENGLISH);
    }
}
