package com.example.chat.messaging.translation;

import org.springframework.stereotype.Component;

/**
 * Script-based guess of the language of a text. Devanagari is reported as Hindi; Latin and
 * anything unrecognised default to English.
 */
@Component
public class LanguageDetector {

    public static final double HEURISTIC_CONFIDENCE = 0.85;

    public Language detect(String text) {
        if (text == null || text.isBlank()) {
            return Language.ENGLISH;
        }
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            Language language = scriptOf(cp);
            if (language != null) {
                return language;
            }
            i += Character.charCount(cp);
        }
        return Language.ENGLISH;
    }

    private static Language scriptOf(int cp) {
        if (cp >= 0x0900 && cp <= 0x097F) return Language.HINDI;
        if (cp >= 0x0980 && cp <= 0x09FF) return Language.BENGALI;
        if (cp >= 0x0A00 && cp <= 0x0A7F) return Language.PUNJABI;
        if (cp >= 0x0A80 && cp <= 0x0AFF) return Language.GUJARATI;
        if (cp >= 0x0B80 && cp <= 0x0BFF) return Language.TAMIL;
        if (cp >= 0x0C00 && cp <= 0x0C7F) return Language.TELUGU;
        if (cp >= 0x0C80 && cp <= 0x0CFF) return Language.KANNADA;
        if (cp >= 0x0D00 && cp <= 0x0D7F) return Language.MALAYALAM;
        return null;
    }
}
