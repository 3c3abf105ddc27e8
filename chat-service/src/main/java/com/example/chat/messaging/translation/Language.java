package com.example.chat.messaging.translation;

import com.example.chat.shared.util.Constants;
import lombok.Getter;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Languages the platform translates between, with the provider's locale code and the
 * name in the language's own script.
 */
@Getter
public enum Language {
    HINDI("hindi", "hi-IN", "हिन्दी"),
    ENGLISH("english", "en-IN", "English"),
    TAMIL("tamil", "ta-IN", "தமிழ்"),
    TELUGU("telugu", "te-IN", "తెలుగు"),
    KANNADA("kannada", "kn-IN", "ಕನ್ನಡ"),
    MALAYALAM("malayalam", "ml-IN", "മലയാളം"),
    MARATHI("marathi", "mr-IN", "मराठी"),
    GUJARATI("gujarati", "gu-IN", "ગુજરાતી"),
    BENGALI("bengali", "bn-IN", "বাংলা"),
    PUNJABI("punjabi", "pa-IN", "ਪੰਜਾਬੀ");

    private final String id;
    private final String code;
    private final String nativeName;

    Language(String id, String code, String nativeName) {
        this.id = id;
        this.code = code;
        this.nativeName = nativeName;
    }

    public static Optional<Language> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(l -> l.id.equals(normalized)).findFirst();
    }

    public static Optional<Language> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(l -> l.code.equalsIgnoreCase(code.trim())).findFirst();
    }

    public static boolean isSupportedOrAuto(String id) {
        return Constants.AUTO_LANGUAGE.equalsIgnoreCase(id == null ? "" : id.trim()) || fromId(id).isPresent();
    }
}
