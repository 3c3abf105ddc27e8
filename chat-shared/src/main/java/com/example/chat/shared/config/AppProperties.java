package com.example.chat.shared.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Data
@Validated
public class AppProperties {

    private String nodeName;

    private final Session session = new Session();
    private final Typing typing = new Typing();
    private final Store store = new Store();
    private final Db db = new Db();
    private final Translation translation = new Translation();
    private final Speech speech = new Speech();
    private final Media media = new Media();
    private final Auth auth = new Auth();
    private final H2Console h2Console = new H2Console();

    @Data
    public static class Session {
        /** Idle time after which a registered connection is evicted by the sweep. */
        @Positive
        private long staleThresholdMs = 300_000L;
        @Positive
        private long sweepIntervalMs = 60_000L;
        @Positive
        private long heartbeatIntervalMs = 30_000L;
        @Positive
        private int maxFailedEmits = 3;
    }

    @Data
    public static class Typing {
        /** 0 disables server-side expiry of typing flags. */
        @PositiveOrZero
        private long ttlMs = 10_000L;
        @Positive
        private long sweepIntervalMs = 2_000L;
    }

    @Data
    public static class Store {
        @Positive
        private int maxRetryAttempts = 50;
        @PositiveOrZero
        private long retryBackoffMs = 5L;
        @Positive
        private int defaultConversationPageSize = 20;
        @Positive
        private int maxConversationPageSize = 50;
        @Positive
        private int defaultMessagePageSize = 50;
        @Positive
        private int maxMessagePageSize = 100;
        @Positive
        private long expiryIntervalMs = 60_000L;
    }

    @Data
    public static class Db {
        @Positive
        private int jdbcParallelism = 10;
    }

    @Data
    public static class Translation {
        @NotBlank
        private String baseUrl = "https://api.sarvam.ai";
        private String apiKey = "";
        @Positive
        private long timeoutMs = 10_000L;
        @Positive
        private long cacheMaximumSize = 10_000L;
        @Positive
        private long cacheExpireAfterWriteMinutes = 30L;
        @Positive
        private int maxBulkTexts = 10;
    }

    @Data
    public static class Speech {
        @NotBlank
        private String baseUrl = "https://api.sarvam.ai";
        private String apiKey = "";
        @Positive
        private long timeoutMs = 30_000L;
        @NotBlank
        private String transcriptionModel = "saarika:v1";
        @NotBlank
        private String synthesisModel = "bulbul:v1";
        @NotBlank
        private String defaultSpeaker = "meera";
        @Positive
        private int synthesisSampleRate = 8000;
        /** Language used when the caller passes {@code auto}. */
        @NotBlank
        private String autoLanguageCode = "hi-IN";
    }

    @Data
    public static class Media {
        @NotBlank
        private String storagePath = "./data/media";
        @Positive
        private long maxVoiceBytes = 10L * 1024 * 1024;
        /** Byte rate used to estimate the duration of compressed audio. */
        @Positive
        private int estimatedBytesPerSecond = 8000;
        private List<String> allowedAudioTypes = new ArrayList<>(List.of(
                "audio/wav", "audio/x-wav", "audio/wave", "audio/mp3", "audio/mpeg",
                "audio/mp4", "audio/webm", "audio/ogg"));
    }

    @Data
    public static class Auth {
        @NotBlank
        private String jwtSecret = "change-me-change-me-change-me-change-me-0123456789";
        private String issuer = "chat-messaging";
        @PositiveOrZero
        private long clockSkewSeconds = 30L;
    }

    @Data
    public static class H2Console {
        private boolean enabled = false;
        private String webPort = "8084";
        private String tcpPort = "9094";
    }
}
