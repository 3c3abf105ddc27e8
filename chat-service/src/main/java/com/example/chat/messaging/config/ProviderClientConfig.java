package com.example.chat.messaging.config;

import com.example.chat.shared.config.AppProperties;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * WebClients for the translation and speech providers. Both authenticate with the
 * provider's subscription key header.
 */
@Configuration
@Slf4j
public class ProviderClientConfig {

    static final String SUBSCRIPTION_KEY_HEADER = "api-subscription-key";
    private static final int CONNECT_TIMEOUT_MS = 5_000;
    // synthesized audio comes back base64-encoded in the JSON body
    private static final int MAX_IN_MEMORY_BYTES = 16 * 1024 * 1024;

    @Bean
    public WebClient translationWebClient(WebClient.Builder builder, AppProperties appProperties) {
        AppProperties.Translation translation = appProperties.getTranslation();
        log.info("Configuring translation client for {} (timeout {}ms)", translation.getBaseUrl(), translation.getTimeoutMs());
        return build(builder, translation.getBaseUrl(), translation.getApiKey(), translation.getTimeoutMs());
    }

    @Bean
    public WebClient speechWebClient(WebClient.Builder builder, AppProperties appProperties) {
        AppProperties.Speech speech = appProperties.getSpeech();
        log.info("Configuring speech client for {} (timeout {}ms)", speech.getBaseUrl(), speech.getTimeoutMs());
        return build(builder, speech.getBaseUrl(), speech.getApiKey(), speech.getTimeoutMs());
    }

    private static WebClient build(WebClient.Builder builder, String baseUrl, String apiKey, long timeoutMs) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS)
                .responseTimeout(Duration.ofMillis(timeoutMs));
        return builder.clone()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(SUBSCRIPTION_KEY_HEADER, apiKey == null ? "" : apiKey)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                .build();
    }
}
