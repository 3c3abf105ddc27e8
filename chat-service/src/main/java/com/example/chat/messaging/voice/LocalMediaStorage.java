package com.example.chat.messaging.voice;

import com.example.chat.shared.config.AppProperties;
import com.example.chat.shared.exception.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;

/**
 * Stores media on the local filesystem under {@code chat.media.storage-path}, one
 * directory per day.
 */
@Component
@Slf4j
public class LocalMediaStorage implements MediaStorage {

    private static final Map<String, String> EXTENSIONS = Map.of(
            "audio/wav", "wav", "audio/x-wav", "wav", "audio/wave", "wav",
            "audio/mp3", "mp3", "audio/mpeg", "mp3", "audio/mp4", "m4a",
            "audio/webm", "webm", "audio/ogg", "ogg");

    private final Path root;

    public LocalMediaStorage(AppProperties appProperties) {
        this.root = Path.of(appProperties.getMedia().getStoragePath()).toAbsolutePath().normalize();
    }

    @Override
    public String store(byte[] content, String mimeType) {
        String extension = EXTENSIONS.getOrDefault(mimeType, "bin");
        String reference = LocalDate.now(ZoneOffset.UTC) + "/" + UUID.randomUUID() + "." + extension;
        Path target = resolve(reference);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not store media " + reference, e);
        }
        log.debug("Stored {} bytes of {} as {}", content.length, mimeType, reference);
        return reference;
    }

    @Override
    public byte[] load(String reference) {
        try {
            return Files.readAllBytes(resolve(reference));
        } catch (NoSuchFileException e) {
            throw new ResourceNotFoundException("Media " + reference + " not found");
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read media " + reference, e);
        }
    }

    private Path resolve(String reference) {
        Path path = root.resolve(reference).normalize();
        if (!path.startsWith(root)) {
            throw new IllegalArgumentException("Media reference escapes the storage root: " + reference);
        }
        return path;
    }
}
