package com.example.chat.messaging.voice;

/**
 * Blob storage for uploaded media. References returned by {@link #store} are opaque to
 * callers and are what messages keep.
 */
public interface MediaStorage {

    String store(byte[] content, String mimeType);

    byte[] load(String reference);
}
