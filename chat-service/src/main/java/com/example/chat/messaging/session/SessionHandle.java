package com.example.chat.messaging.session;

/**
 * Outbound side of one client connection.
 */
public interface SessionHandle {

    String id();

    /**
     * @return false when the frame could not be queued for the client
     */
    boolean send(String frame);

    /**
     * Stops accepting frames and closes the connection once queued frames are flushed.
     */
    void close(String reason);

    boolean isOpen();
}
