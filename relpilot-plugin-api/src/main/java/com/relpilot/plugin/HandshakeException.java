package com.relpilot.plugin;

/**
 * Thrown when a plugin process fails the handshake: missing or wrong magic cookie, malformed
 * handshake line, or a protocol version the host does not speak. Fatal for that plugin; no RPC
 * is attempted afterwards.
 */
public class HandshakeException extends RuntimeException {

    private final String handshakeLine;

    public HandshakeException(String message, String handshakeLine) {
        super(message);
        this.handshakeLine = handshakeLine;
    }

    public HandshakeException(String message, String handshakeLine, Throwable cause) {
        super(message, cause);
        this.handshakeLine = handshakeLine;
    }

    /** Line the plugin printed, or null when none was read. */
    public String getHandshakeLine() {
        return handshakeLine;
    }
}
