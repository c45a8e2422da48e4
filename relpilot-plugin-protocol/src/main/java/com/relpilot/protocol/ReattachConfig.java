package com.relpilot.protocol;

import com.relpilot.plugin.Handshake;
import com.relpilot.plugin.HandshakeException;

import java.net.InetSocketAddress;

/**
 * Everything a host needs to attach to a running plugin server: protocol, app protocol version,
 * and the loopback address the server listens on. Serialized as the handshake line
 * {@code CORE|APP|tcp|HOST:PORT|grpc}.
 *
 * @param protocol        wire protocol, always {@value #PROTOCOL_GRPC}
 * @param protocolVersion app protocol version the plugin speaks
 * @param host            listening host
 * @param port            listening port
 * @param pid             plugin process id when the host spawned it, else null
 */
public record ReattachConfig(
        String protocol,
        int protocolVersion,
        String host,
        int port,
        Long pid
) {
    public static final String PROTOCOL_GRPC = "grpc";
    public static final String NETWORK_TCP = "tcp";

    public static ReattachConfig of(InetSocketAddress address) {
        return new ReattachConfig(PROTOCOL_GRPC, Handshake.PROTOCOL_VERSION,
                address.getAddress().getHostAddress(), address.getPort(), null);
    }

    public ReattachConfig withPid(long pid) {
        return new ReattachConfig(protocol, protocolVersion, host, port, pid);
    }

    public InetSocketAddress toSocketAddress() {
        return new InetSocketAddress(host, port);
    }

    public String toHandshakeLine() {
        return Handshake.CORE_PROTOCOL_VERSION + "|" + protocolVersion + "|" + NETWORK_TCP + "|"
                + host + ":" + port + "|" + protocol;
    }

    /**
     * Parses and checks a handshake line printed by a plugin.
     *
     * @throws HandshakeException when the line is malformed or a protocol version does not match
     */
    public static ReattachConfig parse(String line) {
        if (line == null || line.isBlank()) {
            throw new HandshakeException("plugin exited or printed no handshake line", line);
        }
        String[] parts = line.trim().split("\\|");
        if (parts.length != 5) {
            throw new HandshakeException("malformed handshake line, expected 5 fields: " + line, line);
        }
        int core = parseNumber(parts[0], "core protocol version", line);
        if (core != Handshake.CORE_PROTOCOL_VERSION) {
            throw new HandshakeException("incompatible core protocol version " + core + ", host supports "
                    + Handshake.CORE_PROTOCOL_VERSION, line);
        }
        int app = parseNumber(parts[1], "plugin protocol version", line);
        if (app != Handshake.PROTOCOL_VERSION) {
            throw new HandshakeException("incompatible plugin protocol version " + app + ", host supports "
                    + Handshake.PROTOCOL_VERSION, line);
        }
        if (!NETWORK_TCP.equals(parts[2])) {
            throw new HandshakeException("unsupported network " + parts[2], line);
        }
        if (!PROTOCOL_GRPC.equals(parts[4])) {
            throw new HandshakeException("unsupported protocol " + parts[4], line);
        }
        String address = parts[3];
        int colon = address.lastIndexOf(':');
        if (colon <= 0 || colon == address.length() - 1) {
            throw new HandshakeException("malformed address " + address, line);
        }
        int port = parseNumber(address.substring(colon + 1), "port", line);
        if (port < 1 || port > 65535) {
            throw new HandshakeException("port out of range: " + port, line);
        }
        return new ReattachConfig(parts[4], app, address.substring(0, colon), port, null);
    }

    private static int parseNumber(String value, String what, String line) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new HandshakeException("malformed " + what + ": " + value, line, e);
        }
    }
}
