package com.relpilot.protocol;

import com.relpilot.plugin.Handshake;
import com.relpilot.plugin.HandshakeException;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.InetSocketAddress;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReattachConfigTest {

    @Test
    void parse_readsHandshakeLine() {
        ReattachConfig config = ReattachConfig.parse("1|1|tcp|127.0.0.1:45123|grpc\n");
        assertEquals("127.0.0.1", config.host());
        assertEquals(45123, config.port());
        assertEquals(Handshake.PROTOCOL_VERSION, config.protocolVersion());
        assertEquals("grpc", config.protocol());
        assertNull(config.pid());
    }

    @Test
    void toHandshakeLine_isParsedBack() {
        ReattachConfig config = ReattachConfig.of(new InetSocketAddress(InetAddress.getLoopbackAddress(), 40000));
        assertEquals(config, ReattachConfig.parse(config.toHandshakeLine()));
        assertEquals(7L, config.withPid(7).pid());
    }

    @Test
    void parse_rejectsVersionMismatch() {
        HandshakeException app = assertThrows(HandshakeException.class,
                () -> ReattachConfig.parse("1|2|tcp|127.0.0.1:45123|grpc"));
        assertTrue(app.getMessage().startsWith("incompatible plugin protocol version 2"));
        assertEquals("1|2|tcp|127.0.0.1:45123|grpc", app.getHandshakeLine());

        HandshakeException core = assertThrows(HandshakeException.class,
                () -> ReattachConfig.parse("9|1|tcp|127.0.0.1:45123|grpc"));
        assertTrue(core.getMessage().startsWith("incompatible core protocol version 9"));
    }

    @Test
    void parse_rejectsMalformedLines() {
        assertThrows(HandshakeException.class, () -> ReattachConfig.parse(null));
        assertThrows(HandshakeException.class, () -> ReattachConfig.parse(""));
        assertThrows(HandshakeException.class, () -> ReattachConfig.parse("hello world"));
        assertThrows(HandshakeException.class, () -> ReattachConfig.parse("1|1|unix|/tmp/p.sock|grpc"));
        assertThrows(HandshakeException.class, () -> ReattachConfig.parse("1|1|tcp|127.0.0.1:45123|netrpc"));
        assertThrows(HandshakeException.class, () -> ReattachConfig.parse("1|1|tcp|127.0.0.1|grpc"));
        assertThrows(HandshakeException.class, () -> ReattachConfig.parse("1|1|tcp|127.0.0.1:99999|grpc"));
        assertThrows(HandshakeException.class, () -> ReattachConfig.parse("x|1|tcp|127.0.0.1:1|grpc"));
    }
}
