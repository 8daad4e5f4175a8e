package dev.pluginlink.server.transport;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ListenAddressTest {

    @Test
    void parsesTcpUrlAndPlainHostPort() throws Exception {
        assertEquals(new ListenAddress.Tcp("0.0.0.0", 7071), ListenAddress.parse("tcp://0.0.0.0:7071"));
        assertEquals(new ListenAddress.Tcp("localhost", 9000), ListenAddress.parse("localhost:9000"));
        assertEquals(new ListenAddress.Tcp("0.0.0.0", 9000), ListenAddress.parse(":9000"));
        assertEquals(new ListenAddress.Tcp("::1", 9000), ListenAddress.parse("tcp://[::1]:9000"));
    }

    @Test
    void parsesUnixSocketPath() throws Exception {
        assertEquals(new ListenAddress.Unix(Path.of("/tmp/plugins.sock")), ListenAddress.parse("unix:///tmp/plugins.sock"));
        assertEquals("unix:///tmp/plugins.sock", ListenAddress.parse("unix:///tmp/plugins.sock").toString());
    }

    @Test
    void rejectsUnsupportedOrMalformedAddresses() {
        assertThrows(InvalidAddressException.class, () -> ListenAddress.parse("unix://"));
        assertThrows(InvalidAddressException.class, () -> ListenAddress.parse("http://localhost:8080"));
        assertThrows(InvalidAddressException.class, () -> ListenAddress.parse("localhost"));
        assertThrows(InvalidAddressException.class, () -> ListenAddress.parse("localhost:http"));
        assertThrows(InvalidAddressException.class, () -> ListenAddress.parse("localhost:70000"));
        assertThrows(InvalidAddressException.class, () -> ListenAddress.parse(""));
    }

    @Test
    void printsAsTcpUrl() throws Exception {
        assertEquals("tcp://127.0.0.1:0", ListenAddress.parse("127.0.0.1:0").toString());
    }
}
