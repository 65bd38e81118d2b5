package respite;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class RespiteServerTest {
    private Respite server;

    @BeforeEach
    public void setup() throws Exception {
        Config config = Config.builder()
                .port(0)
                .dir("/var/lib/respite")
                .dbFileName("dump.rdb")
                .build();
        server = new Respite(config);
        server.start();
    }

    @AfterEach
    public void tearDown() {
        server.shutdown();
    }

    private Socket connect() throws IOException {
        Socket socket = new Socket("127.0.0.1", server.getPort());
        socket.setSoTimeout(5000);
        return socket;
    }

    private static void send(Socket socket, String data) throws IOException {
        OutputStream out = socket.getOutputStream();
        out.write(data.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    private static String read(Socket socket, int length) throws IOException {
        byte[] buf = new byte[length];
        new DataInputStream(socket.getInputStream()).readFully(buf);
        return new String(buf, StandardCharsets.UTF_8);
    }

    @Test
    public void testCommandsOverTcp() throws Exception {
        try (Socket socket = connect()) {
            send(socket, "*1\r\n$4\r\nPING\r\n");
            assertEquals("+PONG\r\n", read(socket, 7));

            send(socket, "*3\r\n$3\r\nSET\r\n$3\r\nfoo\r\n$3\r\nbar\r\n");
            assertEquals("+OK\r\n", read(socket, 5));

            send(socket, "*2\r\n$3\r\nGET\r\n$3\r\nfoo\r\n");
            assertEquals("$3\r\nbar\r\n", read(socket, 9));

            send(socket, "*3\r\n$6\r\nCONFIG\r\n$3\r\nGET\r\n$3\r\ndir\r\n");
            String expected = "*2\r\n$3\r\ndir\r\n$16\r\n/var/lib/respite\r\n";
            assertEquals(expected, read(socket, expected.length()));
        }
    }

    @Test
    public void testStoreIsSharedAcrossConnections() throws Exception {
        try (Socket writer = connect(); Socket reader = connect()) {
            send(writer, "*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$5\r\nhello\r\n");
            assertEquals("+OK\r\n", read(writer, 5));

            send(reader, "*2\r\n$3\r\nGET\r\n$1\r\nk\r\n");
            assertEquals("$5\r\nhello\r\n", read(reader, 11));
        }
        assertEquals("hello", server.getStore().get("k").getValue());
    }

    @Test
    public void testExpiryOverTcp() throws Exception {
        try (Socket socket = connect()) {
            send(socket, "*5\r\n$3\r\nSET\r\n$1\r\nk\r\n$1\r\nv\r\n$2\r\nPX\r\n$2\r\n50\r\n");
            assertEquals("+OK\r\n", read(socket, 5));

            Thread.sleep(100);

            send(socket, "*2\r\n$3\r\nGET\r\n$1\r\nk\r\n");
            assertEquals("$-1\r\n", read(socket, 5));
        }
        assertNotNull(server.getStore().get("k"));
    }

    @Test
    public void testUnknownCommandGetsNoReply() throws Exception {
        try (Socket socket = connect()) {
            // Only the PING is answered
            send(socket, "*1\r\n$5\r\nHELLO\r\n*1\r\n$4\r\nPING\r\n");
            assertEquals("+PONG\r\n", read(socket, 7));
        }
    }

    @Test
    public void testProtocolViolationOnlyClosesOffendingConnection() throws Exception {
        try (Socket bad = connect(); Socket good = connect()) {
            send(bad, "!garbage\r\n");
            assertEquals(-1, bad.getInputStream().read());

            send(good, "*1\r\n$4\r\nPING\r\n");
            assertEquals("+PONG\r\n", read(good, 7));
        }
    }
}
