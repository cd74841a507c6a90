package pxefleet.runner.remote;

import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SshRemoteShellTest {

    @Test
    void refusedConnectionIsReportedAsConnectionError() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }

        try (SshRemoteShell shell = new SshRemoteShell("root", port, Duration.ofSeconds(2), null)) {
            RemoteConnectionException e = assertThrows(RemoteConnectionException.class,
                    () -> shell.open("127.0.0.1"));

            assertEquals("127.0.0.1", e.address());
            assertTrue(e.getMessage().contains("127.0.0.1:" + port));
        }
    }
}
