package pxefleet.runner.remote;

import org.apache.sshd.client.SshClient;
import org.apache.sshd.client.channel.ChannelExec;
import org.apache.sshd.client.channel.ClientChannelEvent;
import org.apache.sshd.client.keyverifier.AcceptAllServerKeyVerifier;
import org.apache.sshd.client.session.ClientSession;
import org.apache.sshd.common.keyprovider.FileKeyPairProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pxefleet.runner.config.RunnerConfig;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * SSH implementation of {@link RemoteShell} on Apache MINA SSHD.
 * One shared client; one session per opened channel. Client hosts are
 * re-imaged often, so host keys are not pinned.
 */
public class SshRemoteShell implements RemoteShell, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SshRemoteShell.class);

    private final SshClient client;
    private final String username;
    private final int port;
    private final Duration connectTimeout;

    public SshRemoteShell(RunnerConfig config) {
        this(config.sshUsername(), config.sshPort(), config.connectTimeout(), config.sshPrivateKey());
    }

    public SshRemoteShell(String username, int port, Duration connectTimeout, String privateKeyPath) {
        this.username = username;
        this.port = port;
        this.connectTimeout = connectTimeout;

        this.client = SshClient.setUpDefaultClient();
        client.setServerKeyVerifier(AcceptAllServerKeyVerifier.INSTANCE);
        if (privateKeyPath != null) {
            client.setKeyIdentityProvider(new FileKeyPairProvider(Path.of(privateKeyPath)));
            log.info("SSH client using private key {}", privateKeyPath);
        }
        client.start();
    }

    @Override
    public RemoteChannel open(String address) throws RemoteConnectionException {
        long timeoutMs = connectTimeout.toMillis();
        ClientSession session = null;
        try {
            session = client.connect(username, address, port)
                    .verify(timeoutMs)
                    .getSession();
            session.auth().verify(timeoutMs);
            log.debug("SSH session opened to {}@{}:{}", username, address, port);
            return new SshChannel(address, session);
        } catch (IOException e) {
            closeQuietly(session);
            throw new RemoteConnectionException(address,
                    "SSH connection to " + address + ":" + port + " failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            closeQuietly(session);
            throw new RemoteConnectionException(address,
                    "SSH connection to " + address + ":" + port + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        client.stop();
        log.info("SSH client stopped");
    }

    private static void closeQuietly(ClientSession session) {
        if (session == null) {
            return;
        }
        try {
            session.close();
        } catch (IOException e) {
            log.debug("Error closing SSH session: {}", e.getMessage());
        }
    }

    private static final class SshChannel implements RemoteChannel {

        private final String address;
        private final ClientSession session;

        SshChannel(String address, ClientSession session) {
            this.address = address;
            this.session = session;
        }

        @Override
        public CommandResult run(String command, Duration timeout) throws IOException {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            ByteArrayOutputStream err = new ByteArrayOutputStream();

            try (ChannelExec channel = session.createExecChannel(command)) {
                channel.setOut(out);
                channel.setErr(err);
                channel.open().verify(timeout.toMillis());

                Set<ClientChannelEvent> events = channel.waitFor(
                        EnumSet.of(ClientChannelEvent.CLOSED), timeout.toMillis());

                if (events.contains(ClientChannelEvent.TIMEOUT)) {
                    channel.close(true);
                    throw new RemoteCommandTimeoutException(command, timeout);
                }

                Integer exit = channel.getExitStatus();
                if (exit == null) {
                    throw new IOException("Channel to " + address + " closed without exit status");
                }
                return new CommandResult(exit,
                        out.toString(StandardCharsets.UTF_8),
                        err.toString(StandardCharsets.UTF_8));
            }
        }

        @Override
        public void close() {
            closeQuietly(session);
        }
    }
}
