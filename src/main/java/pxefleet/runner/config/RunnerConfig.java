package pxefleet.runner.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration holder for the operation runner.
 * All settings have sensible defaults; {@link #fromEnv()} overrides them
 * from environment variables.
 */
public final class RunnerConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/pxefleet;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Scheduler settings
    private Duration pollInterval = Duration.ofSeconds(5);
    private int maxConcurrentSessions = 5;
    private int maxBusyPolls = 60;
    private Duration staleSessionTimeout = Duration.ofMinutes(2);

    // Remote execution settings
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration commandTimeout = Duration.ofMinutes(5);
    private Duration sessionMaxDuration = Duration.ofHours(1);
    private String wrapperPath = "/usr/bin/linbo_wrapper";
    private String sshUsername = "root";
    private int sshPort = 22;
    private String sshPrivateKey = null;

    // Onboot settings
    private Path onbootDirectory = Path.of("/srv/linbo/linbocmd");

    // Wake-on-LAN settings
    private String wakeBroadcastAddress = "255.255.255.255";
    private int wakePort = 9;
    private int wakePacketCount = 3;
    private Duration wakePacketInterval = Duration.ofMillis(100);

    private RunnerConfig() {
    }

    public static RunnerConfig defaults() {
        return new RunnerConfig();
    }

    public static RunnerConfig fromEnv() {
        RunnerConfig config = new RunnerConfig();

        String dbUrl = env("RUNNER_DB_URL");
        if (dbUrl != null) {
            config.databaseUrl = dbUrl;
        }

        String port = env("RUNNER_PORT");
        if (port != null) {
            config.serverPort = Integer.parseInt(port);
        }

        String poll = env("RUNNER_POLL_INTERVAL_MS");
        if (poll != null) {
            config.pollInterval = Duration.ofMillis(Long.parseLong(poll));
        }

        String concurrency = env("RUNNER_MAX_CONCURRENT_SESSIONS");
        if (concurrency != null) {
            config.maxConcurrentSessions = Integer.parseInt(concurrency);
        }

        String busyPolls = env("RUNNER_MAX_BUSY_POLLS");
        if (busyPolls != null) {
            config.maxBusyPolls = Integer.parseInt(busyPolls);
        }

        String stale = env("RUNNER_STALE_SESSION_MS");
        if (stale != null) {
            config.staleSessionTimeout = Duration.ofMillis(Long.parseLong(stale));
        }

        String connect = env("RUNNER_CONNECT_TIMEOUT_MS");
        if (connect != null) {
            config.connectTimeout = Duration.ofMillis(Long.parseLong(connect));
        }

        String command = env("RUNNER_COMMAND_TIMEOUT_MS");
        if (command != null) {
            config.commandTimeout = Duration.ofMillis(Long.parseLong(command));
        }

        String maxDuration = env("RUNNER_SESSION_MAX_DURATION_MS");
        if (maxDuration != null) {
            config.sessionMaxDuration = Duration.ofMillis(Long.parseLong(maxDuration));
        }

        String wrapper = env("RUNNER_WRAPPER_PATH");
        if (wrapper != null) {
            config.wrapperPath = wrapper;
        }

        String onbootDir = env("RUNNER_LINBOCMD_DIR");
        if (onbootDir != null) {
            config.onbootDirectory = Path.of(onbootDir);
        }

        String sshUser = env("SSH_USERNAME");
        if (sshUser != null) {
            config.sshUsername = sshUser;
        }

        String sshPort = env("SSH_PORT");
        if (sshPort != null) {
            config.sshPort = Integer.parseInt(sshPort);
        }

        String sshKey = env("SSH_PRIVATE_KEY");
        if (sshKey != null) {
            config.sshPrivateKey = sshKey;
        }

        String wolAddress = env("WOL_BROADCAST_ADDRESS");
        if (wolAddress != null) {
            config.wakeBroadcastAddress = wolAddress;
        }

        String wolPort = env("WOL_PORT");
        if (wolPort != null) {
            config.wakePort = Integer.parseInt(wolPort);
        }

        String wolCount = env("WOL_PACKET_COUNT");
        if (wolCount != null) {
            config.wakePacketCount = Integer.parseInt(wolCount);
        }

        return config;
    }

    private static String env(String name) {
        String value = System.getenv(name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public int maxConcurrentSessions() {
        return maxConcurrentSessions;
    }

    public int maxBusyPolls() {
        return maxBusyPolls;
    }

    public Duration staleSessionTimeout() {
        return staleSessionTimeout;
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }

    public Duration commandTimeout() {
        return commandTimeout;
    }

    public Duration sessionMaxDuration() {
        return sessionMaxDuration;
    }

    public String wrapperPath() {
        return wrapperPath;
    }

    public String sshUsername() {
        return sshUsername;
    }

    public int sshPort() {
        return sshPort;
    }

    public String sshPrivateKey() {
        return sshPrivateKey;
    }

    public Path onbootDirectory() {
        return onbootDirectory;
    }

    public String wakeBroadcastAddress() {
        return wakeBroadcastAddress;
    }

    public int wakePort() {
        return wakePort;
    }

    public int wakePacketCount() {
        return wakePacketCount;
    }

    public Duration wakePacketInterval() {
        return wakePacketInterval;
    }

    // Fluent setters for testing/customization
    public RunnerConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public RunnerConfig withPollInterval(Duration interval) {
        this.pollInterval = interval;
        return this;
    }

    public RunnerConfig withMaxConcurrentSessions(int max) {
        this.maxConcurrentSessions = max;
        return this;
    }

    public RunnerConfig withMaxBusyPolls(int polls) {
        this.maxBusyPolls = polls;
        return this;
    }

    public RunnerConfig withStaleSessionTimeout(Duration timeout) {
        this.staleSessionTimeout = timeout;
        return this;
    }

    public RunnerConfig withOnbootDirectory(Path directory) {
        this.onbootDirectory = directory;
        return this;
    }

    @Override
    public String toString() {
        return "RunnerConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", pollInterval=" + pollInterval.toMillis() + "ms" +
                ", maxConcurrentSessions=" + maxConcurrentSessions +
                ", onbootDirectory=" + onbootDirectory +
                '}';
    }
}
