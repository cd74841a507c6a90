package pxefleet.runner.remote;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pxefleet.runner.command.Command;
import pxefleet.runner.command.CommandPlan;
import pxefleet.runner.config.RunnerConfig;
import pxefleet.runner.model.ErrorKind;
import pxefleet.runner.model.Host;
import pxefleet.runner.model.SessionOutcome;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Runs one session's instructions on one host, strictly in order.
 *
 * <p>
 * Execution stops at the first instruction with a non-zero exit status.
 * Connection problems fail the session before any instruction runs. There is
 * no retry here: a failed host is only tried again by a new operation.
 *
 * <p>
 * Aborting closes the channel. Work that already finished keeps its real
 * outcome; only a command cut short by the abort is reported as cancelled.
 */
public class RemoteExecutor {

    private static final Logger log = LoggerFactory.getLogger(RemoteExecutor.class);

    private static final Duration GUI_TIMEOUT = Duration.ofSeconds(5);
    private static final int MAX_LOG_CHARS = 64 * 1024;

    private final RemoteShell shell;
    private final ClientCommandRenderer renderer;
    private final Duration commandTimeout;
    private final Duration sessionMaxDuration;

    public RemoteExecutor(RemoteShell shell, RunnerConfig config) {
        this(shell, new ClientCommandRenderer(config.wrapperPath()), config.commandTimeout(),
                config.sessionMaxDuration());
    }

    public RemoteExecutor(RemoteShell shell, ClientCommandRenderer renderer, Duration commandTimeout,
            Duration sessionMaxDuration) {
        this.shell = shell;
        this.renderer = renderer;
        this.commandTimeout = commandTimeout;
        this.sessionMaxDuration = sessionMaxDuration;
    }

    public SessionOutcome execute(Host host, CommandPlan plan, AbortSignal abort, ExecutionListener listener) {
        String address = host.address();
        if (abort.isAborted()) {
            return SessionOutcome.cancelled("Cancelled before connect");
        }

        Instant deadline = Instant.now().plus(sessionMaxDuration);
        List<Command> commands = plan.commands();
        StringBuilder output = new StringBuilder();

        RemoteChannel channel;
        try {
            channel = shell.open(address);
        } catch (RemoteConnectionException e) {
            if (abort.isAborted()) {
                return SessionOutcome.cancelled("Cancelled while connecting");
            }
            log.warn("Connection to {} ({}) failed: {}", host.hostname(), address, e.getMessage());
            return SessionOutcome.failed(ErrorKind.CONNECTION, e.getMessage());
        }

        try (channel) {
            abort.onAbort(channel::close);
            listener.onConnected();

            if (renderer.disablesGui(plan)) {
                runBestEffort(channel, renderer.guiDisable(), host);
            }

            Integer lastExit = null;
            for (int i = 0; i < commands.size(); i++) {
                int index = i + 1;
                Command command = commands.get(i);

                if (abort.isAborted()) {
                    return SessionOutcome.cancelled("Cancelled after " + i + " of " + commands.size() + " commands")
                            .withLog(trim(output));
                }

                Duration remaining = Duration.between(Instant.now(), deadline);
                if (remaining.isNegative() || remaining.isZero()) {
                    return SessionOutcome.commandFailed(ErrorKind.TIMEOUT,
                            "Session exceeded maximum duration of " + sessionMaxDuration.toSeconds() + "s",
                            index, null, trim(output));
                }
                Duration timeout = remaining.compareTo(commandTimeout) < 0 ? remaining : commandTimeout;

                String line = renderer.render(command, plan);
                log.debug("[{}] running {}", host.hostname(), line);

                CommandResult result;
                try {
                    result = channel.run(line, timeout);
                } catch (RemoteCommandTimeoutException e) {
                    return SessionOutcome.commandFailed(ErrorKind.TIMEOUT, e.getMessage(), index, null,
                            trim(output));
                } catch (IOException e) {
                    if (abort.isAborted()) {
                        return SessionOutcome.cancelled("Cancelled during '" + command.token() + "'")
                                .withLog(trim(output));
                    }
                    return SessionOutcome.commandFailed(ErrorKind.CONNECTION,
                            "Channel lost during '" + command.token() + "': " + e.getMessage(), index, null,
                            trim(output));
                }

                append(output, command, result);
                lastExit = result.exitCode();

                if (!result.succeeded()) {
                    log.info("[{}] '{}' exited with {}", host.hostname(), command.token(), result.exitCode());
                    return SessionOutcome.commandFailed(ErrorKind.COMMAND_EXECUTION,
                            "Command '" + command.token() + "' exited with " + result.exitCode(),
                            index, result.exitCode(), trim(output));
                }

                listener.onCommandCompleted(index, commands.size());
            }

            if (renderer.restoresGui(plan)) {
                runBestEffort(channel, renderer.guiRestore(), host);
            }

            return SessionOutcome.completed(lastExit, trim(output));
        }
    }

    private void runBestEffort(RemoteChannel channel, String line, Host host) {
        try {
            CommandResult result = channel.run(line, GUI_TIMEOUT);
            if (!result.succeeded()) {
                log.debug("[{}] '{}' exited with {}", host.hostname(), line, result.exitCode());
            }
        } catch (IOException e) {
            log.debug("[{}] '{}' failed: {}", host.hostname(), line, e.getMessage());
        }
    }

    private static void append(StringBuilder output, Command command, CommandResult result) {
        output.append("$ ").append(command.token()).append('\n');
        String text = result.output();
        if (!text.isEmpty()) {
            output.append(text);
            if (!text.endsWith("\n")) {
                output.append('\n');
            }
        }
    }

    private static String trim(StringBuilder output) {
        if (output.length() <= MAX_LOG_CHARS) {
            return output.toString();
        }
        return output.substring(output.length() - MAX_LOG_CHARS);
    }
}
