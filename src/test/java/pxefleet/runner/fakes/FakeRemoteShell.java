package pxefleet.runner.fakes;

import pxefleet.runner.remote.CommandResult;
import pxefleet.runner.remote.RemoteChannel;
import pxefleet.runner.remote.RemoteCommandTimeoutException;
import pxefleet.runner.remote.RemoteConnectionException;
import pxefleet.runner.remote.RemoteShell;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable in-memory remote shell. Every command succeeds with exit 0
 * unless a rule says otherwise.
 */
public class FakeRemoteShell implements RemoteShell {

    private final Set<String> unreachable = ConcurrentHashMap.newKeySet();
    private final Map<String, Integer> exitCodes = new ConcurrentHashMap<>();
    private final Set<String> timeouts = ConcurrentHashMap.newKeySet();
    private final Map<String, List<String>> executed = new ConcurrentHashMap<>();
    private final List<String> connects = new CopyOnWriteArrayList<>();

    private final AtomicInteger open = new AtomicInteger();
    private final AtomicInteger maxOpen = new AtomicInteger();
    private volatile CountDownLatch gate;
    private volatile CountDownLatch started = new CountDownLatch(0);

    public FakeRemoteShell unreachable(String address) {
        unreachable.add(address);
        return this;
    }

    /** Commands containing {@code fragment} exit with {@code exitCode}. */
    public FakeRemoteShell failWhen(String fragment, int exitCode) {
        exitCodes.put(fragment, exitCode);
        return this;
    }

    /** Commands containing {@code fragment} time out. */
    public FakeRemoteShell timeoutWhen(String fragment) {
        timeouts.add(fragment);
        return this;
    }

    /**
     * Block every wrapper command until {@code gate} opens; {@code started}
     * counts down as commands begin waiting.
     */
    public FakeRemoteShell hold(CountDownLatch gate, CountDownLatch started) {
        this.gate = gate;
        this.started = started;
        return this;
    }

    public List<String> executed(String address) {
        return executed.getOrDefault(address, Collections.emptyList());
    }

    public List<String> connects() {
        return connects;
    }

    public int maxConcurrentChannels() {
        return maxOpen.get();
    }

    @Override
    public RemoteChannel open(String address) throws RemoteConnectionException {
        connects.add(address);
        if (unreachable.contains(address)) {
            throw new RemoteConnectionException(address, "Connection to " + address + " refused");
        }
        int now = open.incrementAndGet();
        maxOpen.accumulateAndGet(now, Math::max);
        return new FakeChannel(address);
    }

    private final class FakeChannel implements RemoteChannel {

        private final String address;
        private volatile boolean closed;

        FakeChannel(String address) {
            this.address = address;
        }

        @Override
        public CommandResult run(String command, Duration timeout) throws IOException {
            if (closed) {
                throw new IOException("channel closed");
            }
            executed.computeIfAbsent(address, a -> new CopyOnWriteArrayList<>()).add(command);

            CountDownLatch g = gate;
            if (g != null && !command.startsWith("gui_ctl")) {
                started.countDown();
                try {
                    while (!g.await(10, TimeUnit.MILLISECONDS)) {
                        if (closed) {
                            throw new IOException("channel closed while running " + command);
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IOException("interrupted", e);
                }
            }

            for (String fragment : new ArrayList<>(timeouts)) {
                if (command.contains(fragment)) {
                    throw new RemoteCommandTimeoutException(command, timeout);
                }
            }
            for (Map.Entry<String, Integer> rule : exitCodes.entrySet()) {
                if (command.contains(rule.getKey())) {
                    return new CommandResult(rule.getValue(), "", "error in " + command);
                }
            }
            return new CommandResult(0, "ok " + command + "\n", "");
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                open.decrementAndGet();
            }
        }
    }
}
