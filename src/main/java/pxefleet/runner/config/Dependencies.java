package pxefleet.runner.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pxefleet.runner.api.v1.HealthController;
import pxefleet.runner.api.v1.OnbootController;
import pxefleet.runner.api.v1.OperationController;
import pxefleet.runner.api.v1.WorkerController;
import pxefleet.runner.events.ChannelGroupBroadcaster;
import pxefleet.runner.events.SafeProgressBroadcaster;
import pxefleet.runner.onboot.OnbootScheduler;
import pxefleet.runner.remote.RemoteExecutor;
import pxefleet.runner.remote.RemoteShell;
import pxefleet.runner.remote.SshRemoteShell;
import pxefleet.runner.repository.HostRepository;
import pxefleet.runner.repository.OperationRepository;
import pxefleet.runner.repository.SessionRepository;
import pxefleet.runner.scheduler.SessionScheduler;
import pxefleet.runner.server.RouterHandler;
import pxefleet.runner.server.RunnerNettyServer;
import pxefleet.runner.service.OperationService;
import pxefleet.runner.service.TargetResolver;
import pxefleet.runner.store.Database;
import pxefleet.runner.store.JdbcHostRepository;
import pxefleet.runner.store.JdbcOperationRepository;
import pxefleet.runner.store.JdbcSessionRepository;
import pxefleet.runner.wake.NettyWakeOnLanSender;
import pxefleet.runner.wake.WakeOnLanSender;
import pxefleet.runner.wake.WakeStager;

/**
 * Manual dependency injection container.
 * Creates and wires all runner components.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(RunnerConfig.fromEnv());
 * deps.startScheduler();
 * deps.server().start(config.serverHost(), config.serverPort());
 * // ...
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final RunnerConfig config;
    private final Database database;
    private final HostRepository hostRepository;
    private final OperationRepository operationRepository;
    private final SessionRepository sessionRepository;

    private final RemoteShell remoteShell;
    private final WakeOnLanSender wakeSender;
    private final ChannelGroupBroadcaster subscribers;
    private final SafeProgressBroadcaster broadcaster;

    private final OnbootScheduler onbootScheduler;
    private final SessionScheduler scheduler;
    private final TargetResolver targetResolver;
    private final OperationService operationService;

    // Router and server (lazy-initialized)
    private RouterHandler routerHandler;
    private RunnerNettyServer server;

    private Dependencies(RunnerConfig config, RemoteShell remoteShell, WakeOnLanSender wakeSender) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.remoteShell = remoteShell;
        this.wakeSender = wakeSender;
        this.subscribers = new ChannelGroupBroadcaster(RouterHandler.mapper());
        this.broadcaster = new SafeProgressBroadcaster(subscribers);

        // Repositories
        this.hostRepository = new JdbcHostRepository(database);
        this.operationRepository = new JdbcOperationRepository(database);
        this.sessionRepository = new JdbcSessionRepository(database);

        // Runner
        this.onbootScheduler = new OnbootScheduler(config.onbootDirectory(), broadcaster);
        this.scheduler = new SessionScheduler(operationRepository, sessionRepository, hostRepository,
                new RemoteExecutor(remoteShell, config), onbootScheduler, new WakeStager(wakeSender),
                broadcaster, config);

        // Services
        this.targetResolver = new TargetResolver(hostRepository);
        this.operationService = new OperationService(operationRepository, sessionRepository, targetResolver,
                scheduler, broadcaster);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with SSH execution and UDP wake-up.
     */
    public static Dependencies create(RunnerConfig config) {
        return new Dependencies(config, new SshRemoteShell(config), new NettyWakeOnLanSender(config));
    }

    /**
     * Create dependencies with the given remote shell and wake sender.
     */
    public static Dependencies create(RunnerConfig config, RemoteShell remoteShell, WakeOnLanSender wakeSender) {
        return new Dependencies(config, remoteShell, wakeSender);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(RunnerConfig.fromEnv());
    }

    // Getters
    public RunnerConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public HostRepository hostRepository() {
        return hostRepository;
    }

    public OperationRepository operationRepository() {
        return operationRepository;
    }

    public SessionRepository sessionRepository() {
        return sessionRepository;
    }

    public SafeProgressBroadcaster broadcaster() {
        return broadcaster;
    }

    public OnbootScheduler onbootScheduler() {
        return onbootScheduler;
    }

    public SessionScheduler scheduler() {
        return scheduler;
    }

    public OperationService operationService() {
        return operationService;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(new HealthController(database, scheduler, subscribers))
                    .registerController(new OperationController(operationService))
                    .registerController(new OnbootController(onbootScheduler, targetResolver))
                    .registerController(new WorkerController(scheduler));
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    public synchronized RunnerNettyServer server() {
        if (server == null) {
            server = new RunnerNettyServer(routerHandler(), subscribers);
        }
        return server;
    }

    /**
     * Start the poll loop. Should be called after server startup.
     */
    public void startScheduler() {
        scheduler.start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        if (server != null) {
            try {
                server.stop();
            } catch (RuntimeException e) {
                log.warn("Error stopping server: {}", e.getMessage());
            }
        }

        // Stop scheduler before the pool its workers write to
        try {
            scheduler.close();
        } catch (RuntimeException e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }

        if (remoteShell instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Error closing remote shell: {}", e.getMessage());
            }
        }
        wakeSender.close();

        try {
            database.close();
        } catch (RuntimeException e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
