package gpufleet.orchestrator.config;

import gpufleet.cloud.auth.CloudAuth;
import gpufleet.cloud.config.CloudConfig;
import gpufleet.cloud.config.IniLoader;
import gpufleet.cloud.provider.SshWorkerProbe;
import gpufleet.cloud.provider.YandexComputeProvider;
import gpufleet.orchestrator.api.v1.FleetController;
import gpufleet.orchestrator.api.v1.HealthController;
import gpufleet.orchestrator.provider.ComputeProvider;
import gpufleet.orchestrator.provider.WorkerProbe;
import gpufleet.orchestrator.repository.TaskRepository;
import gpufleet.orchestrator.repository.WorkerRepository;
import gpufleet.orchestrator.scheduler.ControlLoop;
import gpufleet.orchestrator.server.RouterHandler;
import gpufleet.orchestrator.server.StatusServer;
import gpufleet.orchestrator.service.FleetStatusService;
import gpufleet.orchestrator.service.LifecycleOrchestrator;
import gpufleet.orchestrator.store.Database;
import gpufleet.orchestrator.store.JdbcTaskRepository;
import gpufleet.orchestrator.store.JdbcWorkerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * try (Dependencies deps = Dependencies.create(OrchestratorConfig.fromEnv())) {
 *     CycleSummary summary = deps.orchestrator().runCycle();
 * }
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    /** Environment variable holding the path of the cloud INI file. */
    public static final String CLOUD_INI_ENV = "FLEET_CLOUD_INI";

    private final OrchestratorConfig config;
    private final Database database;
    private final WorkerRepository workerRepository;
    private final TaskRepository taskRepository;
    private final LifecycleOrchestrator orchestrator;
    private final FleetStatusService fleetStatusService;

    // Controllers
    private final HealthController healthController;
    private final FleetController fleetController;

    // Lazy-initialized
    private RouterHandler routerHandler;
    private ControlLoop controlLoop;
    private StatusServer statusServer;

    private Dependencies(OrchestratorConfig config, ComputeProvider provider, WorkerProbe probe, Clock clock) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.workerRepository = new JdbcWorkerRepository(database, clock);
        this.taskRepository = new JdbcTaskRepository(database, clock);

        // Services
        this.orchestrator = new LifecycleOrchestrator(workerRepository, taskRepository, provider, probe,
                config, clock);
        this.fleetStatusService = new FleetStatusService(workerRepository, taskRepository, config, clock);

        // Controllers
        this.healthController = new HealthController(database, orchestrator.context());
        this.fleetController = new FleetController(fleetStatusService, orchestrator.context());

        log.info("Dependencies initialized successfully");
    }

    /**
     * Wire against Yandex Cloud, reading provider settings from the INI file
     * named by {@value #CLOUD_INI_ENV}.
     *
     * @throws IllegalArgumentException if the variable is unset or the file is invalid
     */
    public static Dependencies create(OrchestratorConfig config) {
        String iniPath = System.getenv(CLOUD_INI_ENV);
        if (iniPath == null || iniPath.isBlank()) {
            throw new IllegalArgumentException(CLOUD_INI_ENV + " must point to the cloud INI file");
        }
        CloudConfig cloud = IniLoader.load(new File(iniPath.trim()));
        log.info("Loaded cloud config: {}", cloud);

        CloudAuth auth = new CloudAuth(cloud.oauthToken(), config.remoteCallTimeout());
        return create(config,
                new YandexComputeProvider(auth, cloud),
                new SshWorkerProbe(cloud, config.remoteCallTimeout()),
                Clock.systemUTC());
    }

    /**
     * Wire against the given provider and probe.
     */
    public static Dependencies create(OrchestratorConfig config, ComputeProvider provider, WorkerProbe probe,
            Clock clock) {
        return new Dependencies(config, provider, probe, clock);
    }

    // Getters
    public OrchestratorConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public WorkerRepository workerRepository() {
        return workerRepository;
    }

    public TaskRepository taskRepository() {
        return taskRepository;
    }

    public LifecycleOrchestrator orchestrator() {
        return orchestrator;
    }

    public FleetStatusService fleetStatusService() {
        return fleetStatusService;
    }

    /**
     * Router with all status controllers registered.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(healthController)
                    .registerController(fleetController);
            log.info("RouterHandler created with {} controllers", 2);
        }
        return routerHandler;
    }

    public ControlLoop controlLoop() {
        if (controlLoop == null) {
            controlLoop = new ControlLoop(orchestrator, config.pollInterval());
        }
        return controlLoop;
    }

    public StatusServer statusServer() {
        if (statusServer == null) {
            statusServer = new StatusServer(routerHandler());
        }
        return statusServer;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop the loop first so no cycle runs against a closed pool
        if (controlLoop != null) {
            try {
                controlLoop.stop();
            } catch (Exception e) {
                log.warn("Error stopping control loop: {}", e.getMessage());
            }
        }

        if (statusServer != null) {
            try {
                statusServer.stop();
            } catch (Exception e) {
                log.warn("Error stopping status server: {}", e.getMessage());
            }
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
