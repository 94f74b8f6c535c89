package gpufleet;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectWriter;
import gpufleet.orchestrator.config.Dependencies;
import gpufleet.orchestrator.config.OrchestratorConfig;
import gpufleet.orchestrator.server.RouterHandler;
import gpufleet.orchestrator.service.CycleSummary;
import gpufleet.orchestrator.service.FleetStatusService;
import gpufleet.orchestrator.store.Database;
import gpufleet.orchestrator.store.JdbcTaskRepository;
import gpufleet.orchestrator.store.JdbcWorkerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;

/**
 * Command line entry point.
 *
 * <pre>
 * gpufleet [single|continuous|status] [--config scaling.ini] [--verbose]
 * </pre>
 *
 * {@code single} (default) runs one cycle and prints its summary,
 * {@code continuous} runs the control loop with the status server until the
 * JVM is stopped, {@code status} prints a fleet snapshot.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    enum Mode { SINGLE, CONTINUOUS, STATUS }

    record Options(Mode mode, File configFile, boolean verbose) {
    }

    private App() {
    }

    public static void main(String[] args) {
        int code;
        try {
            code = run(parse(args));
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            code = 1;
        } catch (Exception e) {
            log.error("Fatal error", e);
            code = 1;
        }
        System.exit(code);
    }

    static Options parse(String[] args) {
        Mode mode = Mode.SINGLE;
        File configFile = null;
        boolean verbose = false;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--verbose", "-v" -> verbose = true;
                case "--config" -> {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("--config requires a file");
                    }
                    configFile = new File(args[++i]);
                }
                case "single" -> mode = Mode.SINGLE;
                case "continuous" -> mode = Mode.CONTINUOUS;
                case "status" -> mode = Mode.STATUS;
                default -> throw new IllegalArgumentException("Unknown argument: " + arg);
            }
        }
        return new Options(mode, configFile, verbose);
    }

    private static int run(Options options) throws Exception {
        if (options.verbose()) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("gpufleet")).setLevel(Level.DEBUG);
        }
        OrchestratorConfig config = OrchestratorConfig.load(options.configFile());

        switch (options.mode()) {
            case STATUS:
                return status(config);
            case CONTINUOUS:
                return continuous(config);
            default:
                return single(config);
        }
    }

    private static int single(OrchestratorConfig config) throws JsonProcessingException {
        try (Dependencies deps = Dependencies.create(config)) {
            CycleSummary summary = deps.orchestrator().runCycle();
            System.out.println(json().writeValueAsString(summary));
            return summary.isSuccess() ? 0 : 1;
        }
    }

    private static int status(OrchestratorConfig config) throws JsonProcessingException {
        try (Database database = new Database(config)) {
            Clock clock = Clock.systemUTC();
            FleetStatusService service = new FleetStatusService(
                    new JdbcWorkerRepository(database, clock),
                    new JdbcTaskRepository(database, clock),
                    config, clock);
            System.out.println(json().writeValueAsString(service.snapshot()));
            return 0;
        }
    }

    private static int continuous(OrchestratorConfig config) throws InterruptedException {
        Dependencies deps = Dependencies.create(config);
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            deps.close();
            stopped.countDown();
        }, "gpufleet-shutdown"));

        if (config.statusPort() > 0) {
            deps.statusServer().start(config.statusPort());
        }
        deps.controlLoop().start();
        log.info("Running continuously, cycle every {}s", config.pollInterval().toSeconds());

        stopped.await();
        return 0;
    }

    private static ObjectWriter json() {
        return RouterHandler.mapper().writerWithDefaultPrettyPrinter();
    }
}
