package gpufleet.orchestrator.scheduler;

import gpufleet.orchestrator.service.LifecycleOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs orchestrator cycles at a fixed rate for continuous mode.
 *
 * Uses a single-threaded executor so two cycles never overlap; a cycle that
 * overruns the interval delays the next one instead.
 */
public class ControlLoop implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ControlLoop.class);

    private final ScheduledExecutorService executor;
    private final LifecycleOrchestrator orchestrator;
    private final Duration interval;

    private volatile boolean running = false;

    public ControlLoop(LifecycleOrchestrator orchestrator, Duration interval) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "gpufleet-control-loop");
            t.setDaemon(true);
            return t;
        });
        this.orchestrator = orchestrator;
        this.interval = interval;
    }

    /**
     * Start the loop. The first cycle runs immediately.
     */
    public void start() {
        if (running) {
            log.warn("Control loop already running");
            return;
        }

        running = true;

        long intervalMs = interval.toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable("orchestrator-cycle", orchestrator::runCycle),
                0,
                intervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Control loop started, cycle every {}ms", intervalMs);
    }

    /**
     * Stop the loop, letting an in-flight cycle finish.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Control loop forcefully stopped");
            } else {
                log.info("Control loop stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    // An exception escaping a scheduled task cancels all later runs.
    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
