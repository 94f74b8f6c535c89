package gpufleet.orchestrator.config;

import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Configuration holder for the orchestrator.
 * All settings have defaults; an INI file ({@code [SCALING]} section) and then
 * {@code FLEET_*} environment variables override them.
 */
public final class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    public static final String INI_SECTION = "SCALING";
    public static final String ENV_PREFIX = "FLEET_";

    // Fleet bounds
    private int minWorkers = 2;
    private int maxWorkers = 10;

    // Health timeouts
    private Duration idleTimeout = Duration.ofSeconds(300);
    private Duration stuckTaskTimeout = Duration.ofSeconds(1200);
    private Duration spawningTimeout = Duration.ofSeconds(300);
    private Duration spawnGracePeriod = Duration.ofSeconds(180);
    private Duration scaleDownCooldown = Duration.ofSeconds(60);

    // Scaling
    private double scaleUpMultiplier = 1.0;
    private double scaleDownMultiplier = 0.9;
    private int idleBufferTarget = 0;

    // Failure-rate breaker
    private double maxFailureRate = 0.8;
    private Duration failureWindow = Duration.ofMinutes(30);
    private int minSampleForFailureRate = 5;

    // Loop
    private Duration pollInterval = Duration.ofSeconds(30);
    private int reconciliationCycleStride = 10;
    private Duration remoteCallTimeout = Duration.ofSeconds(30);

    // Task recovery
    private int maxTaskAttempts = 3;
    private Duration unassignedOrphanTimeout = Duration.ofMinutes(15);
    private Duration recentFailureLookback = Duration.ofHours(24);
    private Set<String> longRunningTaskTypes = new LinkedHashSet<>(List.of("travel_orchestrator"));

    // Provisioning
    private String workerNamePrefix = "gpu-";
    private List<Integer> ramTiersGb = List.of(72, 60, 48, 32, 16);

    // Infrastructure
    private String databaseUrl = "jdbc:h2:file:./data/gpufleet;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 5;
    private int statusPort = 8080;

    private OrchestratorConfig() {
    }

    public static OrchestratorConfig defaults() {
        return new OrchestratorConfig();
    }

    /**
     * Defaults overridden by {@code FLEET_*} environment variables
     * (e.g. {@code FLEET_MIN_WORKERS}).
     */
    public static OrchestratorConfig fromEnv() {
        OrchestratorConfig config = new OrchestratorConfig();
        config.apply(key -> System.getenv(envName(key)));
        return config.sanitize();
    }

    /**
     * Defaults, then the INI file's {@code [SCALING]} section, then environment.
     */
    public static OrchestratorConfig load(File iniFile) {
        OrchestratorConfig config = new OrchestratorConfig();
        if (iniFile != null) {
            config.apply(readSection(iniFile));
        }
        config.apply(key -> System.getenv(envName(key)));
        return config.sanitize();
    }

    /** Options from an INI file only, no environment overrides. */
    public static OrchestratorConfig fromIni(File iniFile) {
        OrchestratorConfig config = new OrchestratorConfig();
        config.apply(readSection(iniFile));
        return config.sanitize();
    }

    /** Environment variable for an option, e.g. {@code min_workers} is {@code FLEET_MIN_WORKERS}. */
    static String envName(String key) {
        return ENV_PREFIX + key.toUpperCase(Locale.ROOT);
    }

    private static Function<String, String> readSection(File iniFile) {
        try {
            Ini ini = new Ini(iniFile);
            Profile.Section section = ini.get(INI_SECTION);
            if (section == null) {
                log.warn("No [{}] section in {}, using defaults", INI_SECTION, iniFile);
                return key -> null;
            }
            return section::get;
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read config file: " + iniFile, e);
        }
    }

    /**
     * Override settings from a key lookup. Keys are the snake_case option names.
     */
    OrchestratorConfig apply(Function<String, String> source) {
        minWorkers = intOption(source, "min_workers", minWorkers);
        maxWorkers = intOption(source, "max_workers", maxWorkers);
        idleTimeout = secondsOption(source, "idle_timeout_seconds", idleTimeout);
        stuckTaskTimeout = secondsOption(source, "stuck_task_timeout_seconds", stuckTaskTimeout);
        spawningTimeout = secondsOption(source, "spawning_timeout_seconds", spawningTimeout);
        spawnGracePeriod = secondsOption(source, "spawn_grace_period_seconds", spawnGracePeriod);
        scaleDownCooldown = secondsOption(source, "scale_down_cooldown_seconds", scaleDownCooldown);
        scaleUpMultiplier = doubleOption(source, "scale_up_multiplier", scaleUpMultiplier);
        scaleDownMultiplier = doubleOption(source, "scale_down_multiplier", scaleDownMultiplier);
        idleBufferTarget = intOption(source, "idle_buffer_target", idleBufferTarget);
        maxFailureRate = doubleOption(source, "max_failure_rate", maxFailureRate);
        String window = value(source, "failure_window_minutes");
        if (window != null) {
            failureWindow = Duration.ofMinutes(parseInt("failure_window_minutes", window));
        }
        minSampleForFailureRate = intOption(source, "min_sample_for_failure_rate", minSampleForFailureRate);
        pollInterval = secondsOption(source, "poll_interval_seconds", pollInterval);
        reconciliationCycleStride = intOption(source, "reconciliation_cycle_stride", reconciliationCycleStride);
        remoteCallTimeout = secondsOption(source, "remote_call_timeout_seconds", remoteCallTimeout);
        maxTaskAttempts = intOption(source, "max_task_attempts", maxTaskAttempts);
        String orphan = value(source, "unassigned_orphan_timeout_minutes");
        if (orphan != null) {
            unassignedOrphanTimeout = Duration.ofMinutes(parseInt("unassigned_orphan_timeout_minutes", orphan));
        }
        String lookback = value(source, "recent_failure_lookback_hours");
        if (lookback != null) {
            recentFailureLookback = Duration.ofHours(parseInt("recent_failure_lookback_hours", lookback));
        }
        String types = value(source, "long_running_task_types");
        if (types != null) {
            longRunningTaskTypes = Arrays.stream(types.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toCollection(LinkedHashSet::new));
        }
        String prefix = value(source, "worker_name_prefix");
        if (prefix != null) {
            workerNamePrefix = prefix;
        }
        String tiers = value(source, "ram_tiers_gb");
        if (tiers != null) {
            ramTiersGb = Arrays.stream(tiers.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .map(s -> parseInt("ram_tiers_gb", s))
                    .toList();
        }
        String dbUrl = value(source, "database_url");
        if (dbUrl != null) {
            databaseUrl = dbUrl;
        }
        databasePoolSize = intOption(source, "database_pool_size", databasePoolSize);
        statusPort = intOption(source, "status_port", statusPort);
        return this;
    }

    /**
     * Clamp values into their safe ranges and reject contradictory bounds.
     */
    public OrchestratorConfig sanitize() {
        if (minWorkers < 0) {
            throw new IllegalArgumentException("min_workers must be >= 0, got " + minWorkers);
        }
        if (maxWorkers < minWorkers) {
            throw new IllegalArgumentException(
                    "max_workers (" + maxWorkers + ") must be >= min_workers (" + minWorkers + ")");
        }
        if (scaleUpMultiplier < 1.0) {
            log.warn("scale_up_multiplier {} < 1.0 would under-provision, using 1.0", scaleUpMultiplier);
            scaleUpMultiplier = 1.0;
        }
        if (scaleDownMultiplier <= 0.0 || scaleDownMultiplier > 1.0) {
            log.warn("scale_down_multiplier {} outside (0, 1.0], using 1.0", scaleDownMultiplier);
            scaleDownMultiplier = 1.0;
        }
        if (idleBufferTarget < 0 || idleBufferTarget > maxWorkers) {
            int clamped = Math.max(0, Math.min(idleBufferTarget, maxWorkers));
            log.warn("idle_buffer_target {} outside [0, {}], using {}", idleBufferTarget, maxWorkers, clamped);
            idleBufferTarget = clamped;
        }
        if (reconciliationCycleStride < 1) {
            log.warn("reconciliation_cycle_stride {} < 1, using 1", reconciliationCycleStride);
            reconciliationCycleStride = 1;
        }
        if (maxTaskAttempts < 1) {
            throw new IllegalArgumentException("max_task_attempts must be >= 1, got " + maxTaskAttempts);
        }
        if (ramTiersGb.isEmpty()) {
            throw new IllegalArgumentException("ram_tiers_gb must list at least one tier");
        }
        return this;
    }

    private static String value(Function<String, String> source, String key) {
        String v = source.apply(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static int intOption(Function<String, String> source, String key, int current) {
        String v = value(source, key);
        return v != null ? parseInt(key, v) : current;
    }

    private static double doubleOption(Function<String, String> source, String key, double current) {
        String v = value(source, key);
        if (v == null) {
            return current;
        }
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + v, e);
        }
    }

    private static Duration secondsOption(Function<String, String> source, String key, Duration current) {
        String v = value(source, key);
        return v != null ? Duration.ofSeconds(parseInt(key, v)) : current;
    }

    private static int parseInt(String key, String v) {
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + v, e);
        }
    }

    // Getters
    public int minWorkers() {
        return minWorkers;
    }

    public int maxWorkers() {
        return maxWorkers;
    }

    public Duration idleTimeout() {
        return idleTimeout;
    }

    public Duration stuckTaskTimeout() {
        return stuckTaskTimeout;
    }

    public Duration spawningTimeout() {
        return spawningTimeout;
    }

    public Duration spawnGracePeriod() {
        return spawnGracePeriod;
    }

    public Duration scaleDownCooldown() {
        return scaleDownCooldown;
    }

    public double scaleUpMultiplier() {
        return scaleUpMultiplier;
    }

    public double scaleDownMultiplier() {
        return scaleDownMultiplier;
    }

    public int idleBufferTarget() {
        return idleBufferTarget;
    }

    public double maxFailureRate() {
        return maxFailureRate;
    }

    public Duration failureWindow() {
        return failureWindow;
    }

    public int minSampleForFailureRate() {
        return minSampleForFailureRate;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public int reconciliationCycleStride() {
        return reconciliationCycleStride;
    }

    public Duration remoteCallTimeout() {
        return remoteCallTimeout;
    }

    public int maxTaskAttempts() {
        return maxTaskAttempts;
    }

    public Duration unassignedOrphanTimeout() {
        return unassignedOrphanTimeout;
    }

    public Duration recentFailureLookback() {
        return recentFailureLookback;
    }

    public Set<String> longRunningTaskTypes() {
        return Set.copyOf(longRunningTaskTypes);
    }

    public String workerNamePrefix() {
        return workerNamePrefix;
    }

    public List<Integer> ramTiersGb() {
        return ramTiersGb;
    }

    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int statusPort() {
        return statusPort;
    }

    // Fluent setters for testing/customization
    public OrchestratorConfig withWorkerBounds(int min, int max) {
        this.minWorkers = min;
        this.maxWorkers = max;
        return this;
    }

    public OrchestratorConfig withIdleTimeout(Duration timeout) {
        this.idleTimeout = timeout;
        return this;
    }

    public OrchestratorConfig withStuckTaskTimeout(Duration timeout) {
        this.stuckTaskTimeout = timeout;
        return this;
    }

    public OrchestratorConfig withSpawningTimeout(Duration timeout) {
        this.spawningTimeout = timeout;
        return this;
    }

    public OrchestratorConfig withSpawnGracePeriod(Duration grace) {
        this.spawnGracePeriod = grace;
        return this;
    }

    public OrchestratorConfig withScaleDownCooldown(Duration cooldown) {
        this.scaleDownCooldown = cooldown;
        return this;
    }

    public OrchestratorConfig withMultipliers(double up, double down) {
        this.scaleUpMultiplier = up;
        this.scaleDownMultiplier = down;
        return this;
    }

    public OrchestratorConfig withIdleBufferTarget(int target) {
        this.idleBufferTarget = target;
        return this;
    }

    public OrchestratorConfig withFailureRate(double maxRate, Duration window, int minSample) {
        this.maxFailureRate = maxRate;
        this.failureWindow = window;
        this.minSampleForFailureRate = minSample;
        return this;
    }

    public OrchestratorConfig withReconciliationCycleStride(int stride) {
        this.reconciliationCycleStride = stride;
        return this;
    }

    public OrchestratorConfig withMaxTaskAttempts(int attempts) {
        this.maxTaskAttempts = attempts;
        return this;
    }

    public OrchestratorConfig withLongRunningTaskTypes(Set<String> types) {
        this.longRunningTaskTypes = new LinkedHashSet<>(types);
        return this;
    }

    public OrchestratorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public OrchestratorConfig withStatusPort(int port) {
        this.statusPort = port;
        return this;
    }

    @Override
    public String toString() {
        return "OrchestratorConfig{" +
                "workers=[" + minWorkers + ".." + maxWorkers + "]" +
                ", idleTimeout=" + idleTimeout.toSeconds() + "s" +
                ", stuckTaskTimeout=" + stuckTaskTimeout.toSeconds() + "s" +
                ", spawningTimeout=" + spawningTimeout.toSeconds() + "s" +
                ", multipliers=" + scaleUpMultiplier + "/" + scaleDownMultiplier +
                ", idleBuffer=" + idleBufferTarget +
                ", maxFailureRate=" + maxFailureRate +
                ", poll=" + pollInterval.toSeconds() + "s" +
                ", databaseUrl='" + databaseUrl + '\'' +
                '}';
    }
}
