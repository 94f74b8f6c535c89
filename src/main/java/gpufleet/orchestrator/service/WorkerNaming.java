package gpufleet.orchestrator.service;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Worker ids: {@code <prefix><yyyyMMdd-HHmmss>-<8 hex>}, e.g. {@code gpu-20260101-120000-1a2b3c4d}.
 * The id is also the instance name, so it stays lower case without underscores.
 */
public class WorkerNaming {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss")
            .withZone(ZoneOffset.UTC);

    private final String prefix;
    private final Clock clock;

    public WorkerNaming(String prefix, Clock clock) {
        this.prefix = prefix;
        this.clock = clock;
    }

    public String newWorkerId() {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return prefix + STAMP.format(clock.instant()) + "-" + suffix;
    }

    public boolean isOurs(String instanceName) {
        return instanceName != null && instanceName.startsWith(prefix);
    }

    public String prefix() {
        return prefix;
    }
}
