package gpufleet.orchestrator.model;

/**
 * Task execution status, stored with the labels task producers and workers use.
 */
public enum TaskStatus {
    /** Waiting to be claimed */
    QUEUED("Queued"),
    /** Claimed by a worker and running */
    IN_PROGRESS("In Progress"),
    /** Finished successfully */
    COMPLETE("Complete"),
    /** Finished with an error, or gave up after too many attempts */
    FAILED("Failed");

    private final String label;

    TaskStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static TaskStatus fromLabel(String label) {
        for (TaskStatus status : values()) {
            if (status.label.equalsIgnoreCase(label) || status.name().equalsIgnoreCase(label)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + label);
    }
}
