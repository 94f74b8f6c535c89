package gpufleet.orchestrator.model;

/**
 * Workload class of a task type.
 */
public enum TaskClass {
    /** Bounded run time; subject to the stuck-task timeout and orphan recovery */
    STANDARD,
    /** Orchestration-style tasks that legitimately run for hours; exempt from both */
    LONG_RUNNING
}
