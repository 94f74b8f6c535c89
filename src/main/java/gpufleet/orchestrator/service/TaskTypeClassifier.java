package gpufleet.orchestrator.service;

import gpufleet.orchestrator.model.Task;
import gpufleet.orchestrator.model.TaskClass;

import java.util.Set;

/**
 * Maps task types to their workload class by exact name.
 * Unknown types are STANDARD.
 */
public class TaskTypeClassifier {

    private final Set<String> longRunningTypes;

    public TaskTypeClassifier(Set<String> longRunningTypes) {
        this.longRunningTypes = Set.copyOf(longRunningTypes);
    }

    public TaskClass classify(String taskType) {
        return taskType != null && longRunningTypes.contains(taskType)
                ? TaskClass.LONG_RUNNING
                : TaskClass.STANDARD;
    }

    /** Exempt from the stuck-task timeout and from orphan recovery. */
    public boolean isExempt(Task task) {
        return classify(task.taskType()) == TaskClass.LONG_RUNNING;
    }
}
