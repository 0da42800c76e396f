package xyz.firestige.fleet.domain.event;

import xyz.firestige.fleet.domain.plan.WorkItem;
import xyz.firestige.fleet.exception.FailureInfo;

/**
 * 工作项致命失败
 */
public class WorkItemFailedEvent extends WorkItemEvent {

    private final FailureInfo failure;

    public WorkItemFailedEvent(String runId, WorkItem item, int attempt, FailureInfo failure) {
        super(runId, item, attempt, item.key() + " 致命失败: " + failure.getErrorMessage());
        this.failure = failure;
    }

    public FailureInfo getFailure() {
        return failure;
    }
}
