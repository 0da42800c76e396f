package xyz.firestige.fleet.domain.event;

import xyz.firestige.fleet.domain.plan.WorkItem;
import xyz.firestige.fleet.exception.FailureInfo;

import java.time.Duration;

public class WorkItemRetryingEvent extends WorkItemEvent {

    private final FailureInfo failure;
    private final Duration delay;

    public WorkItemRetryingEvent(String runId, WorkItem item, int attempt, FailureInfo failure, Duration delay) {
        super(runId, item, attempt, item.key() + " 第 " + attempt + " 次失败，" + delay.toMillis() + "ms 后重试");
        this.failure = failure;
        this.delay = delay;
    }

    public FailureInfo getFailure() {
        return failure;
    }

    public Duration getDelay() {
        return delay;
    }
}
