package xyz.firestige.fleet.domain.event;

import xyz.firestige.fleet.domain.plan.WorkItem;

import java.time.Duration;

public class WorkItemSucceededEvent extends WorkItemEvent {

    private final Duration duration;

    public WorkItemSucceededEvent(String runId, WorkItem item, int attempt, Duration duration) {
        super(runId, item, attempt, item.key() + " 执行成功");
        this.duration = duration;
    }

    public Duration getDuration() {
        return duration;
    }
}
