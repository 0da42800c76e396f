package xyz.firestige.fleet.domain.event;

import xyz.firestige.fleet.domain.plan.WorkItem;

public class WorkItemStartedEvent extends WorkItemEvent {

    public WorkItemStartedEvent(String runId, WorkItem item, int attempt) {
        super(runId, item, attempt, "开始执行 " + item.key() + "（第 " + attempt + " 次）");
    }
}
