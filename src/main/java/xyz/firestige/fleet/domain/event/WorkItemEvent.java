package xyz.firestige.fleet.domain.event;

import xyz.firestige.fleet.domain.plan.WorkItem;

/**
 * 工作项相关事件基类
 */
public abstract class WorkItemEvent extends DeploymentEvent {

    private final WorkItem item;
    private final int attempt;

    protected WorkItemEvent(String runId, WorkItem item, int attempt, String message) {
        super(runId, message);
        this.item = item;
        this.attempt = attempt;
    }

    public WorkItem getItem() {
        return item;
    }

    public int getAttempt() {
        return attempt;
    }
}
