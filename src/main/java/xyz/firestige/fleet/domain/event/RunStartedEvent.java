package xyz.firestige.fleet.domain.event;

/**
 * 一次 apply 开始
 */
public class RunStartedEvent extends DeploymentEvent {

    private final int itemCount;

    public RunStartedEvent(String runId, int itemCount) {
        super(runId, "部署开始，工作项数: " + itemCount);
        this.itemCount = itemCount;
    }

    public int getItemCount() {
        return itemCount;
    }
}
