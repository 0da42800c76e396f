package xyz.firestige.fleet.domain.event;

import xyz.firestige.fleet.domain.manifest.DeploymentPhase;

public class PhaseStartedEvent extends DeploymentEvent {

    private final DeploymentPhase phase;
    private final int itemCount;

    public PhaseStartedEvent(String runId, DeploymentPhase phase, int itemCount) {
        super(runId, "阶段开始: " + phase.getDescription());
        this.phase = phase;
        this.itemCount = itemCount;
    }

    public DeploymentPhase getPhase() {
        return phase;
    }

    public int getItemCount() {
        return itemCount;
    }
}
