package xyz.firestige.fleet.domain.event;

import xyz.firestige.fleet.domain.manifest.DeploymentPhase;

public class PhaseCompletedEvent extends DeploymentEvent {

    private final DeploymentPhase phase;
    private final boolean passed;

    public PhaseCompletedEvent(String runId, DeploymentPhase phase, boolean passed) {
        super(runId, "阶段结束: " + phase.getDescription() + (passed ? "（通过）" : "（未通过）"));
        this.phase = phase;
        this.passed = passed;
    }

    public DeploymentPhase getPhase() {
        return phase;
    }

    public boolean isPassed() {
        return passed;
    }
}
