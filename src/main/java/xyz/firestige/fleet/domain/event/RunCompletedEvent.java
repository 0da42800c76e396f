package xyz.firestige.fleet.domain.event;

import java.time.Duration;

/**
 * 一次 apply 结束（含部分成功、失败、取消）
 */
public class RunCompletedEvent extends DeploymentEvent {

    private final String outcome;
    private final Duration duration;

    public RunCompletedEvent(String runId, String outcome, Duration duration) {
        super(runId, "部署结束: " + outcome);
        this.outcome = outcome;
        this.duration = duration;
    }

    public String getOutcome() {
        return outcome;
    }

    public Duration getDuration() {
        return duration;
    }
}
