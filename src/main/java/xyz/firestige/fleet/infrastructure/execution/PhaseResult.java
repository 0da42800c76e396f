package xyz.firestige.fleet.infrastructure.execution;

import xyz.firestige.fleet.domain.execution.WorkItemStatus;
import xyz.firestige.fleet.domain.manifest.DeploymentPhase;

import java.util.List;

/**
 * 顶层阶段执行结果
 */
public record PhaseResult(DeploymentPhase phase, List<WorkItemResult> results, boolean started) {

    public PhaseResult {
        results = List.copyOf(results);
    }

    /**
     * 阶段内所有工作项均成功或被显式跳过
     */
    public boolean passed() {
        return started && results.stream().allMatch(r -> r.status().allowsProgression());
    }

    public long count(WorkItemStatus status) {
        return results.stream().filter(r -> r.status() == status).count();
    }
}
