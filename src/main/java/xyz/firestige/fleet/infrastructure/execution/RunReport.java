package xyz.firestige.fleet.infrastructure.execution;

import xyz.firestige.fleet.domain.execution.WorkItemStatus;
import xyz.firestige.fleet.exception.FailureInfo;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 一次 apply 的执行报告
 *
 * @param runId    运行标识
 * @param outcome  运行结果
 * @param phases   各阶段结果（按阶段顺序）
 * @param failure  执行前的致命错误（预检失败等），否则为 null
 * @param duration 总耗时
 */
public record RunReport(String runId, RunOutcome outcome, List<PhaseResult> phases, FailureInfo failure, Duration duration) {

    public RunReport {
        phases = List.copyOf(phases);
    }

    public List<WorkItemResult> results() {
        return phases.stream().flatMap(p -> p.results().stream()).collect(Collectors.toList());
    }

    public long count(WorkItemStatus status) {
        return results().stream().filter(r -> r.status() == status).count();
    }

    public int exitCode() {
        return outcome.getExitCode();
    }
}
