package xyz.firestige.fleet.infrastructure.execution;

import xyz.firestige.fleet.domain.execution.WorkItemStatus;
import xyz.firestige.fleet.domain.plan.WorkItem;
import xyz.firestige.fleet.exception.FailureInfo;

import java.time.Duration;

/**
 * 工作项执行结果
 *
 * @param item     工作项
 * @param status   最终状态（未启动的为 PENDING）
 * @param attempts 执行次数
 * @param failure  失败信息（成功时为 null）
 * @param duration 耗时
 */
public record WorkItemResult(WorkItem item, WorkItemStatus status, int attempts, FailureInfo failure, Duration duration) {

    public static WorkItemResult succeeded(WorkItem item, int attempts, Duration duration) {
        return new WorkItemResult(item, WorkItemStatus.SUCCEEDED, attempts, null, duration);
    }

    public static WorkItemResult fatallyFailed(WorkItem item, int attempts, FailureInfo failure, Duration duration) {
        return new WorkItemResult(item, WorkItemStatus.FATALLY_FAILED, attempts, failure, duration);
    }

    public static WorkItemResult skipped(WorkItem item) {
        return new WorkItemResult(item, WorkItemStatus.SKIPPED, 0, null, Duration.ZERO);
    }

    public static WorkItemResult cancelled(WorkItem item, int attempts, FailureInfo failure, Duration duration) {
        return new WorkItemResult(item, WorkItemStatus.CANCELLED, attempts, failure, duration);
    }

    public static WorkItemResult notStarted(WorkItem item) {
        return new WorkItemResult(item, WorkItemStatus.PENDING, 0, null, Duration.ZERO);
    }

    public boolean isSuccess() {
        return status == WorkItemStatus.SUCCEEDED;
    }
}
