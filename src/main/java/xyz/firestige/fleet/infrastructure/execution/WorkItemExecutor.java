package xyz.firestige.fleet.infrastructure.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.fleet.domain.event.DomainEventPublisher;
import xyz.firestige.fleet.domain.event.HealthCheckedEvent;
import xyz.firestige.fleet.domain.event.WorkItemFailedEvent;
import xyz.firestige.fleet.domain.event.WorkItemRetryingEvent;
import xyz.firestige.fleet.domain.event.WorkItemStartedEvent;
import xyz.firestige.fleet.domain.event.WorkItemSucceededEvent;
import xyz.firestige.fleet.domain.execution.CancellationToken;
import xyz.firestige.fleet.domain.execution.RetryPolicy;
import xyz.firestige.fleet.domain.execution.WorkItemStateMachine;
import xyz.firestige.fleet.domain.execution.WorkItemStatus;
import xyz.firestige.fleet.domain.manifest.HealthFacet;
import xyz.firestige.fleet.domain.plan.WorkItem;
import xyz.firestige.fleet.domain.state.HealthSnapshot;
import xyz.firestige.fleet.exception.ErrorType;
import xyz.firestige.fleet.exception.FailureInfo;
import xyz.firestige.fleet.exception.HealthTimeoutException;
import xyz.firestige.fleet.exception.TransientApplyException;
import xyz.firestige.fleet.infrastructure.health.HealthCheckService;
import xyz.firestige.fleet.infrastructure.health.ProbeResult;
import xyz.firestige.fleet.infrastructure.metrics.MetricsRegistry;

import java.time.Duration;
import java.time.Instant;

/**
 * 单个工作项执行器
 * <p>
 * 职责：
 * 1. 驱动工作项状态机：PENDING → APPLYING → SUCCEEDED / FAILED → (重试 | FATALLY_FAILED | CANCELLED)
 * 2. 按重试策略处理瞬时失败，致命失败或预算用尽时终止
 * 3. 服务最后一个工作负载项完成后执行健康检查
 * 4. 成功后写入状态存储（一项一写）
 * 5. 发布工作项事件，维护日志上下文
 */
public class WorkItemExecutor {

    private static final Logger log = LoggerFactory.getLogger(WorkItemExecutor.class);

    private final WorkItemDispatcher dispatcher;
    private final HealthCheckService healthCheckService;
    private final DomainEventPublisher eventPublisher;
    private final MetricsRegistry metrics;

    public WorkItemExecutor(WorkItemDispatcher dispatcher,
                            HealthCheckService healthCheckService,
                            DomainEventPublisher eventPublisher,
                            MetricsRegistry metrics) {
        this.dispatcher = dispatcher;
        this.healthCheckService = healthCheckService;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
    }

    /**
     * 执行工作项
     *
     * @param item       工作项
     * @param context    运行上下文
     * @param healthGate 完成后是否需要通过健康检查
     */
    public WorkItemResult execute(WorkItem item, ExecutionContext context, boolean healthGate) {
        WorkItemStateMachine stateMachine = new WorkItemStateMachine();
        CancellationToken token = context.getToken();

        if (!item.executable()) {
            stateMachine.transitionTo(WorkItemStatus.SKIPPED);
            return WorkItemResult.skipped(item);
        }
        if (token.isCancelled()) {
            stateMachine.transitionTo(WorkItemStatus.CANCELLED);
            return WorkItemResult.cancelled(item, 0, null, Duration.ZERO);
        }

        context.injectMdc(item);
        long startNanos = System.nanoTime();
        RetryPolicy policy = RetryPolicy.initial(context.getSettings().retryAttempts());
        try {
            while (true) {
                int attempt = policy.attempts();
                stateMachine.transitionTo(WorkItemStatus.APPLYING);
                log.info("开始执行工作项: {} ({}), 第 {} 次, 原因: {}", item.key(), item.action().getValue(), attempt, item.reason());
                eventPublisher.publish(new WorkItemStartedEvent(context.getRunId(), item, attempt));

                FailureInfo failure;
                try {
                    applyOnce(item, context, healthGate);
                    stateMachine.transitionTo(WorkItemStatus.SUCCEEDED);
                    Duration duration = elapsedSince(startNanos);
                    log.info("工作项完成: {}, 耗时: {}ms", item.key(), duration.toMillis());
                    metrics.incrementCounter("fleet_work_item_succeeded", "kind", item.kind().getWireName());
                    metrics.recordDuration("fleet_work_item_duration", duration, "kind", item.kind().getWireName());
                    eventPublisher.publish(new WorkItemSucceededEvent(context.getRunId(), item, attempt, duration));
                    return WorkItemResult.succeeded(item, attempt, duration);
                } catch (RuntimeException e) {
                    failure = FailureInfo.fromException(e, item.key());
                    stateMachine.transitionTo(WorkItemStatus.FAILED);
                    log.warn("工作项失败: {}, 第 {} 次, 类型: {}, 原因: {}",
                            item.key(), attempt, failure.getErrorType(), failure.getErrorMessage());
                }

                if (token.isCancelled()) {
                    return cancel(item, stateMachine, attempt, failure, startNanos);
                }
                if (!failure.isRetryable() || !policy.canRetry()) {
                    stateMachine.transitionTo(WorkItemStatus.FATALLY_FAILED);
                    log.error("工作项最终失败: {}, 共执行 {} 次, 原因: {}", item.key(), attempt, failure.getErrorMessage());
                    metrics.incrementCounter("fleet_work_item_failed", "kind", item.kind().getWireName(),
                            "error", failure.getErrorType().name());
                    eventPublisher.publish(new WorkItemFailedEvent(context.getRunId(), item, attempt, failure));
                    return WorkItemResult.fatallyFailed(item, attempt, failure, elapsedSince(startNanos));
                }

                Duration delay = context.getSettings().retryStrategy().nextDelay(policy.getRetryCount() + 1);
                log.info("工作项将在 {}ms 后重试: {} ({}/{})",
                        delay.toMillis(), item.key(), policy.getRetryCount() + 1, policy.getMaxRetry());
                metrics.incrementCounter("fleet_work_item_retried", "kind", item.kind().getWireName());
                eventPublisher.publish(new WorkItemRetryingEvent(context.getRunId(), item, attempt, failure, delay));
                policy = policy.incrementRetryCount();
                if (token.sleep(delay)) {
                    return cancel(item, stateMachine, attempt, failure, startNanos);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            FailureInfo failure = FailureInfo.of(ErrorType.UNKNOWN_ERROR, "执行线程被中断", item.key());
            if (stateMachine.canTransition(WorkItemStatus.CANCELLED)) {
                return cancel(item, stateMachine, policy.attempts(), failure, startNanos);
            }
            return WorkItemResult.cancelled(item, policy.attempts(), failure, elapsedSince(startNanos));
        } finally {
            context.clearMdc();
        }
    }

    private void applyOnce(WorkItem item, ExecutionContext context, boolean healthGate) {
        dispatcher.dispatch(item, context.getManifest());
        if (healthGate) {
            verifyHealth(item, context);
        }
        context.getStateStore().record(item, item.fingerprint());
    }

    private void verifyHealth(WorkItem item, ExecutionContext context) {
        HealthFacet facet = context.getManifest().getService(item.service()).serviceInterface().health();
        if (facet == null) {
            return;
        }
        ProbeResult result;
        try {
            result = healthCheckService.probe(item.service(), facet, context.getToken());
        } catch (HealthTimeoutException e) {
            recordHealth(context, item.service(), false, e.getMessage());
            throw e;
        }
        recordHealth(context, item.service(), result.healthy(), result.detail());
        if (!result.healthy()) {
            throw new TransientApplyException("服务 " + item.service() + " 健康检查未通过: " + result.detail());
        }
    }

    private void recordHealth(ExecutionContext context, String service, boolean healthy, String detail) {
        eventPublisher.publish(new HealthCheckedEvent(context.getRunId(), service, healthy, detail));
        try {
            context.getHealthStore().record(new HealthSnapshot(service, healthy, detail, Instant.now()));
        } catch (RuntimeException e) {
            // 健康状态只用于展示，写入失败不影响部署
            log.warn("记录健康状态失败: {}", service, e);
        }
    }

    private WorkItemResult cancel(WorkItem item, WorkItemStateMachine stateMachine, int attempts,
                                  FailureInfo failure, long startNanos) {
        stateMachine.transitionTo(WorkItemStatus.CANCELLED);
        log.warn("工作项已取消: {}", item.key());
        metrics.incrementCounter("fleet_work_item_cancelled", "kind", item.kind().getWireName());
        return WorkItemResult.cancelled(item, attempts, failure, elapsedSince(startNanos));
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
