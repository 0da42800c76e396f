package xyz.firestige.fleet.infrastructure.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import xyz.firestige.fleet.domain.event.DomainEventPublisher;
import xyz.firestige.fleet.domain.event.PhaseCompletedEvent;
import xyz.firestige.fleet.domain.event.PhaseStartedEvent;
import xyz.firestige.fleet.domain.event.RunCompletedEvent;
import xyz.firestige.fleet.domain.event.RunStartedEvent;
import xyz.firestige.fleet.domain.execution.CancellationToken;
import xyz.firestige.fleet.domain.execution.WorkItemStatus;
import xyz.firestige.fleet.domain.manifest.DeploymentPhase;
import xyz.firestige.fleet.domain.manifest.Manifest;
import xyz.firestige.fleet.domain.plan.DeploymentPlan;
import xyz.firestige.fleet.domain.plan.WorkItem;
import xyz.firestige.fleet.exception.FailureInfo;
import xyz.firestige.fleet.exception.FatalApplyException;
import xyz.firestige.fleet.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.fleet.infrastructure.persistence.DeploymentStateStore;
import xyz.firestige.fleet.infrastructure.persistence.HealthStatusStore;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 分阶段执行引擎
 * <p>
 * 执行模型：
 * 1. 顶层阶段严格按 INFRASTRUCTURE → CORE_CONFIGURATION → IDENTITY_REGISTRATION → APPLICATION_ROLLOUT 顺序执行，
 *    前一阶段全部成功（或被显式跳过）后才进入下一阶段
 * 2. 阶段内按依赖层推进，同一层的服务之间无依赖
 * 3. 同一层内每个服务的工作项组成一条串行链，不同服务的链并发执行，并发度受 parallelism 限制；
 *    parallelism 为 1 时严格按计划顺序逐项执行
 * 4. 出现致命失败后不再启动新的工作项，在途的工作项执行完毕
 * 5. 取消后不再启动新的工作项，在途工作项在宽限期内完成
 */
public class PhasedExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(PhasedExecutionEngine.class);

    private final WorkItemDispatcher dispatcher;
    private final WorkItemExecutor executor;
    private final DomainEventPublisher eventPublisher;
    private final MetricsRegistry metrics;
    private final Duration cancellationGrace;

    public PhasedExecutionEngine(WorkItemDispatcher dispatcher,
                                 WorkItemExecutor executor,
                                 DomainEventPublisher eventPublisher,
                                 MetricsRegistry metrics,
                                 Duration cancellationGrace) {
        this.dispatcher = dispatcher;
        this.executor = executor;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
        this.cancellationGrace = cancellationGrace;
    }

    public RunReport execute(DeploymentPlan plan, Manifest manifest, ExecutionSettings settings, CancellationToken token,
                             DeploymentStateStore stateStore, HealthStatusStore healthStore) {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        ExecutionContext context = new ExecutionContext(runId, manifest, settings, token, stateStore, healthStore);
        long startNanos = System.nanoTime();

        MDC.put("runId", runId);
        try {
            log.info("开始执行部署: runId={}, 工作项: {}, 可执行: {}, parallelism={}",
                    runId, plan.getItems().size(), plan.executableItems().size(), settings.parallelism());
            eventPublisher.publish(new RunStartedEvent(runId, plan.executableItems().size()));
            metrics.incrementCounter("fleet_run_started");

            if (!plan.executableItems().isEmpty()) {
                try {
                    dispatcher.preflight(plan);
                } catch (FatalApplyException e) {
                    FailureInfo failure = FailureInfo.fromException(e, "preflight");
                    List<PhaseResult> untouched = new ArrayList<>();
                    for (DeploymentPhase phase : DeploymentPhase.values()) {
                        List<WorkItem> items = plan.itemsIn(phase);
                        if (!items.isEmpty()) {
                            untouched.add(new PhaseResult(phase, items.stream().map(WorkItemResult::notStarted).toList(), false));
                        }
                    }
                    return complete(new RunReport(runId, RunOutcome.FAILED, untouched, failure, elapsedSince(startNanos)));
                }
            }

            Set<String> healthGated = healthGatedItems(plan);
            List<PhaseResult> phaseResults = new ArrayList<>();
            boolean halted = false;
            for (DeploymentPhase phase : DeploymentPhase.values()) {
                List<WorkItem> items = plan.itemsIn(phase);
                if (items.isEmpty()) {
                    continue;
                }
                if (halted || token.isCancelled()) {
                    phaseResults.add(new PhaseResult(phase, notStarted(items, token), false));
                    continue;
                }
                PhaseResult result = runPhase(phase, items, context, healthGated);
                phaseResults.add(result);
                if (!result.passed()) {
                    halted = true;
                    log.warn("阶段 {} 未通过，后续阶段不再执行", phase.getDescription());
                }
            }

            RunOutcome outcome = outcomeOf(phaseResults, token);
            return complete(new RunReport(runId, outcome, phaseResults, null, elapsedSince(startNanos)));
        } finally {
            MDC.clear();
        }
    }

    private RunReport complete(RunReport report) {
        log.info("部署结束: runId={}, 结果: {}, 成功: {}, 失败: {}, 跳过: {}, 取消: {}, 未执行: {}, 耗时: {}ms",
                report.runId(), report.outcome().getDescription(),
                report.count(WorkItemStatus.SUCCEEDED), report.count(WorkItemStatus.FATALLY_FAILED),
                report.count(WorkItemStatus.SKIPPED), report.count(WorkItemStatus.CANCELLED),
                report.count(WorkItemStatus.PENDING), report.duration().toMillis());
        metrics.incrementCounter("fleet_run_completed", "outcome", report.outcome().name().toLowerCase());
        metrics.recordDuration("fleet_run_duration", report.duration(), "outcome", report.outcome().name().toLowerCase());
        eventPublisher.publish(new RunCompletedEvent(report.runId(), report.outcome().name(), report.duration()));
        return report;
    }

    // ====== 阶段执行 ======

    private PhaseResult runPhase(DeploymentPhase phase, List<WorkItem> items, ExecutionContext context, Set<String> healthGated) {
        log.info("进入阶段: {} ({}), 工作项: {}", phase.getDescription(), phase.getManifestKey(), items.size());
        eventPublisher.publish(new PhaseStartedEvent(context.getRunId(), phase, items.size()));
        metrics.setGauge("fleet_current_phase", phase.ordinal());

        Map<Integer, List<WorkItem>> layers = new TreeMap<>();
        for (WorkItem item : items) {
            layers.computeIfAbsent(item.layer(), k -> new ArrayList<>()).add(item);
        }

        Map<String, WorkItemResult> results = new ConcurrentHashMap<>();
        AtomicBoolean halted = new AtomicBoolean(false);
        int parallelism = context.getSettings().parallelism();
        ExecutorService pool = parallelism > 1 ? newWorkerPool(parallelism, context.getRunId()) : null;
        try {
            for (Map.Entry<Integer, List<WorkItem>> layer : layers.entrySet()) {
                List<WorkItem> layerItems = layer.getValue();
                if (halted.get() || context.getToken().isCancelled()) {
                    notStarted(layerItems, context.getToken()).forEach(r -> results.put(r.item().key(), r));
                    continue;
                }
                log.debug("阶段 {} 第 {} 层, 工作项: {}", phase, layer.getKey(), layerItems.size());
                if (pool == null) {
                    runChain(layerItems, context, healthGated, halted, results);
                } else {
                    runLayerConcurrently(pool, layerItems, context, healthGated, halted, results);
                }
            }
        } finally {
            if (pool != null) {
                pool.shutdownNow();
            }
        }

        List<WorkItemResult> ordered = new ArrayList<>();
        for (WorkItem item : items) {
            ordered.add(results.get(item.key()));
        }
        PhaseResult phaseResult = new PhaseResult(phase, ordered, true);
        eventPublisher.publish(new PhaseCompletedEvent(context.getRunId(), phase, phaseResult.passed()));
        log.info("阶段结束: {}, 通过: {}", phase.getDescription(), phaseResult.passed());
        return phaseResult;
    }

    private void runLayerConcurrently(ExecutorService pool, List<WorkItem> layerItems, ExecutionContext context,
                                      Set<String> healthGated, AtomicBoolean halted, Map<String, WorkItemResult> results) {
        Map<String, List<WorkItem>> chains = new LinkedHashMap<>();
        for (WorkItem item : layerItems) {
            chains.computeIfAbsent(item.service(), k -> new ArrayList<>()).add(item);
        }
        List<Future<?>> futures = new ArrayList<>();
        for (List<WorkItem> chain : chains.values()) {
            futures.add(pool.submit(() -> runChain(chain, context, healthGated, halted, results)));
        }
        for (Future<?> future : futures) {
            awaitChain(future, context);
        }
        // 未能在宽限期内结束的链，其剩余工作项视为未执行
        for (WorkItem item : layerItems) {
            results.computeIfAbsent(item.key(), k -> WorkItemResult.cancelled(item, 0, null, Duration.ZERO));
        }
    }

    private void awaitChain(Future<?> future, ExecutionContext context) {
        try {
            if (context.getToken().isCancelled()) {
                future.get(cancellationGrace.toMillis(), TimeUnit.MILLISECONDS);
            } else {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            context.getToken().cancel("主线程被中断");
        } catch (ExecutionException e) {
            log.error("工作项链执行异常", e.getCause());
        } catch (TimeoutException e) {
            log.warn("在途工作项未能在宽限期 {}s 内结束", cancellationGrace.toSeconds());
            future.cancel(true);
        }
    }

    private void runChain(List<WorkItem> chain, ExecutionContext context, Set<String> healthGated,
                          AtomicBoolean halted, Map<String, WorkItemResult> results) {
        for (WorkItem item : chain) {
            if (halted.get()) {
                results.put(item.key(), WorkItemResult.notStarted(item));
                continue;
            }
            WorkItemResult result = executor.execute(item, context, healthGated.contains(item.key()));
            results.put(item.key(), result);
            if (result.status() == WorkItemStatus.FATALLY_FAILED) {
                halted.set(true);
            }
        }
    }

    // ====== 辅助 ======

    /**
     * 每个服务在计划中的最后一个工作负载项（container 或 configuration_applied）需要通过健康检查
     */
    static Set<String> healthGatedItems(DeploymentPlan plan) {
        Map<String, WorkItem> last = new LinkedHashMap<>();
        for (WorkItem item : plan.executableItems()) {
            if (item.kind().isWorkload()) {
                last.put(item.service(), item);
            }
        }
        Set<String> keys = new HashSet<>();
        last.values().forEach(item -> keys.add(item.key()));
        return keys;
    }

    private static List<WorkItemResult> notStarted(List<WorkItem> items, CancellationToken token) {
        List<WorkItemResult> results = new ArrayList<>();
        for (WorkItem item : items) {
            if (!item.executable()) {
                results.add(WorkItemResult.skipped(item));
            } else if (token.isCancelled()) {
                results.add(WorkItemResult.cancelled(item, 0, null, Duration.ZERO));
            } else {
                results.add(WorkItemResult.notStarted(item));
            }
        }
        return results;
    }

    static RunOutcome outcomeOf(List<PhaseResult> phases, CancellationToken token) {
        if (token.isCancelled()) {
            return RunOutcome.CANCELLED;
        }
        boolean anyFailed = false;
        boolean anySucceeded = false;
        for (PhaseResult phase : phases) {
            anyFailed |= phase.count(WorkItemStatus.FATALLY_FAILED) > 0;
            anySucceeded |= phase.count(WorkItemStatus.SUCCEEDED) > 0;
        }
        if (!anyFailed) {
            return RunOutcome.SUCCEEDED;
        }
        return anySucceeded ? RunOutcome.PARTIAL : RunOutcome.FAILED;
    }

    private static ExecutorService newWorkerPool(int parallelism, String runId) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r, "fleet-worker-" + runId + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
