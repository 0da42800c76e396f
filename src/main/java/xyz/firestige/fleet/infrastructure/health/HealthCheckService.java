package xyz.firestige.fleet.infrastructure.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.fleet.domain.execution.CancellationToken;
import xyz.firestige.fleet.domain.manifest.HealthFacet;
import xyz.firestige.fleet.exception.HealthTimeoutException;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 健康检查服务
 * <p>
 * 执行顺序：
 * 1. startup 探针执行一次，失败即不健康
 * 2. liveness 探针按 interval 轮询，直到成功或尝试次数用尽
 * 3. 若声明了 readiness，同样轮询
 * <p>
 * 整个序列受 timeout 约束：轮询在调度线程池上进行，调用方等待结果，超时后取消待执行的轮询并抛出
 * {@link HealthTimeoutException}；取消令牌触发时立即返回不健康。
 */
public class HealthCheckService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final ProbeRunner runner;
    private final ScheduledExecutorService scheduler;

    public HealthCheckService(ProbeRunner runner, int threads) {
        this.runner = runner;
        AtomicInteger counter = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(threads, r -> {
            Thread t = new Thread(r, "health-probe-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public ProbeResult probe(String service, HealthFacet facet, CancellationToken token) {
        Duration timeout = facet.timeoutDuration();
        ProbeSession session = new ProbeSession(service, facet, System.nanoTime() + timeout.toNanos());
        Runnable unregister = token.onCancel(() -> session.outcome.complete(ProbeResult.unhealthy("cancelled")));
        log.info("Health check {} started: liveness={}, interval={}s, timeout={}s, retries={}",
                service, facet.liveness(), facet.intervalSeconds(), facet.timeoutSeconds(), facet.retries());
        session.start();
        try {
            ProbeResult result = session.outcome.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Health check {} finished: {}", service, result);
            return result;
        } catch (TimeoutException e) {
            log.warn("Health check {} timed out after {}s", service, timeout.toSeconds());
            throw new HealthTimeoutException(service, timeout);
        } catch (ExecutionException e) {
            return ProbeResult.unhealthy("探测异常: " + e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProbeResult.unhealthy("interrupted");
        } finally {
            session.cancel();
            unregister.run();
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }

    /**
     * 一次健康检查序列
     */
    private final class ProbeSession {

        private final String service;
        private final HealthFacet facet;
        private final long deadlineNanos;
        private final CompletableFuture<ProbeResult> outcome = new CompletableFuture<>();
        private volatile ScheduledFuture<?> pending;
        private int livenessAttempts;
        private int readinessAttempts;

        ProbeSession(String service, HealthFacet facet, long deadlineNanos) {
            this.service = service;
            this.facet = facet;
            this.deadlineNanos = deadlineNanos;
        }

        void start() {
            schedule(this::runStartup, Duration.ZERO);
        }

        void cancel() {
            ScheduledFuture<?> p = pending;
            if (p != null) {
                p.cancel(false);
            }
        }

        private void runStartup() {
            if (facet.startup() != null && !facet.startup().isBlank()) {
                ProbeResult result = runOnce(facet.startup());
                if (!result.healthy()) {
                    outcome.complete(ProbeResult.unhealthy("startup 探针失败: " + result.detail()));
                    return;
                }
            }
            runLiveness();
        }

        private void runLiveness() {
            if (outcome.isDone()) {
                return;
            }
            livenessAttempts++;
            ProbeResult result = runOnce(facet.liveness());
            log.debug("Liveness probe {} attempt {}: {}", service, livenessAttempts, result);
            if (result.healthy()) {
                if (facet.readiness() != null && !facet.readiness().isBlank()) {
                    runReadiness();
                } else {
                    outcome.complete(ProbeResult.ok());
                }
            } else if (livenessAttempts >= Math.max(1, facet.retries())) {
                outcome.complete(ProbeResult.unhealthy(
                        "liveness 探针 " + livenessAttempts + " 次均失败: " + result.detail()));
            } else {
                schedule(this::runLiveness, facet.intervalDuration());
            }
        }

        private void runReadiness() {
            if (outcome.isDone()) {
                return;
            }
            readinessAttempts++;
            ProbeResult result = runOnce(facet.readiness());
            if (result.healthy()) {
                outcome.complete(ProbeResult.ok());
            } else if (readinessAttempts >= Math.max(1, facet.retries())) {
                outcome.complete(ProbeResult.unhealthy(
                        "readiness 探针 " + readinessAttempts + " 次均失败: " + result.detail()));
            } else {
                schedule(this::runReadiness, facet.intervalDuration());
            }
        }

        private ProbeResult runOnce(String target) {
            long remaining = deadlineNanos - System.nanoTime();
            if (remaining <= 0) {
                return ProbeResult.unhealthy("已超过截止时间");
            }
            try {
                return runner.run(target, Duration.ofNanos(remaining));
            } catch (RuntimeException e) {
                return ProbeResult.unhealthy(e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }

        private void schedule(Runnable step, Duration delay) {
            if (outcome.isDone()) {
                return;
            }
            pending = scheduler.schedule(() -> {
                try {
                    step.run();
                } catch (Throwable t) {
                    outcome.completeExceptionally(t);
                }
            }, delay.toMillis(), TimeUnit.MILLISECONDS);
        }
    }
}
