package xyz.firestige.fleet.infrastructure.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import xyz.firestige.fleet.domain.event.PhaseCompletedEvent;
import xyz.firestige.fleet.domain.event.PhaseStartedEvent;
import xyz.firestige.fleet.domain.event.WorkItemFailedEvent;
import xyz.firestige.fleet.domain.event.WorkItemRetryingEvent;
import xyz.firestige.fleet.domain.event.WorkItemSucceededEvent;
import xyz.firestige.fleet.infrastructure.metrics.MetricsRegistry;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 部署进度监听器
 * <p>
 * 职责：输出阶段级进度，维护进度指标
 */
public class DeploymentProgressListener {

    private static final Logger log = LoggerFactory.getLogger(DeploymentProgressListener.class);

    private final MetricsRegistry metrics;
    private final AtomicInteger phaseTotal = new AtomicInteger();
    private final AtomicInteger phaseDone = new AtomicInteger();

    public DeploymentProgressListener(MetricsRegistry metrics) {
        this.metrics = metrics;
    }

    @EventListener
    public void onPhaseStarted(PhaseStartedEvent event) {
        phaseTotal.set(event.getItemCount());
        phaseDone.set(0);
        metrics.setGauge("fleet_phase_progress", 0);
        log.info("[{}] 阶段 {} 开始, 共 {} 项", event.getRunId(), event.getPhase().getDescription(), event.getItemCount());
    }

    @EventListener
    public void onItemSucceeded(WorkItemSucceededEvent event) {
        progress(event.getRunId(), event.getItem().key(), "成功");
    }

    @EventListener
    public void onItemFailed(WorkItemFailedEvent event) {
        progress(event.getRunId(), event.getItem().key(), "失败: " + event.getFailure().getErrorMessage());
    }

    @EventListener
    public void onItemRetrying(WorkItemRetryingEvent event) {
        log.info("[{}] {} 第 {} 次失败, {}ms 后重试", event.getRunId(), event.getItem().key(),
                event.getAttempt(), event.getDelay().toMillis());
    }

    @EventListener
    public void onPhaseCompleted(PhaseCompletedEvent event) {
        log.info("[{}] 阶段 {} 结束, 通过: {}", event.getRunId(), event.getPhase().getDescription(), event.isPassed());
    }

    private void progress(String runId, String key, String outcome) {
        int done = phaseDone.incrementAndGet();
        int total = Math.max(phaseTotal.get(), done);
        metrics.setGauge("fleet_phase_progress", (double) done / total);
        log.info("[{}] ({}/{}) {} {}", runId, done, total, key, outcome);
    }
}
