package xyz.firestige.fleet.infrastructure.execution;

import org.slf4j.MDC;
import xyz.firestige.fleet.domain.execution.CancellationToken;
import xyz.firestige.fleet.domain.manifest.Manifest;
import xyz.firestige.fleet.domain.plan.WorkItem;
import xyz.firestige.fleet.infrastructure.persistence.DeploymentStateStore;
import xyz.firestige.fleet.infrastructure.persistence.HealthStatusStore;

/**
 * 一次运行的上下文，在各工作线程之间共享
 * <p>
 * 日志上下文（MDC）：runId / service / kind / phase，在工作项执行线程上注入，结束时清理
 */
public class ExecutionContext {

    private final String runId;
    private final Manifest manifest;
    private final ExecutionSettings settings;
    private final CancellationToken token;
    private final DeploymentStateStore stateStore;
    private final HealthStatusStore healthStore;

    public ExecutionContext(String runId, Manifest manifest, ExecutionSettings settings, CancellationToken token,
                            DeploymentStateStore stateStore, HealthStatusStore healthStore) {
        this.runId = runId;
        this.manifest = manifest;
        this.settings = settings;
        this.token = token;
        this.stateStore = stateStore;
        this.healthStore = healthStore;
    }

    public void injectMdc(WorkItem item) {
        if (runId != null) MDC.put("runId", runId);
        if (item != null) {
            MDC.put("service", item.service());
            MDC.put("kind", item.kind().getWireName());
            MDC.put("phase", item.phase().name());
        }
    }

    public void clearMdc() {
        MDC.clear();
    }

    public String getRunId() {
        return runId;
    }

    public Manifest getManifest() {
        return manifest;
    }

    public ExecutionSettings getSettings() {
        return settings;
    }

    public CancellationToken getToken() {
        return token;
    }

    public DeploymentStateStore getStateStore() {
        return stateStore;
    }

    public HealthStatusStore getHealthStore() {
        return healthStore;
    }
}
