package xyz.firestige.fleet.domain.event;

/**
 * 服务健康检查完成（健康、不健康或超时）
 */
public class HealthCheckedEvent extends DeploymentEvent {

    private final String service;
    private final boolean healthy;
    private final String detail;

    public HealthCheckedEvent(String runId, String service, boolean healthy, String detail) {
        super(runId, "健康检查 " + service + ": " + (healthy ? "healthy" : "unhealthy - " + detail));
        this.service = service;
        this.healthy = healthy;
        this.detail = detail;
    }

    public String getService() {
        return service;
    }

    public boolean isHealthy() {
        return healthy;
    }

    public String getDetail() {
        return detail;
    }
}
