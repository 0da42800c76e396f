package xyz.firestige.fleet.exception;

import java.time.Duration;

/**
 * 健康检查超时异常
 */
public class HealthTimeoutException extends OrchestratorException {

    private final String service;
    private final Duration timeout;

    public HealthTimeoutException(String service, Duration timeout) {
        super(ErrorType.HEALTH_TIMEOUT_ERROR,
                "服务 " + service + " 健康检查在 " + timeout.toSeconds() + " 秒内未通过");
        this.service = service;
        this.timeout = timeout;
    }

    public String getService() {
        return service;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
