package xyz.firestige.fleet.domain.manifest;

/**
 * 清单级别的编排默认值，未声明的字段为 null，表示沿用应用配置
 *
 * @param healthCheckTimeoutSeconds 健康检查默认超时
 * @param retryAttempts             工作项重试次数
 * @param retryDelaySeconds         重试间隔
 */
public record OrchestrationDefaults(Integer healthCheckTimeoutSeconds, Integer retryAttempts, Integer retryDelaySeconds) {

    public static final OrchestrationDefaults NONE = new OrchestrationDefaults(null, null, null);
}
