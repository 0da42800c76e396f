package xyz.firestige.fleet.infrastructure.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.fleet.config.OrchestratorProperties;
import xyz.firestige.fleet.domain.execution.RetryStrategy;
import xyz.firestige.fleet.domain.manifest.OrchestrationDefaults;

import java.time.Duration;

/**
 * 合并执行参数：应用配置 < 清单声明 < 命令行覆盖
 */
public class ExecutionSettingsResolver {

    private static final Logger log = LoggerFactory.getLogger(ExecutionSettingsResolver.class);

    private final OrchestratorProperties properties;

    public ExecutionSettingsResolver(OrchestratorProperties properties) {
        this.properties = properties;
    }

    public ExecutionSettings resolve(OrchestrationDefaults manifestDefaults, ExecutionOverrides overrides) {
        OrchestratorProperties.Retry retry = properties.getRetry();

        int parallelism = properties.getParallelism();
        int attempts = retry.getAttempts();
        Duration delay = retry.getDelay();

        if (manifestDefaults.retryAttempts() != null) {
            attempts = manifestDefaults.retryAttempts();
        }
        if (manifestDefaults.retryDelaySeconds() != null) {
            delay = Duration.ofSeconds(manifestDefaults.retryDelaySeconds());
        }

        if (overrides.parallelism() != null) {
            parallelism = overrides.parallelism();
        }
        if (overrides.retryAttempts() != null) {
            attempts = overrides.retryAttempts();
        }
        if (overrides.retryDelay() != null) {
            delay = overrides.retryDelay();
        }

        RetryStrategy strategy = retry.getBackoff() == OrchestratorProperties.BackoffType.fixed
                ? new FixedDelayRetryStrategy(delay)
                : new ExponentialBackoffRetryStrategy(delay, retry.getMultiplier(), retry.getMaxDelay());

        log.info("执行参数: parallelism={}, retryAttempts={}, retryDelay={}, backoff={}",
                parallelism, attempts, delay, retry.getBackoff());
        return new ExecutionSettings(parallelism, attempts, strategy);
    }
}
