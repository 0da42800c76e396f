package xyz.firestige.fleet.infrastructure.execution;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import xyz.firestige.fleet.config.OrchestratorProperties;
import xyz.firestige.fleet.domain.manifest.OrchestrationDefaults;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
@DisplayName("ExecutionSettingsResolver 单元测试")
class ExecutionSettingsResolverTest {

    private final OrchestratorProperties properties = new OrchestratorProperties();
    private final ExecutionSettingsResolver resolver = new ExecutionSettingsResolver(properties);

    @Test
    @DisplayName("场景 8.1: 未声明时使用应用配置")
    void propertiesOnly() {
        ExecutionSettings settings = resolver.resolve(OrchestrationDefaults.NONE, ExecutionOverrides.NONE);

        assertEquals(4, settings.parallelism());
        assertEquals(3, settings.retryAttempts());
        assertInstanceOf(ExponentialBackoffRetryStrategy.class, settings.retryStrategy());
        assertEquals(Duration.ofSeconds(5), settings.retryStrategy().nextDelay(1));
    }

    @Test
    @DisplayName("场景 8.2: 清单覆盖应用配置，命令行覆盖清单")
    void precedence() {
        properties.getRetry().setBackoff(OrchestratorProperties.BackoffType.fixed);
        OrchestrationDefaults manifest = new OrchestrationDefaults(null, 5, 10);

        ExecutionSettings fromManifest = resolver.resolve(manifest, ExecutionOverrides.NONE);
        assertEquals(5, fromManifest.retryAttempts());
        assertEquals(Duration.ofSeconds(10), fromManifest.retryStrategy().nextDelay(3));

        ExecutionSettings fromCli = resolver.resolve(manifest, new ExecutionOverrides(1, 0, Duration.ofSeconds(2)));
        assertEquals(1, fromCli.parallelism());
        assertEquals(0, fromCli.retryAttempts());
        assertEquals(Duration.ofSeconds(2), fromCli.retryStrategy().nextDelay(1));
    }

    @Test
    @DisplayName("场景 8.3: 并行度必须为正数")
    void rejectsInvalidParallelism() {
        assertThrows(IllegalArgumentException.class,
                () -> resolver.resolve(OrchestrationDefaults.NONE, new ExecutionOverrides(0, null, null)));
    }
}
