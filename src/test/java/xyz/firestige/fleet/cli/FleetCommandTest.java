package xyz.firestige.fleet.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;
import xyz.firestige.fleet.application.OrchestrationService;
import xyz.firestige.fleet.application.dto.ApplyResult;
import xyz.firestige.fleet.application.dto.PlanRequest;
import xyz.firestige.fleet.application.dto.PlanResult;
import xyz.firestige.fleet.application.dto.StatusEntry;
import xyz.firestige.fleet.application.dto.StatusReport;
import xyz.firestige.fleet.application.dto.SyncState;
import xyz.firestige.fleet.config.OrchestratorProperties;
import xyz.firestige.fleet.domain.execution.CancellationToken;
import xyz.firestige.fleet.domain.plan.DeploymentPlan;
import xyz.firestige.fleet.domain.state.ResourceKind;
import xyz.firestige.fleet.exception.CycleException;
import xyz.firestige.fleet.exception.ManifestValidationException;
import xyz.firestige.fleet.infrastructure.execution.ExecutionOverrides;
import xyz.firestige.fleet.infrastructure.execution.RunOutcome;
import xyz.firestige.fleet.infrastructure.execution.RunReport;
import xyz.firestige.fleet.validation.ValidationError;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * 命令行退出码与参数传递测试
 */
@Tag("unit")
@DisplayName("命令行 单元测试")
class FleetCommandTest {

    private final OrchestrationService service = mock(OrchestrationService.class);
    private final OrchestratorProperties properties = new OrchestratorProperties();
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        CommandLine.IFactory factory = new CommandLine.IFactory() {
            @Override
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == PlanCommand.class) {
                    return cls.cast(new PlanCommand(service));
                }
                if (cls == ApplyCommand.class) {
                    return cls.cast(new ApplyCommand(service, properties));
                }
                if (cls == StatusCommand.class) {
                    return cls.cast(new StatusCommand(service));
                }
                if (cls == DecommissionCommand.class) {
                    return cls.cast(new DecommissionCommand(service));
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
        commandLine = CliRunner.newCommandLine(factory);
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @Test
    @DisplayName("场景 15.1: plan 合法时退出码 0，并透传清单与选择选项")
    void planValid() {
        // Given
        when(service.plan(any())).thenReturn(planResult());

        // When
        int exit = commandLine.execute("-m", "fleet.yaml", "-s", "state.json", "plan",
                "--only", "grafana,wiki", "--force", "grafana");

        // Then
        assertEquals(0, exit);
        ArgumentCaptor<PlanRequest> captor = ArgumentCaptor.forClass(PlanRequest.class);
        verify(service).plan(captor.capture());
        PlanRequest request = captor.getValue();
        assertEquals("fleet.yaml", request.manifest());
        assertEquals("state.json", request.stateFile());
        assertEquals(Set.of("grafana", "wiki"), request.options().getOnly());
        assertEquals(Set.of("grafana"), request.options().getForce());
        assertTrue(out.toString().contains("No changes."));
    }

    @Test
    @DisplayName("场景 15.2: plan 遇到清单违规时退出码 2，并列出全部违规")
    void planInvalid() {
        when(service.plan(any())).thenThrow(new ManifestValidationException(List.of(
                ValidationError.of("services.grafana.ip", "缺少必填字段", "REQUIRED"),
                ValidationError.of("services.wiki.ports[0]", "端口超出范围", "OUT_OF_RANGE"))));

        int exit = commandLine.execute("plan");

        assertEquals(2, exit);
        assertTrue(err.toString().contains("2 violation(s)"), err.toString());
        assertTrue(err.toString().contains("services.wiki.ports[0]"));
    }

    @Test
    @DisplayName("场景 15.3: plan 遇到依赖环时退出码 2，并输出环路")
    void planCycle() {
        when(service.plan(any())).thenThrow(new CycleException(List.of("a", "b", "a")));

        int exit = commandLine.execute("plan");

        assertEquals(2, exit);
        assertTrue(err.toString().contains("a -> b -> a"));
    }

    @Test
    @DisplayName("场景 15.4: apply 的退出码来自运行结果，并透传执行参数")
    void applyExitCodes() {
        // Given
        when(service.apply(any(), any(), any())).thenReturn(applyResult(RunOutcome.PARTIAL));

        // When
        int exit = commandLine.execute("apply", "--parallelism", "2", "--retries", "5", "--retry-delay", "1");

        // Then
        assertEquals(3, exit);
        ArgumentCaptor<ExecutionOverrides> overrides = ArgumentCaptor.forClass(ExecutionOverrides.class);
        verify(service).apply(any(PlanRequest.class), overrides.capture(), any(CancellationToken.class));
        assertEquals(2, overrides.getValue().parallelism());
        assertEquals(5, overrides.getValue().retryAttempts());
        assertEquals(Duration.ofSeconds(1), overrides.getValue().retryDelay());
    }

    @Test
    @DisplayName("场景 15.5: apply 各运行结果对应的退出码")
    void applyOutcomes() {
        when(service.apply(any(), any(), any())).thenReturn(applyResult(RunOutcome.SUCCEEDED));
        assertEquals(0, commandLine.execute("apply"));

        when(service.apply(any(), any(), any())).thenReturn(applyResult(RunOutcome.FAILED));
        assertEquals(1, commandLine.execute("apply"));

        when(service.apply(any(), any(), any())).thenReturn(applyResult(RunOutcome.CANCELLED));
        assertEquals(130, commandLine.execute("apply"));
    }

    @Test
    @DisplayName("场景 15.6: apply 遇到清单违规时退出码 1")
    void applyInvalid() {
        when(service.apply(any(), any(), any())).thenThrow(new ManifestValidationException(List.of(
                ValidationError.of("services.grafana.ip", "缺少必填字段", "REQUIRED"))));

        assertEquals(1, commandLine.execute("apply"));
        assertTrue(err.toString().contains("services.grafana.ip"));
    }

    @Test
    @DisplayName("场景 15.7: status 输出记录与同步状态")
    void status() {
        when(service.status(null, null)).thenReturn(new StatusReport(Path.of("state.json"), Instant.EPOCH,
                List.of(new StatusEntry("postgresql", ResourceKind.CONTAINER, "sha256:abc", Instant.EPOCH, SyncState.IN_SYNC),
                        new StatusEntry("grafana", ResourceKind.CONTAINER, null, null, SyncState.PENDING)),
                Map.of(), null));

        int exit = commandLine.execute("status");

        assertEquals(0, exit);
        String output = out.toString();
        assertTrue(output.contains("postgresql"));
        assertTrue(output.contains("in_sync"));
        assertTrue(output.contains("1 in sync, 0 drifted, 1 pending, 0 orphaned."), output);
    }

    @Test
    @DisplayName("场景 15.8: decommission 按资源类型移除记录")
    void decommission() {
        when(service.decommission(eq("state.json"), eq("old-wiki"), any())).thenReturn(1);

        int exit = commandLine.execute("-s", "state.json", "decommission", "old-wiki", "--kind", "container");

        assertEquals(0, exit);
        verify(service).decommission("state.json", "old-wiki", EnumSet.of(ResourceKind.CONTAINER));
        assertTrue(out.toString().contains("Removed 1 record(s) of old-wiki."));
    }

    @Test
    @DisplayName("场景 15.9: 未知选项返回用法错误且不调用服务")
    void unknownOption() {
        int exit = commandLine.execute("plan", "--bogus");

        assertEquals(CommandLine.ExitCode.USAGE, exit);
        verify(service, never()).plan(any());
    }

    private static PlanResult planResult() {
        return new PlanResult(null, null, new DeploymentPlan(List.of(), List.of()), Path.of("state.json"));
    }

    private static ApplyResult applyResult(RunOutcome outcome) {
        return new ApplyResult(planResult(), new RunReport("run-1", outcome, List.of(), null, Duration.ZERO));
    }
}
