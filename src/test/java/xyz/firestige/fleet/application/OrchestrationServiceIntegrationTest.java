package xyz.firestige.fleet.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.ActiveProfiles;
import xyz.firestige.fleet.application.dto.ApplyResult;
import xyz.firestige.fleet.application.dto.PlanRequest;
import xyz.firestige.fleet.application.dto.PlanResult;
import xyz.firestige.fleet.application.dto.StatusReport;
import xyz.firestige.fleet.application.dto.SyncState;
import xyz.firestige.fleet.domain.execution.CancellationToken;
import xyz.firestige.fleet.domain.execution.WorkItemStatus;
import xyz.firestige.fleet.domain.plan.DiffOptions;
import xyz.firestige.fleet.domain.plan.WorkAction;
import xyz.firestige.fleet.domain.state.ResourceKind;
import xyz.firestige.fleet.exception.FatalApplyException;
import xyz.firestige.fleet.exception.ManifestValidationException;
import xyz.firestige.fleet.infrastructure.execution.ExecutionOverrides;
import xyz.firestige.fleet.infrastructure.execution.RunOutcome;
import xyz.firestige.fleet.infrastructure.external.ConfigurationApplier;
import xyz.firestige.fleet.infrastructure.external.IdentityProviderClient;
import xyz.firestige.fleet.infrastructure.external.ProvisioningBackend;
import xyz.firestige.fleet.infrastructure.external.SecretResolver;
import xyz.firestige.fleet.support.StubCollaborators;
import xyz.firestige.fleet.support.StubSecretResolver;
import xyz.firestige.fleet.support.TestManifests;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 编排服务集成测试
 * <p>
 * 完整 Spring 上下文，外部协作方替换为桩实现，状态写入临时目录
 */
@Tag("integration")
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("编排服务 集成测试")
class OrchestrationServiceIntegrationTest {

    @Autowired
    private OrchestrationService orchestrationService;

    @Autowired
    private StubCollaborators stubs;

    @TempDir
    Path workDir;

    private String manifest;
    private String stateFile;

    @BeforeEach
    void setUp() throws IOException {
        stubs.reset();
        manifest = write("fleet.yaml", TestManifests.FRESH_DEPLOY);
        stateFile = workDir.resolve("state/deployment-state.json").toString();
    }

    @Test
    @DisplayName("场景 16.1: plan 不产生任何副作用")
    void planHasNoSideEffects() {
        // When
        PlanResult result = orchestrationService.plan(new PlanRequest(manifest, stateFile, DiffOptions.none()));

        // Then
        assertEquals(5, result.plan().getItems().size());
        assertEquals(5L, result.plan().countByAction().get(WorkAction.CREATE));
        assertTrue(stubs.getCalls().isEmpty());
        assertFalse(Files.exists(Path.of(stateFile)));
    }

    @Test
    @DisplayName("场景 16.2: 首次部署后再次 plan 为空，status 全部一致")
    void applyThenIdempotent() {
        // When
        ApplyResult applied = apply(DiffOptions.none());

        // Then
        assertEquals(RunOutcome.SUCCEEDED, applied.report().outcome());
        assertEquals(0, applied.exitCode());
        assertEquals(5, stubs.getCalls().size());
        assertTrue(Files.exists(Path.of(stateFile)));

        PlanResult replan = orchestrationService.plan(new PlanRequest(manifest, stateFile, DiffOptions.none()));
        assertTrue(replan.plan().isEmpty());

        StatusReport status = orchestrationService.status(manifest, stateFile);
        assertNull(status.manifestError());
        assertEquals(5, status.count(SyncState.IN_SYNC));
        assertNotNull(status.updatedAt());
    }

    @Test
    @DisplayName("场景 16.3: 部分失败后重跑只执行未完成的工作项")
    void partialFailureThenResume() {
        // Given
        stubs.failNext("grafana/container", () -> new FatalApplyException("quota exceeded"));

        // When
        ApplyResult first = apply(DiffOptions.none());

        // Then
        assertEquals(RunOutcome.PARTIAL, first.report().outcome());
        assertEquals(3, first.exitCode());
        assertEquals(1, first.report().count(WorkItemStatus.FATALLY_FAILED));

        // 核心服务已记录，重跑时不再执行
        stubs.reset();
        ApplyResult second = apply(DiffOptions.none());
        assertEquals(RunOutcome.SUCCEEDED, second.report().outcome());
        assertTrue(stubs.getCalls().contains("grafana/container"));
        assertTrue(stubs.getCalls().stream().noneMatch(c -> c.startsWith("postgresql/")
                || c.startsWith("caddy/") || c.startsWith("authentik/")));
        assertTrue(orchestrationService.plan(new PlanRequest(manifest, stateFile, DiffOptions.none())).plan().isEmpty());
    }

    @Test
    @DisplayName("场景 16.4: 清单被修改后 status 显示漂移，force 重新执行")
    void driftAndForce() throws IOException {
        apply(DiffOptions.none());
        write("fleet.yaml", TestManifests.FRESH_DEPLOY.replace("hostname: grafana", "hostname: grafana-01"));

        StatusReport status = orchestrationService.status(manifest, stateFile);
        assertEquals(1, status.count(SyncState.DRIFTED));

        stubs.reset();
        ApplyResult forced = apply(DiffOptions.forcing("postgresql"));
        assertEquals(RunOutcome.SUCCEEDED, forced.report().outcome());
        assertEquals(Set.of("postgresql/container", "grafana/container"), Set.copyOf(stubs.getCalls()));
    }

    @Test
    @DisplayName("场景 16.5: 服务移出清单后记录成为孤立记录，decommission 显式移除")
    void orphansAndDecommission() throws IOException {
        apply(DiffOptions.none());
        write("fleet.yaml", TestManifests.FRESH_DEPLOY.replace("""
                  vaultwarden:
                    ip: 10.0.0.21
                    hostname: vaultwarden
                    depends_on: [postgresql, caddy, authentik]
                """, ""));

        PlanResult plan = orchestrationService.plan(new PlanRequest(manifest, stateFile, DiffOptions.none()));
        assertTrue(plan.plan().isEmpty());
        assertEquals(1, plan.plan().getOrphans().size());
        assertEquals(1, orchestrationService.status(manifest, stateFile).count(SyncState.ORPHANED));

        int removed = orchestrationService.decommission(stateFile, "vaultwarden", Set.of(ResourceKind.CONTAINER));

        assertEquals(1, removed);
        assertTrue(orchestrationService.plan(new PlanRequest(manifest, stateFile, DiffOptions.none()))
                .plan().getOrphans().isEmpty());
    }

    @Test
    @DisplayName("场景 16.6: 非法清单在任何副作用之前被拒绝")
    void invalidManifestRejectedBeforeSideEffects() throws IOException {
        write("fleet.yaml", TestManifests.FRESH_DEPLOY.replace("depends_on: [postgresql, caddy, authentik]\n", "depends_on: [ghost]\n"));

        assertThrows(ManifestValidationException.class, () -> apply(DiffOptions.none()));
        assertTrue(stubs.getCalls().isEmpty());
        assertFalse(Files.exists(Path.of(stateFile)));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("场景 16.7: 健康检查结果进入 status")
    void healthSnapshotsInStatus() throws IOException {
        write("fleet.yaml", TestManifests.WITH_INTERFACES.replace("liveness: pg_isready", "liveness: \"true\""));

        ApplyResult result = apply(DiffOptions.none());

        assertEquals(RunOutcome.SUCCEEDED, result.report().outcome());
        StatusReport status = orchestrationService.status(manifest, stateFile);
        assertTrue(status.health().containsKey("postgresql"));
        assertTrue(status.health().get("postgresql").healthy());
        assertEquals(0, status.count(SyncState.PENDING));
    }

    @Test
    @DisplayName("场景 16.8: 清单不可用时 status 仍输出已记录的状态")
    void statusWithoutManifest() throws IOException {
        apply(DiffOptions.none());
        Files.delete(Path.of(manifest));

        StatusReport status = orchestrationService.status(manifest, stateFile);

        assertNotNull(status.manifestError());
        assertEquals(5, status.count(SyncState.UNKNOWN));
    }

    private ApplyResult apply(DiffOptions options) {
        return orchestrationService.apply(new PlanRequest(manifest, stateFile, options),
                ExecutionOverrides.NONE, new CancellationToken());
    }

    private String write(String name, String content) throws IOException {
        Path file = workDir.resolve(name);
        Files.writeString(file, content);
        return file.toString();
    }

    @TestConfiguration
    static class StubCollaboratorConfiguration {

        @Bean
        StubCollaborators stubCollaborators() {
            return new StubCollaborators();
        }

        @Bean
        @Primary
        ProvisioningBackend stubProvisioningBackend(StubCollaborators stubs) {
            return stubs.provisioning;
        }

        @Bean
        @Primary
        IdentityProviderClient stubIdentityProviderClient(StubCollaborators stubs) {
            return stubs.identityProvider;
        }

        @Bean
        @Primary
        ConfigurationApplier stubConfigurationApplier(StubCollaborators stubs) {
            return stubs.configuration;
        }

        @Bean
        @Primary
        SecretResolver stubSecretResolver() {
            return StubSecretResolver.resolvingAll();
        }
    }
}
