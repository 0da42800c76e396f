package xyz.firestige.fleet.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.fleet.application.dto.ApplyResult;
import xyz.firestige.fleet.application.dto.PlanRequest;
import xyz.firestige.fleet.application.dto.PlanResult;
import xyz.firestige.fleet.application.dto.StatusEntry;
import xyz.firestige.fleet.application.dto.StatusReport;
import xyz.firestige.fleet.application.dto.SyncState;
import xyz.firestige.fleet.config.OrchestratorProperties;
import xyz.firestige.fleet.domain.execution.CancellationToken;
import xyz.firestige.fleet.domain.graph.DependencyGraphBuilder;
import xyz.firestige.fleet.domain.graph.PhaseGraph;
import xyz.firestige.fleet.domain.manifest.Manifest;
import xyz.firestige.fleet.domain.manifest.ServiceSpec;
import xyz.firestige.fleet.domain.plan.DeploymentPlan;
import xyz.firestige.fleet.domain.plan.DiffEngine;
import xyz.firestige.fleet.domain.plan.FingerprintCalculator;
import xyz.firestige.fleet.domain.state.DeploymentRecord;
import xyz.firestige.fleet.domain.state.DeploymentState;
import xyz.firestige.fleet.domain.state.ResourceKind;
import xyz.firestige.fleet.exception.OrchestratorException;
import xyz.firestige.fleet.infrastructure.execution.ExecutionOverrides;
import xyz.firestige.fleet.infrastructure.execution.ExecutionSettings;
import xyz.firestige.fleet.infrastructure.execution.ExecutionSettingsResolver;
import xyz.firestige.fleet.infrastructure.execution.PhasedExecutionEngine;
import xyz.firestige.fleet.infrastructure.execution.RunReport;
import xyz.firestige.fleet.infrastructure.manifest.ManifestLoader;
import xyz.firestige.fleet.infrastructure.persistence.DeploymentStateStore;
import xyz.firestige.fleet.infrastructure.persistence.HealthStatusStore;
import xyz.firestige.fleet.infrastructure.persistence.StateStoreProvider;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 编排应用服务
 * <p>
 * 职责：
 * 1. plan：加载清单 → 构建依赖图 → 读取状态 → 计算差异，无副作用
 * 2. apply：在 plan 基础上合并执行参数，交给分阶段执行引擎
 * 3. status：对比已记录状态与当前清单，附带最近的健康检查结果
 * 4. decommission：显式移除部署记录
 * <p>
 * 应用服务只做协调，不包含具体业务逻辑
 */
public class OrchestrationService {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationService.class);

    private final OrchestratorProperties properties;
    private final ManifestLoader manifestLoader;
    private final DependencyGraphBuilder graphBuilder;
    private final DiffEngine diffEngine;
    private final FingerprintCalculator fingerprintCalculator;
    private final StateStoreProvider stateStoreProvider;
    private final ExecutionSettingsResolver settingsResolver;
    private final PhasedExecutionEngine executionEngine;

    public OrchestrationService(OrchestratorProperties properties,
                                ManifestLoader manifestLoader,
                                DependencyGraphBuilder graphBuilder,
                                DiffEngine diffEngine,
                                FingerprintCalculator fingerprintCalculator,
                                StateStoreProvider stateStoreProvider,
                                ExecutionSettingsResolver settingsResolver,
                                PhasedExecutionEngine executionEngine) {
        this.properties = properties;
        this.manifestLoader = manifestLoader;
        this.graphBuilder = graphBuilder;
        this.diffEngine = diffEngine;
        this.fingerprintCalculator = fingerprintCalculator;
        this.stateStoreProvider = stateStoreProvider;
        this.settingsResolver = settingsResolver;
        this.executionEngine = executionEngine;
    }

    /**
     * 生成部署计划
     *
     * @throws xyz.firestige.fleet.exception.ManifestValidationException 清单或选项不合法
     * @throws xyz.firestige.fleet.exception.CycleException              依赖成环
     */
    public PlanResult plan(PlanRequest request) {
        Path stateFile = stateStoreProvider.resolveStateFile(request.stateFile());
        try (DeploymentStateStore store = stateStoreProvider.open(stateFile)) {
            return plan(request, stateFile, store);
        }
    }

    /**
     * 执行部署
     * <p>
     * 清单、依赖图和选项的错误在任何副作用发生前抛出
     */
    public ApplyResult apply(PlanRequest request, ExecutionOverrides overrides, CancellationToken token) {
        Path stateFile = stateStoreProvider.resolveStateFile(request.stateFile());
        try (DeploymentStateStore store = stateStoreProvider.open(stateFile)) {
            PlanResult planResult = plan(request, stateFile, store);
            ExecutionSettings settings = settingsResolver.resolve(planResult.manifest().getDefaults(), overrides);
            HealthStatusStore healthStore = stateStoreProvider.healthStore(stateFile);
            RunReport report = executionEngine.execute(planResult.plan(), planResult.manifest(), settings, token, store, healthStore);
            return new ApplyResult(planResult, report);
        }
    }

    /**
     * 查询部署状态
     *
     * @param manifestPath 清单路径，null 时使用配置；清单不可用时仍返回已记录的状态
     */
    public StatusReport status(String manifestPath, String stateFileOverride) {
        Path stateFile = stateStoreProvider.resolveStateFile(stateFileOverride);
        DeploymentState state;
        try (DeploymentStateStore store = stateStoreProvider.open(stateFile)) {
            state = store.snapshot();
        }

        Manifest manifest = null;
        String manifestError = null;
        try {
            manifest = manifestLoader.load(resolveManifest(manifestPath));
        } catch (OrchestratorException e) {
            log.warn("Manifest unavailable for status comparison: {}", e.getMessage());
            manifestError = e.getMessage();
        }

        List<StatusEntry> entries = new ArrayList<>();
        for (DeploymentRecord record : state.allRecords()) {
            entries.add(new StatusEntry(record.service(), record.kind(), record.fingerprint(), record.updatedAt(),
                    syncOf(manifest, record)));
        }
        if (manifest != null) {
            for (ServiceSpec service : manifest.enabledServices()) {
                for (ResourceKind kind : service.requiredKinds()) {
                    if (!state.has(service.name(), kind)) {
                        entries.add(new StatusEntry(service.name(), kind, null, null, SyncState.PENDING));
                    }
                }
            }
        }
        entries.sort(Comparator.comparing(StatusEntry::service).thenComparingInt(e -> e.kind().priority()));

        return new StatusReport(stateFile, state.getUpdatedAt(), entries,
                stateStoreProvider.healthStore(stateFile).loadAll(), manifestError);
    }

    /**
     * 显式移除部署记录，不触碰实际资源
     *
     * @param kinds 要移除的资源类型，为空时移除该服务的全部记录
     * @return 实际移除的记录数
     */
    public int decommission(String stateFileOverride, String service, Set<ResourceKind> kinds) {
        Path stateFile = stateStoreProvider.resolveStateFile(stateFileOverride);
        Set<ResourceKind> targets = kinds == null || kinds.isEmpty() ? Set.of(ResourceKind.values()) : kinds;
        try (DeploymentStateStore store = stateStoreProvider.open(stateFile)) {
            int removed = store.decommission(service, targets);
            log.info("Decommissioned service {}: {} record(s) removed from {}", service, removed, stateFile);
            return removed;
        }
    }

    // ====== 内部方法 ======

    private PlanResult plan(PlanRequest request, Path stateFile, DeploymentStateStore store) {
        Manifest manifest = manifestLoader.load(resolveManifest(request.manifest()));
        PhaseGraph graph = graphBuilder.build(manifest);
        DeploymentPlan plan = diffEngine.diff(manifest, graph, store.snapshot(), request.options());
        log.info("Plan computed: {} item(s) {}, {} orphan(s), options={}",
                plan.getItems().size(), plan.countByAction(), plan.getOrphans().size(), request.options());
        return new PlanResult(manifest, graph, plan, stateFile);
    }

    private Path resolveManifest(String override) {
        return Paths.get(override != null ? override : properties.getManifest());
    }

    private SyncState syncOf(Manifest manifest, DeploymentRecord record) {
        if (manifest == null) {
            return SyncState.UNKNOWN;
        }
        Optional<ServiceSpec> service = manifest.findService(record.service());
        if (service.isEmpty() || !service.get().enabled() || !service.get().requiredKinds().contains(record.kind())) {
            return SyncState.ORPHANED;
        }
        String expected = fingerprintCalculator.fingerprint(manifest, service.get(), record.kind());
        return expected.equals(record.fingerprint()) ? SyncState.IN_SYNC : SyncState.DRIFTED;
    }
}
