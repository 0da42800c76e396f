package xyz.firestige.fleet.domain.plan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.fleet.domain.graph.PhaseGraph;
import xyz.firestige.fleet.domain.manifest.Manifest;
import xyz.firestige.fleet.domain.manifest.ServiceSpec;
import xyz.firestige.fleet.domain.state.DeploymentRecord;
import xyz.firestige.fleet.domain.state.DeploymentState;
import xyz.firestige.fleet.domain.state.ResourceKind;
import xyz.firestige.fleet.exception.ManifestValidationException;
import xyz.firestige.fleet.validation.ValidationError;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 差异引擎：比较期望状态（清单）与已记录状态，生成有序工作项
 * <p>
 * 规则：
 * 1. 没有记录 -> create
 * 2. 指纹不同 -> update
 * 3. 指纹相同 -> 不产生工作项
 * 4. force 指定的服务始终产生工作项，skip 指定的服务以 skip 动作输出
 * <p>
 * 纯函数，不修改状态。清单中已不存在的服务的记录作为孤儿返回，不会生成删除动作
 */
public class DiffEngine {

    private static final Logger log = LoggerFactory.getLogger(DiffEngine.class);

    private final FingerprintCalculator fingerprintCalculator;

    public DiffEngine(FingerprintCalculator fingerprintCalculator) {
        this.fingerprintCalculator = fingerprintCalculator;
    }

    public DeploymentPlan diff(Manifest manifest, PhaseGraph graph, DeploymentState state, DiffOptions options) {
        validateOptions(manifest, options);

        List<WorkItem> items = new ArrayList<>();
        for (String name : graph.servicesInOrder()) {
            if (!options.selects(name)) {
                continue;
            }
            ServiceSpec service = manifest.getService(name);
            for (ResourceKind kind : service.requiredKinds()) {
                diffOne(manifest, graph, state, options, service, kind).ifPresent(items::add);
            }
        }

        List<DeploymentRecord> orphans = new ArrayList<>();
        for (String recorded : state.services()) {
            Optional<ServiceSpec> spec = manifest.findService(recorded);
            if (spec.isEmpty() || !spec.get().enabled()) {
                orphans.addAll(state.recordsOf(recorded).values());
            } else {
                Set<ResourceKind> required = Set.copyOf(spec.get().requiredKinds());
                state.recordsOf(recorded).values().stream()
                        .filter(r -> !required.contains(r.kind()))
                        .forEach(orphans::add);
            }
        }

        DeploymentPlan plan = new DeploymentPlan(items, orphans);
        log.info("差异计算完成: items={}, byAction={}, orphans={}, options={}",
                plan.getItems().size(), plan.countByAction(), orphans.size(), options);
        return plan;
    }

    private Optional<WorkItem> diffOne(Manifest manifest, PhaseGraph graph, DeploymentState state,
                                       DiffOptions options, ServiceSpec service, ResourceKind kind) {
        String name = service.name();
        String desired = fingerprintCalculator.fingerprint(manifest, service, kind);
        Optional<String> recorded = state.fingerprintOf(name, kind);

        WorkAction action;
        String reason;
        if (recorded.isEmpty()) {
            action = WorkAction.CREATE;
            reason = "no record";
        } else if (options.forces(name)) {
            action = WorkAction.UPDATE;
            reason = "forced";
        } else if (!recorded.get().equals(desired)) {
            action = WorkAction.UPDATE;
            reason = "fingerprint changed";
        } else {
            return Optional.empty();
        }

        if (options.skips(name)) {
            reason = "skipped by operator (would " + action.getValue() + ")";
            action = WorkAction.SKIP;
        }

        return Optional.of(new WorkItem(name, kind, action, graph.phaseOf(name),
                graph.layerOf(name), desired, reason));
    }

    private void validateOptions(Manifest manifest, DiffOptions options) {
        List<ValidationError> errors = new ArrayList<>();
        checkNames(manifest, options.getOnly(), "--only", errors);
        checkNames(manifest, options.getSkip(), "--skip", errors);
        checkNames(manifest, options.getForce(), "--force", errors);
        if (!errors.isEmpty()) {
            throw new ManifestValidationException(errors);
        }
    }

    private static void checkNames(Manifest manifest, Set<String> names, String option, List<ValidationError> errors) {
        for (String name : names) {
            Optional<ServiceSpec> spec = manifest.findService(name);
            if (spec.isEmpty()) {
                errors.add(ValidationError.of(option, "未知服务: " + name, "UNKNOWN_SERVICE", name));
            } else if (!spec.get().enabled()) {
                errors.add(ValidationError.of(option, "服务未启用: " + name, "SERVICE_DISABLED", name));
            }
        }
    }
}
