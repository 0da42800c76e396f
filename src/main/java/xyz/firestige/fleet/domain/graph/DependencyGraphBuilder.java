package xyz.firestige.fleet.domain.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.fleet.domain.manifest.DeploymentPhase;
import xyz.firestige.fleet.domain.manifest.Manifest;
import xyz.firestige.fleet.domain.manifest.PhaseAssignments;
import xyz.firestige.fleet.domain.manifest.ServiceSpec;
import xyz.firestige.fleet.exception.CycleException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 依赖图构建器
 * <p>
 * 职责：
 * 1. 由启用服务的 depends_on 构建 DAG
 * 2. 分层 Kahn 拓扑排序，层内按名称排序
 * 3. 识别核心服务（core_services 或 deployment_phases 前三段中列出）
 * 4. 按层为每个服务分配顶层阶段，阶段不早于其依赖的阶段
 * <p>
 * 存在环时抛出 {@link CycleException}，此时尚未产生任何副作用
 */
public class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    public PhaseGraph build(Manifest manifest) {
        Map<String, SortedSet<String>> dependencies = new TreeMap<>();
        for (ServiceSpec spec : manifest.enabledServices()) {
            dependencies.put(spec.name(), new TreeSet<>(spec.dependsOn()));
        }
        // 只保留启用服务之间的边
        dependencies.values().forEach(deps -> deps.retainAll(dependencies.keySet()));

        Map<String, Integer> remaining = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        dependencies.forEach((service, deps) -> {
            remaining.put(service, deps.size());
            deps.forEach(dep -> dependents.computeIfAbsent(dep, d -> new ArrayList<>()).add(service));
        });

        List<List<String>> layers = new ArrayList<>();
        Map<String, Integer> layerIndex = new HashMap<>();
        SortedSet<String> current = new TreeSet<>();
        remaining.forEach((service, count) -> {
            if (count == 0) {
                current.add(service);
            }
        });

        while (!current.isEmpty()) {
            int index = layers.size();
            layers.add(new ArrayList<>(current));
            SortedSet<String> next = new TreeSet<>();
            for (String service : current) {
                layerIndex.put(service, index);
                for (String dependent : dependents.getOrDefault(service, List.of())) {
                    int left = remaining.merge(dependent, -1, Integer::sum);
                    if (left == 0) {
                        next.add(dependent);
                    }
                }
            }
            current.clear();
            current.addAll(next);
        }

        if (layerIndex.size() != dependencies.size()) {
            List<String> cycle = CycleDetector.findCycle(dependencies)
                    .orElseGet(() -> new ArrayList<>(unresolved(dependencies.keySet(), layerIndex.keySet())));
            throw new CycleException(cycle);
        }

        Set<String> core = new HashSet<>(manifest.getPhaseAssignments().coreServiceNames());
        manifest.enabledServices().stream()
                .filter(ServiceSpec::core)
                .forEach(s -> core.add(s.name()));
        core.retainAll(dependencies.keySet());

        Map<String, DeploymentPhase> phases = assignPhases(layers, dependencies, core, manifest.getPhaseAssignments());

        log.debug("依赖图构建完成: services={}, layers={}, core={}, phases={}",
                dependencies.size(), layers.size(), core, phases);
        return new PhaseGraph(layers, layerIndex, dependencies, core, phases);
    }

    /**
     * 逐层分配阶段；依赖总在更早的层，处理到某服务时其依赖的阶段已确定
     */
    private static Map<String, DeploymentPhase> assignPhases(List<List<String>> layers,
                                                             Map<String, SortedSet<String>> dependencies,
                                                             Set<String> core, PhaseAssignments assignments) {
        Map<String, DeploymentPhase> phases = new HashMap<>();
        for (List<String> layer : layers) {
            for (String service : layer) {
                DeploymentPhase phase = core.contains(service)
                        ? declaredCorePhase(service, assignments)
                        : DeploymentPhase.APPLICATION_ROLLOUT;
                for (String dep : dependencies.get(service)) {
                    DeploymentPhase depPhase = phases.get(dep);
                    if (depPhase.compareTo(phase) > 0) {
                        phase = depPhase;
                    }
                }
                phases.put(service, phase);
            }
        }
        return phases;
    }

    private static DeploymentPhase declaredCorePhase(String service, PhaseAssignments assignments) {
        for (DeploymentPhase phase : List.of(DeploymentPhase.INFRASTRUCTURE,
                DeploymentPhase.CORE_CONFIGURATION, DeploymentPhase.IDENTITY_REGISTRATION)) {
            if (assignments.servicesFor(phase).contains(service)) {
                return phase;
            }
        }
        return DeploymentPhase.INFRASTRUCTURE;
    }

    private static SortedSet<String> unresolved(Set<String> all, Set<String> resolved) {
        SortedSet<String> left = new TreeSet<>(all);
        left.removeAll(resolved);
        return left;
    }
}
