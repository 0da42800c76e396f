package xyz.firestige.fleet.domain.graph;

import xyz.firestige.fleet.domain.manifest.DeploymentPhase;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 分层阶段图
 * <p>
 * layer(s) = 0（无依赖）或 1 + max(layer(dep))；层内服务按名称排序。
 * 每个服务整体归属一个顶层阶段：核心服务取其在 deployment_phases 中最早出现的阶段
 * （仅在 core_services 中声明的取基础设施阶段），再提升到不早于其所有依赖的阶段；
 * 其余服务全部在应用发布阶段。因此沿依赖边阶段只增不减。
 */
public final class PhaseGraph {

    private final List<List<String>> layers;
    private final Map<String, Integer> layerIndex;
    private final Map<String, SortedSet<String>> dependencies;
    private final Set<String> coreServices;
    private final Map<String, DeploymentPhase> phases;

    PhaseGraph(List<List<String>> layers, Map<String, Integer> layerIndex,
               Map<String, SortedSet<String>> dependencies, Set<String> coreServices,
               Map<String, DeploymentPhase> phases) {
        List<List<String>> copy = new ArrayList<>();
        layers.forEach(layer -> copy.add(List.copyOf(layer)));
        this.layers = Collections.unmodifiableList(copy);
        this.layerIndex = Map.copyOf(layerIndex);
        this.dependencies = Map.copyOf(dependencies);
        this.coreServices = Set.copyOf(coreServices);
        this.phases = Map.copyOf(phases);
    }

    public List<List<String>> getLayers() {
        return layers;
    }

    public int layerCount() {
        return layers.size();
    }

    public int layerOf(String service) {
        Integer layer = layerIndex.get(service);
        if (layer == null) {
            throw new IllegalArgumentException("服务不在阶段图中: " + service);
        }
        return layer;
    }

    public boolean contains(String service) {
        return layerIndex.containsKey(service);
    }

    public boolean isCore(String service) {
        return coreServices.contains(service);
    }

    /**
     * 拓扑顺序的服务列表（先按层，再按名称）
     */
    public List<String> servicesInOrder() {
        List<String> ordered = new ArrayList<>();
        layers.forEach(ordered::addAll);
        return ordered;
    }

    public SortedSet<String> dependenciesOf(String service) {
        return dependencies.getOrDefault(service, Collections.emptySortedSet());
    }

    /**
     * 传递依赖（不含自身）
     */
    public SortedSet<String> transitiveDependenciesOf(String service) {
        SortedSet<String> result = new TreeSet<>();
        Deque<String> queue = new ArrayDeque<>(dependenciesOf(service));
        while (!queue.isEmpty()) {
            String dep = queue.poll();
            if (result.add(dep)) {
                queue.addAll(dependenciesOf(dep));
            }
        }
        return result;
    }

    /**
     * 服务（及其全部工作项）所属的顶层阶段
     */
    public DeploymentPhase phaseOf(String service) {
        DeploymentPhase phase = phases.get(service);
        if (phase == null) {
            throw new IllegalArgumentException("服务不在阶段图中: " + service);
        }
        return phase;
    }
}
