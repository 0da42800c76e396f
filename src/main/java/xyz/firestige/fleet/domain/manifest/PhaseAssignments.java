package xyz.firestige.fleet.domain.manifest;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 清单中的 deployment_phases 段：每个顶层阶段列出的服务
 */
public final class PhaseAssignments {

    public static final PhaseAssignments EMPTY = new PhaseAssignments(Map.of());

    private final Map<DeploymentPhase, List<String>> assignments;

    public PhaseAssignments(Map<DeploymentPhase, List<String>> assignments) {
        EnumMap<DeploymentPhase, List<String>> copy = new EnumMap<>(DeploymentPhase.class);
        assignments.forEach((phase, names) -> copy.put(phase, List.copyOf(names)));
        this.assignments = Collections.unmodifiableMap(copy);
    }

    public List<String> servicesFor(DeploymentPhase phase) {
        return assignments.getOrDefault(phase, List.of());
    }

    /**
     * 出现在前三个阶段中的服务被视为核心服务
     */
    public Set<String> coreServiceNames() {
        Set<String> names = new LinkedHashSet<>();
        names.addAll(servicesFor(DeploymentPhase.INFRASTRUCTURE));
        names.addAll(servicesFor(DeploymentPhase.CORE_CONFIGURATION));
        names.addAll(servicesFor(DeploymentPhase.IDENTITY_REGISTRATION));
        return names;
    }

    public Map<DeploymentPhase, List<String>> asMap() {
        return assignments;
    }

    public boolean isEmpty() {
        return assignments.isEmpty();
    }
}
