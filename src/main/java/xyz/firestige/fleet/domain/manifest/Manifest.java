package xyz.firestige.fleet.domain.manifest;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 部署清单（期望状态的唯一来源）
 * <p>
 * 服务按名称排序保存，core_services 与 services 合并为同一张表，通过 {@link ServiceSpec#core()} 区分
 */
public final class Manifest {

    private final NetworkSpec network;
    private final Map<String, ServiceSpec> services;
    private final PhaseAssignments phaseAssignments;
    private final OrchestrationDefaults defaults;

    public Manifest(NetworkSpec network, Map<String, ServiceSpec> services,
                    PhaseAssignments phaseAssignments, OrchestrationDefaults defaults) {
        this.network = network;
        this.services = Collections.unmodifiableMap(new TreeMap<>(services));
        this.phaseAssignments = phaseAssignments == null ? PhaseAssignments.EMPTY : phaseAssignments;
        this.defaults = defaults == null ? OrchestrationDefaults.NONE : defaults;
    }

    public NetworkSpec getNetwork() {
        return network;
    }

    public Map<String, ServiceSpec> getServices() {
        return services;
    }

    public Optional<ServiceSpec> findService(String name) {
        return Optional.ofNullable(services.get(name));
    }

    public ServiceSpec getService(String name) {
        ServiceSpec spec = services.get(name);
        if (spec == null) {
            throw new IllegalArgumentException("清单中不存在服务: " + name);
        }
        return spec;
    }

    public List<ServiceSpec> enabledServices() {
        return services.values().stream()
                .filter(ServiceSpec::enabled)
                .collect(Collectors.toList());
    }

    public Collection<String> serviceNames() {
        return services.keySet();
    }

    public PhaseAssignments getPhaseAssignments() {
        return phaseAssignments;
    }

    public OrchestrationDefaults getDefaults() {
        return defaults;
    }
}
