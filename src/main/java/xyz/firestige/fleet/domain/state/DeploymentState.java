package xyz.firestige.fleet.domain.state;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * 部署状态快照（不可变）
 * <p>
 * 修改操作返回新快照，写入由 DeploymentStateStore 串行化
 */
public final class DeploymentState {

    private static final DeploymentState EMPTY = new DeploymentState(new TreeMap<>(), null);

    private final Map<String, Map<ResourceKind, DeploymentRecord>> records;
    private final Instant updatedAt;

    private DeploymentState(Map<String, Map<ResourceKind, DeploymentRecord>> records, Instant updatedAt) {
        this.records = records;
        this.updatedAt = updatedAt;
    }

    public static DeploymentState empty() {
        return EMPTY;
    }

    public static DeploymentState of(Collection<DeploymentRecord> records, Instant updatedAt) {
        Map<String, Map<ResourceKind, DeploymentRecord>> map = new TreeMap<>();
        for (DeploymentRecord record : records) {
            map.computeIfAbsent(record.service(), s -> new EnumMap<>(ResourceKind.class))
                    .put(record.kind(), record);
        }
        return new DeploymentState(map, updatedAt);
    }

    public boolean has(String service, ResourceKind kind) {
        return find(service, kind).isPresent();
    }

    public Optional<DeploymentRecord> find(String service, ResourceKind kind) {
        Map<ResourceKind, DeploymentRecord> byKind = records.get(service);
        return byKind == null ? Optional.empty() : Optional.ofNullable(byKind.get(kind));
    }

    public Optional<String> fingerprintOf(String service, ResourceKind kind) {
        return find(service, kind).map(DeploymentRecord::fingerprint);
    }

    public Map<ResourceKind, DeploymentRecord> recordsOf(String service) {
        Map<ResourceKind, DeploymentRecord> byKind = records.get(service);
        return byKind == null ? Map.of() : Collections.unmodifiableMap(byKind);
    }

    public Set<String> services() {
        return Collections.unmodifiableSet(records.keySet());
    }

    public List<DeploymentRecord> allRecords() {
        List<DeploymentRecord> all = new ArrayList<>();
        records.values().forEach(byKind -> all.addAll(byKind.values()));
        return all;
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * 返回写入（或覆盖）一条记录后的新快照
     */
    public DeploymentState with(DeploymentRecord record) {
        Map<String, Map<ResourceKind, DeploymentRecord>> copy = deepCopy();
        copy.computeIfAbsent(record.service(), s -> new EnumMap<>(ResourceKind.class))
                .put(record.kind(), record);
        return new DeploymentState(copy, record.updatedAt());
    }

    /**
     * 返回移除指定服务若干资源类型记录后的新快照
     */
    public DeploymentState without(String service, Set<ResourceKind> kinds, Instant at) {
        Map<String, Map<ResourceKind, DeploymentRecord>> copy = deepCopy();
        Map<ResourceKind, DeploymentRecord> byKind = copy.get(service);
        if (byKind != null) {
            byKind.keySet().removeAll(kinds);
            if (byKind.isEmpty()) {
                copy.remove(service);
            }
        }
        return new DeploymentState(copy, at);
    }

    private Map<String, Map<ResourceKind, DeploymentRecord>> deepCopy() {
        Map<String, Map<ResourceKind, DeploymentRecord>> copy = new TreeMap<>();
        records.forEach((service, byKind) -> copy.put(service, new EnumMap<>(byKind)));
        return copy;
    }
}
