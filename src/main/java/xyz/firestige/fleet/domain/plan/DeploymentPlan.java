package xyz.firestige.fleet.domain.plan;

import xyz.firestige.fleet.domain.manifest.DeploymentPhase;
import xyz.firestige.fleet.domain.state.DeploymentRecord;
import xyz.firestige.fleet.domain.state.ResourceKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 部署计划：有序工作项列表，以及状态中存在但清单已不存在的孤儿记录
 */
public final class DeploymentPlan {

    private final List<WorkItem> items;
    private final List<DeploymentRecord> orphans;

    public DeploymentPlan(List<WorkItem> items, List<DeploymentRecord> orphans) {
        List<WorkItem> sorted = new ArrayList<>(items);
        sorted.sort(WorkItem.EXECUTION_ORDER);
        this.items = Collections.unmodifiableList(sorted);
        this.orphans = List.copyOf(orphans);
    }

    public List<WorkItem> getItems() {
        return items;
    }

    public List<DeploymentRecord> getOrphans() {
        return orphans;
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * 需要实际执行的工作项（不含 skip）
     */
    public List<WorkItem> executableItems() {
        return items.stream().filter(WorkItem::executable).collect(Collectors.toList());
    }

    public List<WorkItem> itemsIn(DeploymentPhase phase) {
        return items.stream().filter(i -> i.phase() == phase).collect(Collectors.toList());
    }

    public Set<ResourceKind> executableKinds() {
        return items.stream()
                .filter(WorkItem::executable)
                .map(WorkItem::kind)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(ResourceKind.class)));
    }

    public Map<WorkAction, Long> countByAction() {
        Map<WorkAction, Long> counts = new EnumMap<>(WorkAction.class);
        for (WorkAction action : WorkAction.values()) {
            counts.put(action, 0L);
        }
        items.forEach(i -> counts.merge(i.action(), 1L, Long::sum));
        return counts;
    }

    public Map<DeploymentPhase, Long> countByPhase() {
        Map<DeploymentPhase, Long> counts = new EnumMap<>(DeploymentPhase.class);
        items.forEach(i -> counts.merge(i.phase(), 1L, Long::sum));
        return counts;
    }
}
