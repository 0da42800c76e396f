package xyz.firestige.fleet.domain.execution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 工作项状态机
 * <p>
 * PENDING -> APPLYING -> SUCCEEDED | FAILED；FAILED -> APPLYING（重试）| FATALLY_FAILED；
 * PENDING 还可以直接进入 SKIPPED 或 CANCELLED。非法迁移抛出 IllegalStateException。
 */
public class WorkItemStateMachine {

    /**
     * 状态迁移监听
     */
    @FunctionalInterface
    public interface TransitionListener {
        void onTransition(WorkItemStatus from, WorkItemStatus to);
    }

    private static final Map<WorkItemStatus, Set<WorkItemStatus>> RULES = new EnumMap<>(WorkItemStatus.class);

    static {
        RULES.put(WorkItemStatus.PENDING, EnumSet.of(WorkItemStatus.APPLYING, WorkItemStatus.SKIPPED, WorkItemStatus.CANCELLED));
        RULES.put(WorkItemStatus.APPLYING, EnumSet.of(WorkItemStatus.SUCCEEDED, WorkItemStatus.FAILED));
        RULES.put(WorkItemStatus.FAILED, EnumSet.of(WorkItemStatus.APPLYING, WorkItemStatus.FATALLY_FAILED, WorkItemStatus.CANCELLED));
        RULES.put(WorkItemStatus.SUCCEEDED, EnumSet.noneOf(WorkItemStatus.class));
        RULES.put(WorkItemStatus.FATALLY_FAILED, EnumSet.noneOf(WorkItemStatus.class));
        RULES.put(WorkItemStatus.SKIPPED, EnumSet.noneOf(WorkItemStatus.class));
        RULES.put(WorkItemStatus.CANCELLED, EnumSet.noneOf(WorkItemStatus.class));
    }

    private WorkItemStatus current;
    private final List<TransitionListener> listeners = new ArrayList<>();
    private final List<WorkItemStatus> history = new ArrayList<>();

    public WorkItemStateMachine() {
        this(WorkItemStatus.PENDING);
    }

    public WorkItemStateMachine(WorkItemStatus initial) {
        this.current = initial;
        this.history.add(initial);
    }

    public void addListener(TransitionListener listener) {
        listeners.add(listener);
    }

    public synchronized boolean canTransition(WorkItemStatus to) {
        return RULES.getOrDefault(current, Collections.emptySet()).contains(to);
    }

    public synchronized WorkItemStatus transitionTo(WorkItemStatus to) {
        if (!canTransition(to)) {
            throw new IllegalStateException("非法的状态迁移: " + current + " -> " + to);
        }
        WorkItemStatus old = current;
        current = to;
        history.add(to);
        for (TransitionListener listener : listeners) {
            listener.onTransition(old, to);
        }
        return current;
    }

    public synchronized WorkItemStatus getCurrent() {
        return current;
    }

    public synchronized List<WorkItemStatus> getHistory() {
        return List.copyOf(history);
    }
}
