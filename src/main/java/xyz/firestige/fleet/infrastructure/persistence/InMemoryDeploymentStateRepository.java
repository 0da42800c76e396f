package xyz.firestige.fleet.infrastructure.persistence;

import xyz.firestige.fleet.domain.state.DeploymentState;
import xyz.firestige.fleet.domain.state.DeploymentStateRepository;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 内存状态仓储（测试用，进程退出后丢失）
 */
public class InMemoryDeploymentStateRepository implements DeploymentStateRepository {

    private final AtomicReference<DeploymentState> state = new AtomicReference<>(DeploymentState.empty());
    private final AtomicInteger saveCount = new AtomicInteger();

    @Override
    public DeploymentState load() {
        return state.get();
    }

    @Override
    public void save(DeploymentState newState) {
        state.set(newState);
        saveCount.incrementAndGet();
    }

    public int getSaveCount() {
        return saveCount.get();
    }
}
