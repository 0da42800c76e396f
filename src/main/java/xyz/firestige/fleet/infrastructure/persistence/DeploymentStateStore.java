package xyz.firestige.fleet.infrastructure.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.fleet.domain.plan.WorkItem;
import xyz.firestige.fleet.domain.state.DeploymentRecord;
import xyz.firestige.fleet.domain.state.DeploymentState;
import xyz.firestige.fleet.domain.state.DeploymentStateRepository;
import xyz.firestige.fleet.domain.state.ResourceKind;
import xyz.firestige.fleet.exception.StateStoreException;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 部署状态存储
 * <p>
 * 职责：
 * 1. 持有当前状态快照，读操作无锁
 * 2. 所有写操作经由单一写线程串行执行，每次写入整体落盘
 * 3. 写入调用阻塞到落盘完成，调用方据此确认记录已持久化
 */
public class DeploymentStateStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DeploymentStateStore.class);

    private final DeploymentStateRepository repository;
    private final Clock clock;
    private final ExecutorService writer;
    private volatile DeploymentState current;

    public DeploymentStateStore(DeploymentStateRepository repository) {
        this(repository, Clock.systemUTC());
    }

    public DeploymentStateStore(DeploymentStateRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
        this.writer = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "state-writer");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 从仓储重新读取状态
     */
    public DeploymentState load() {
        DeploymentState loaded = repository.load();
        this.current = loaded;
        return loaded;
    }

    public DeploymentState snapshot() {
        DeploymentState state = current;
        return state == null ? load() : state;
    }

    public boolean has(String service, ResourceKind kind) {
        return snapshot().has(service, kind);
    }

    public Optional<String> fingerprintOf(String service, ResourceKind kind) {
        return snapshot().fingerprintOf(service, kind);
    }

    /**
     * 记录工作项成功，阻塞到落盘完成
     */
    public DeploymentRecord record(WorkItem item, String fingerprint) {
        DeploymentRecord record = new DeploymentRecord(item.service(), item.kind(), fingerprint, Instant.now(clock));
        submit(() -> {
            DeploymentState next = snapshot().with(record);
            repository.save(next);
            current = next;
            log.info("Recorded {} fingerprint={}", record.key(), fingerprint);
            return null;
        });
        return record;
    }

    /**
     * 移除服务的部署记录（显式下线）
     *
     * @return 实际移除的记录数
     */
    public int decommission(String service, Set<ResourceKind> kinds) {
        return submit(() -> {
            DeploymentState before = snapshot();
            int removed = (int) before.recordsOf(service).keySet().stream().filter(kinds::contains).count();
            if (removed > 0) {
                DeploymentState next = before.without(service, kinds, Instant.now(clock));
                repository.save(next);
                current = next;
            }
            log.info("Decommissioned {} record(s) of {}", removed, service);
            return removed;
        });
    }

    private <T> T submit(Callable<T> task) {
        Future<T> future = writer.submit(task);
        try {
            return future.get();
        } catch (InterruptedException e) {
            // 写任务已提交，仍会在写线程完成
            Thread.currentThread().interrupt();
            throw new StateStoreException("等待状态写入时被中断", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StateStoreException sse) {
                throw sse;
            }
            throw new StateStoreException("状态写入失败", cause);
        }
    }

    @Override
    public void close() {
        writer.shutdown();
    }
}
