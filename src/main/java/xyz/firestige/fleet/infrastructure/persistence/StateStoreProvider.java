package xyz.firestige.fleet.infrastructure.persistence;

import xyz.firestige.fleet.config.OrchestratorProperties;
import xyz.firestige.fleet.domain.state.DeploymentStateRepository;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 按状态文件位置打开存储
 * <p>
 * 状态文件可由命令行逐次覆盖，因此存储按次打开，由调用方关闭；
 * 内存模式下所有调用共享同一份状态
 */
public class StateStoreProvider {

    private final OrchestratorProperties properties;
    private final InMemoryDeploymentStateRepository memoryRepository = new InMemoryDeploymentStateRepository();
    private final HealthStatusStore memoryHealthStore = new HealthStatusStore(null);

    public StateStoreProvider(OrchestratorProperties properties) {
        this.properties = properties;
    }

    /**
     * @param override 命令行指定的状态文件，null 时使用配置
     */
    public Path resolveStateFile(String override) {
        return Paths.get(override != null ? override : properties.getStateFile());
    }

    public DeploymentStateStore open(Path stateFile) {
        DeploymentStateRepository repository = properties.getStoreType() == OrchestratorProperties.StoreType.memory
                ? memoryRepository
                : new JsonFileDeploymentStateRepository(stateFile);
        DeploymentStateStore store = new DeploymentStateStore(repository);
        store.load();
        return store;
    }

    /**
     * 健康状态文件固定为本次使用的状态文件同目录下的 {@code <name>.health.json}
     */
    public HealthStatusStore healthStore(Path stateFile) {
        if (properties.getStoreType() == OrchestratorProperties.StoreType.memory) {
            return memoryHealthStore;
        }
        String name = stateFile.getFileName().toString();
        String base = name.endsWith(".json") ? name.substring(0, name.length() - ".json".length()) : name;
        return new HealthStatusStore(stateFile.resolveSibling(base + ".health.json"));
    }
}
