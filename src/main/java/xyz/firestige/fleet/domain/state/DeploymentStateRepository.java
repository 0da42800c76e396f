package xyz.firestige.fleet.domain.state;

/**
 * 部署状态仓储接口
 * <p>
 * save 必须是原子的：读者要么看到旧文档，要么看到新文档
 */
public interface DeploymentStateRepository {

    /**
     * 读取当前状态，不存在时返回空状态
     */
    DeploymentState load();

    /**
     * 整体写入状态
     */
    void save(DeploymentState state);
}
