package xyz.firestige.fleet.application.dto;

import xyz.firestige.fleet.domain.state.HealthSnapshot;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * status 结果
 *
 * @param stateFile     状态文件
 * @param updatedAt     状态最后更新时间，从未写入时为 null
 * @param entries       按服务名、资源优先级排序
 * @param health        各服务最近一次健康检查结果
 * @param manifestError 清单无法加载时的原因，否则为 null
 */
public record StatusReport(Path stateFile, Instant updatedAt, List<StatusEntry> entries,
                           Map<String, HealthSnapshot> health, String manifestError) {

    public long count(SyncState sync) {
        return entries.stream().filter(e -> e.sync() == sync).count();
    }
}
