package xyz.firestige.fleet.domain.manifest;

import java.time.Duration;

/**
 * 健康检查接口面
 * <p>
 * 探针目标以 http:// 或 https:// 开头时按 HTTP GET 执行，否则按 shell 命令执行
 *
 * @param startup         启动探针，只执行一次（可选）
 * @param liveness        存活探针（必填）
 * @param readiness       就绪探针（可选）
 * @param intervalSeconds 轮询间隔（秒）
 * @param timeoutSeconds  整个探测序列的超时（秒）
 * @param retries         存活/就绪探针的最大尝试次数
 */
public record HealthFacet(String startup, String liveness, String readiness,
                          int intervalSeconds, int timeoutSeconds, int retries) {

    public Duration intervalDuration() {
        return Duration.ofSeconds(intervalSeconds);
    }

    public Duration timeoutDuration() {
        return Duration.ofSeconds(timeoutSeconds);
    }
}
