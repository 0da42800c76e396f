package xyz.firestige.fleet.domain.state;

import java.time.Instant;

/**
 * 服务最近一次健康检查结果
 *
 * @param service   服务名
 * @param healthy   是否健康
 * @param detail    结果说明
 * @param checkedAt 检查时间
 */
public record HealthSnapshot(String service, boolean healthy, String detail, Instant checkedAt) {
}
