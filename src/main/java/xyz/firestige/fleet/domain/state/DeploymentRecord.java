package xyz.firestige.fleet.domain.state;

import java.time.Instant;
import java.util.Objects;

/**
 * 部署记录：某服务某资源类型最近一次成功应用的指纹
 *
 * @param service     服务名
 * @param kind        资源类型
 * @param fingerprint 内容指纹（sha256:...）
 * @param updatedAt   写入时间
 */
public record DeploymentRecord(String service, ResourceKind kind, String fingerprint, Instant updatedAt) {

    public DeploymentRecord {
        Objects.requireNonNull(service, "service 不能为空");
        Objects.requireNonNull(kind, "kind 不能为空");
        Objects.requireNonNull(fingerprint, "fingerprint 不能为空");
    }

    public String key() {
        return service + "/" + kind.getWireName();
    }
}
