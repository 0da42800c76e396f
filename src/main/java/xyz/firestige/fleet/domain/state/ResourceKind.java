package xyz.firestige.fleet.domain.state;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * 资源类型
 * <p>
 * 枚举顺序即同一服务内的执行优先级：先容器，再身份登记，最后配置
 */
public enum ResourceKind {

    CONTAINER("container", "容器", true),

    IDENTITY_REGISTRATION("identity_registration", "身份登记", false),

    CONFIGURATION_APPLIED("configuration_applied", "配置下发", true);

    /**
     * 状态文档中使用的名称
     */
    private final String wireName;

    private final String description;

    /**
     * 是否改变服务的运行负载（此类工作项完成后需要健康检查）
     */
    private final boolean workload;

    ResourceKind(String wireName, String description, boolean workload) {
        this.wireName = wireName;
        this.description = description;
        this.workload = workload;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public String getDescription() {
        return description;
    }

    public boolean isWorkload() {
        return workload;
    }

    public int priority() {
        return ordinal();
    }

    public static Optional<ResourceKind> fromWireName(String name) {
        return Arrays.stream(values())
                .filter(k -> k.wireName.equals(name))
                .findFirst();
    }
}
