package xyz.firestige.fleet.domain.plan;

import xyz.firestige.fleet.domain.manifest.DeploymentPhase;
import xyz.firestige.fleet.domain.state.ResourceKind;

import java.util.Comparator;
import java.util.Objects;

/**
 * 工作项：把某服务的某种资源推进到期望状态的一个单位
 *
 * @param service     服务名
 * @param kind        资源类型
 * @param action      动作
 * @param phase       所属顶层阶段
 * @param layer       服务所在依赖层
 * @param fingerprint 期望状态的指纹，成功后写入状态存储
 * @param reason      生成原因（用于 plan 输出）
 */
public record WorkItem(String service, ResourceKind kind, WorkAction action, DeploymentPhase phase,
                       int layer, String fingerprint, String reason) {

    /**
     * 计划顺序：(顶层阶段, 层, 资源优先级, 服务名)
     */
    public static final Comparator<WorkItem> EXECUTION_ORDER = Comparator
            .comparing(WorkItem::phase)
            .thenComparingInt(WorkItem::layer)
            .thenComparingInt(item -> item.kind().priority())
            .thenComparing(WorkItem::service);

    public WorkItem {
        Objects.requireNonNull(service, "service 不能为空");
        Objects.requireNonNull(kind, "kind 不能为空");
        Objects.requireNonNull(action, "action 不能为空");
        Objects.requireNonNull(phase, "phase 不能为空");
    }

    public String key() {
        return service + "/" + kind.getWireName();
    }

    public boolean executable() {
        return action != WorkAction.SKIP;
    }
}
