package xyz.firestige.fleet.application.dto;

/**
 * 记录与当前清单的一致性
 */
public enum SyncState {

    IN_SYNC("一致"),

    DRIFTED("待更新"),

    /**
     * 清单要求但尚无记录
     */
    PENDING("未部署"),

    /**
     * 有记录但服务已移除、停用或不再需要该资源
     */
    ORPHANED("孤立"),

    /**
     * 清单不可用，无法比较
     */
    UNKNOWN("未知");

    private final String description;

    SyncState(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
