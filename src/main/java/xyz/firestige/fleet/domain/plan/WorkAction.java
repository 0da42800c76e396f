package xyz.firestige.fleet.domain.plan;

/**
 * 工作项动作
 */
public enum WorkAction {

    CREATE("create", "新建"),

    UPDATE("update", "更新"),

    /**
     * 运维显式跳过，不执行
     */
    SKIP("skip", "跳过");

    private final String value;
    private final String description;

    WorkAction(String value, String description) {
        this.value = value;
        this.description = description;
    }

    public String getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }
}
