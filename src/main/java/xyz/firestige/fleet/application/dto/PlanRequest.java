package xyz.firestige.fleet.application.dto;

import xyz.firestige.fleet.domain.plan.DiffOptions;

/**
 * plan / apply 的公共输入
 *
 * @param manifest  清单路径，null 时使用配置
 * @param stateFile 状态文件路径，null 时使用配置
 * @param options   --only / --skip / --force
 */
public record PlanRequest(String manifest, String stateFile, DiffOptions options) {

    public PlanRequest {
        options = options == null ? DiffOptions.none() : options;
    }

    public static PlanRequest defaults() {
        return new PlanRequest(null, null, DiffOptions.none());
    }
}
