package xyz.firestige.fleet.infrastructure.external;

import java.util.List;

/**
 * 供应结果
 *
 * @param vmid      后端分配或确认的标识
 * @param addresses 容器地址
 */
public record ProvisionResult(Integer vmid, List<String> addresses) {
}
