package xyz.firestige.fleet.application.dto;

import xyz.firestige.fleet.domain.state.ResourceKind;

import java.time.Instant;

/**
 * status 输出的一行：某服务的某种资源
 *
 * @param fingerprint 已记录的指纹，未部署时为 null
 * @param updatedAt   记录时间，未部署时为 null
 */
public record StatusEntry(String service, ResourceKind kind, String fingerprint, Instant updatedAt, SyncState sync) {
}
