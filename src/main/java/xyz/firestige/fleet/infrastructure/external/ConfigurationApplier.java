package xyz.firestige.fleet.infrastructure.external;

import java.util.Map;

/**
 * 配置应用方：把服务配置负载下发到目标主机，调用需幂等
 */
public interface ConfigurationApplier extends ExternalCollaborator {

    void apply(String service, Map<String, Object> payload);
}
