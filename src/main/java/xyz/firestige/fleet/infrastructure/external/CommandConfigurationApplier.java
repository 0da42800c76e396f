package xyz.firestige.fleet.infrastructure.external;

import xyz.firestige.fleet.config.OrchestratorProperties;

import java.util.Map;

/**
 * 以外部命令实现的配置应用方
 * <p>
 * 请求：{"action": "apply", "service": "...", "payload": {...}}
 */
public class CommandConfigurationApplier extends AbstractCommandCollaborator implements ConfigurationApplier {

    public CommandConfigurationApplier(OrchestratorProperties.Command config, ExternalCommandInvoker invoker,
                                       SecretResolver secretResolver) {
        super("configuration", config, invoker, secretResolver);
    }

    @Override
    public void apply(String service, Map<String, Object> payload) {
        call(Map.of("action", "apply", "service", service, "payload", payload));
    }
}
