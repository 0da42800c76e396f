package xyz.firestige.fleet.infrastructure.external;

import com.fasterxml.jackson.databind.JsonNode;
import xyz.firestige.fleet.config.OrchestratorProperties;

import java.util.Map;

/**
 * 以外部命令实现的身份提供方客户端
 * <p>
 * 请求：{"action": "register_application", "registration": {...}}；响应：{"client_id": "...", "client_type": "confidential"}
 */
public class CommandIdentityProviderClient extends AbstractCommandCollaborator implements IdentityProviderClient {

    public CommandIdentityProviderClient(OrchestratorProperties.Command config, ExternalCommandInvoker invoker,
                                         SecretResolver secretResolver) {
        super("identity-provider", config, invoker, secretResolver);
    }

    @Override
    public RegistrationResult registerApplication(ApplicationRegistration registration) {
        JsonNode response = call(Map.of("action", "register_application", "registration", registration));
        String clientId = response.path("client_id").asText(registration.auth().clientId());
        return new RegistrationResult(clientId, response.path("client_type").asText("confidential"));
    }
}
