package xyz.firestige.fleet.infrastructure.external;

import com.fasterxml.jackson.databind.JsonNode;
import xyz.firestige.fleet.config.OrchestratorProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 以外部命令实现的供应后端
 * <p>
 * 请求：{"action": "create_or_update", "container": {...}}；响应：{"vmid": 100, "addresses": ["..."]}
 */
public class CommandProvisioningBackend extends AbstractCommandCollaborator implements ProvisioningBackend {

    public CommandProvisioningBackend(OrchestratorProperties.Command config, ExternalCommandInvoker invoker,
                                      SecretResolver secretResolver) {
        super("provisioning", config, invoker, secretResolver);
    }

    @Override
    public ProvisionResult createOrUpdate(ContainerSpec spec) {
        JsonNode response = call(Map.of("action", "create_or_update", "container", spec));
        Integer vmid = response.hasNonNull("vmid") ? response.get("vmid").asInt() : spec.vmid();
        List<String> addresses = new ArrayList<>();
        response.path("addresses").forEach(a -> addresses.add(a.asText()));
        if (addresses.isEmpty() && spec.ip() != null) {
            addresses.add(spec.ip());
        }
        return new ProvisionResult(vmid, addresses);
    }
}
