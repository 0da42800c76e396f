package xyz.firestige.fleet.infrastructure.external;

import com.fasterxml.jackson.databind.JsonNode;
import xyz.firestige.fleet.config.OrchestratorProperties;
import xyz.firestige.fleet.exception.FatalApplyException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 以外部命令实现的协作方基类
 * <p>
 * 凭据在每次调用前即时解析，作为子进程环境变量传入
 */
public abstract class AbstractCommandCollaborator implements ExternalCollaborator {

    private final String name;
    private final OrchestratorProperties.Command config;
    private final ExternalCommandInvoker invoker;
    private final SecretResolver secretResolver;

    protected AbstractCommandCollaborator(String name, OrchestratorProperties.Command config,
                                          ExternalCommandInvoker invoker, SecretResolver secretResolver) {
        this.name = name;
        this.config = config;
        this.invoker = invoker;
        this.secretResolver = secretResolver;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isConfigured() {
        return config.isConfigured();
    }

    @Override
    public Collection<String> credentialReferences() {
        return config.getCredentials().values();
    }

    protected JsonNode call(Object request) {
        if (!isConfigured()) {
            throw new FatalApplyException("协作方未配置: " + name);
        }
        Map<String, String> env = new LinkedHashMap<>();
        config.getCredentials().forEach((variable, reference) -> env.put(variable, secretResolver.resolve(reference)));
        return invoker.invoke(name, config.getCommand(), request, env, config.getTimeout());
    }
}
