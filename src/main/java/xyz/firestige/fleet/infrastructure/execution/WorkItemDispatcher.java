package xyz.firestige.fleet.infrastructure.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.fleet.domain.manifest.Manifest;
import xyz.firestige.fleet.domain.manifest.ProxyEndpoint;
import xyz.firestige.fleet.domain.manifest.ServiceInterface;
import xyz.firestige.fleet.domain.manifest.ServiceSpec;
import xyz.firestige.fleet.domain.plan.DeploymentPlan;
import xyz.firestige.fleet.domain.state.ResourceKind;
import xyz.firestige.fleet.domain.plan.WorkItem;
import xyz.firestige.fleet.exception.FatalApplyException;
import xyz.firestige.fleet.infrastructure.external.ApplicationRegistration;
import xyz.firestige.fleet.infrastructure.external.ConfigurationApplier;
import xyz.firestige.fleet.infrastructure.external.ContainerSpec;
import xyz.firestige.fleet.infrastructure.external.ExternalCollaborator;
import xyz.firestige.fleet.infrastructure.external.IdentityProviderClient;
import xyz.firestige.fleet.infrastructure.external.ProvisionResult;
import xyz.firestige.fleet.infrastructure.external.ProvisioningBackend;
import xyz.firestige.fleet.infrastructure.external.RegistrationResult;
import xyz.firestige.fleet.infrastructure.external.SecretResolver;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 工作项分发器
 * <p>
 * 职责：
 * 1. 按资源类型把工作项交给对应的外部协作方
 * 2. 执行前预检：计划用到的协作方必须已配置，且凭据可解析
 */
public class WorkItemDispatcher {

    private static final Logger log = LoggerFactory.getLogger(WorkItemDispatcher.class);

    private final ProvisioningBackend provisioningBackend;
    private final IdentityProviderClient identityProviderClient;
    private final ConfigurationApplier configurationApplier;
    private final SecretResolver secretResolver;

    public WorkItemDispatcher(ProvisioningBackend provisioningBackend,
                              IdentityProviderClient identityProviderClient,
                              ConfigurationApplier configurationApplier,
                              SecretResolver secretResolver) {
        this.provisioningBackend = provisioningBackend;
        this.identityProviderClient = identityProviderClient;
        this.configurationApplier = configurationApplier;
        this.secretResolver = secretResolver;
    }

    /**
     * 预检，失败时抛出 {@link FatalApplyException}，不产生任何副作用
     */
    public void preflight(DeploymentPlan plan) {
        List<String> problems = new ArrayList<>();
        for (ResourceKind kind : plan.executableKinds()) {
            ExternalCollaborator collaborator = collaboratorFor(kind);
            if (!collaborator.isConfigured()) {
                problems.add("协作方 " + collaborator.getName() + " 未配置（" + kind.getWireName() + " 需要）");
                continue;
            }
            for (String reference : collaborator.credentialReferences()) {
                if (!secretResolver.canResolve(reference)) {
                    // 只输出引用，不输出内容
                    problems.add("协作方 " + collaborator.getName() + " 的凭据无法解析: " + reference);
                }
            }
        }
        if (!problems.isEmpty()) {
            problems.forEach(p -> log.error("预检失败: {}", p));
            throw new FatalApplyException("预检失败: " + String.join("; ", problems));
        }
        log.info("预检通过: {}", plan.executableKinds());
    }

    public void dispatch(WorkItem item, Manifest manifest) {
        ServiceSpec service = manifest.getService(item.service());
        switch (item.kind()) {
            case CONTAINER -> {
                ProvisionResult result = provisioningBackend.createOrUpdate(ContainerSpec.from(manifest, service));
                log.info("容器已就绪: {}, vmid={}, addresses={}", service.name(), result.vmid(), result.addresses());
            }
            case IDENTITY_REGISTRATION -> {
                RegistrationResult result = identityProviderClient.registerApplication(registrationOf(service));
                log.info("身份登记完成: {}, clientId={}, clientType={}", service.name(), result.clientId(), result.clientType());
            }
            case CONFIGURATION_APPLIED -> {
                configurationApplier.apply(service.name(), configurationPayload(service));
                log.info("配置已下发: {}", service.name());
            }
        }
    }

    ExternalCollaborator collaboratorFor(ResourceKind kind) {
        return switch (kind) {
            case CONTAINER -> provisioningBackend;
            case IDENTITY_REGISTRATION -> identityProviderClient;
            case CONFIGURATION_APPLIED -> configurationApplier;
        };
    }

    static ApplicationRegistration registrationOf(ServiceSpec service) {
        ServiceInterface facets = service.serviceInterface();
        List<String> domains = facets.proxy().stream()
                .map(ProxyEndpoint::domain)
                .distinct()
                .collect(Collectors.toList());
        return new ApplicationRegistration(service.name(), facets.auth(), domains);
    }

    /**
     * 配置负载：config / db / proxy / health，缺省的接口面不出现
     */
    static Map<String, Object> configurationPayload(ServiceSpec service) {
        ServiceInterface facets = service.serviceInterface();
        Map<String, Object> payload = new LinkedHashMap<>();
        if (facets.config() != null && !facets.config().isEmpty()) {
            payload.put("config", facets.config());
        }
        if (facets.db() != null) {
            payload.put("db", facets.db());
        }
        if (!facets.proxy().isEmpty()) {
            payload.put("proxy", facets.proxy());
        }
        if (facets.health() != null) {
            payload.put("health", facets.health());
        }
        return payload;
    }
}
