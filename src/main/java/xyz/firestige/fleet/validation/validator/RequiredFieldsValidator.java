package xyz.firestige.fleet.validation.validator;

import xyz.firestige.fleet.domain.manifest.HealthFacet;
import xyz.firestige.fleet.domain.manifest.Manifest;
import xyz.firestige.fleet.domain.manifest.NetworkSpec;
import xyz.firestige.fleet.domain.manifest.ProxyEndpoint;
import xyz.firestige.fleet.domain.manifest.ServiceInterface;
import xyz.firestige.fleet.domain.manifest.ServiceSpec;
import xyz.firestige.fleet.validation.ManifestValidator;
import xyz.firestige.fleet.validation.ValidationResult;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 必填字段校验器
 */
public class RequiredFieldsValidator implements ManifestValidator {

    private static final String CODE = "REQUIRED";

    @Override
    public ValidationResult validate(Manifest manifest) {
        ValidationResult result = new ValidationResult();

        NetworkSpec network = manifest.getNetwork();
        if (network == null) {
            result.addError("network", "缺少 network 段", CODE, null);
        } else {
            require(result, network.domain(), "network.domain");
            require(result, network.gateway(), "network.gateway");
            require(result, network.networkCidr(), "network.network_cidr");
            require(result, network.dnsServer(), "network.dns_server");
        }

        if (manifest.getServices().isEmpty()) {
            result.addError("services", "清单中没有任何服务", CODE, null);
        }

        // 按清单段落报告：先 core_services，再 services，段内按名称
        List<ServiceSpec> ordered = manifest.getServices().values().stream()
                .sorted(Comparator.comparing((ServiceSpec s) -> !s.core()))
                .collect(Collectors.toList());
        for (ServiceSpec service : ordered) {
            String base = sectionOf(service) + "." + service.name();
            require(result, service.ip(), base + ".ip");
            require(result, service.hostname(), base + ".hostname");

            ServiceInterface iface = service.serviceInterface();
            List<ProxyEndpoint> proxy = iface.proxy();
            for (ProxyEndpoint endpoint : proxy) {
                String ep = base + ".interface.proxy" + (proxy.size() == 1 ? "" : "." + endpoint.name());
                require(result, endpoint.domain(), ep + ".domain");
                require(result, endpoint.upstream(), ep + ".upstream");
            }
            if (iface.auth() != null && iface.auth().type() == null) {
                require(result, null, base + ".interface.auth.type");
            }
            HealthFacet health = iface.health();
            if (health != null) {
                require(result, health.liveness(), base + ".interface.health.liveness");
            }
        }
        return result;
    }

    static String sectionOf(ServiceSpec service) {
        return service.core() ? "core_services" : "services";
    }

    private static void require(ValidationResult result, String value, String field) {
        if (value == null || value.isBlank()) {
            result.addError(field, "必填字段缺失", CODE, value);
        }
    }

    @Override
    public String getValidatorName() {
        return "RequiredFieldsValidator";
    }

    @Override
    public int getOrder() {
        return 10;
    }
}
