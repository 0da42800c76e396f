package xyz.firestige.fleet.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import xyz.firestige.fleet.domain.manifest.Manifest;
import xyz.firestige.fleet.infrastructure.manifest.ManifestBinder;
import xyz.firestige.fleet.infrastructure.manifest.ManifestLoader;
import xyz.firestige.fleet.validation.ValidationChain;
import xyz.firestige.fleet.validation.validator.AddressConflictValidator;
import xyz.firestige.fleet.validation.validator.DependencyCycleValidator;
import xyz.firestige.fleet.validation.validator.DependencyReferenceValidator;
import xyz.firestige.fleet.validation.validator.PhaseAssignmentValidator;
import xyz.firestige.fleet.validation.validator.PortRangeValidator;
import xyz.firestige.fleet.validation.validator.ProxyDomainUniquenessValidator;
import xyz.firestige.fleet.validation.validator.RequiredFieldsValidator;

import java.util.List;

/**
 * 测试清单工厂
 */
public final class TestManifests {

    public static final String NETWORK = """
            network:
              domain: lab.test
              gateway: 10.0.0.1
              network_cidr: 10.0.0.0/24
              dns_server: 10.0.0.53
            """;

    /**
     * 3 个无依赖的核心服务 + 2 个依赖全部核心服务的应用服务，均无接口面（每个服务只有 container）
     */
    public static final String FRESH_DEPLOY = NETWORK + """
            core_services:
              postgresql:
                ip: 10.0.0.10
                hostname: postgresql
              caddy:
                ip: 10.0.0.11
                hostname: caddy
              authentik:
                ip: 10.0.0.12
                hostname: authentik
            services:
              grafana:
                ip: 10.0.0.20
                hostname: grafana
                depends_on: [postgresql, caddy, authentik]
              vaultwarden:
                ip: 10.0.0.21
                hostname: vaultwarden
                depends_on: [postgresql, caddy, authentik]
            """;

    /**
     * 带接口面的清单：postgresql 有健康检查，grafana 有代理、认证、配置
     */
    public static final String WITH_INTERFACES = NETWORK + """
            core_services:
              postgresql:
                ip: 10.0.0.10
                hostname: postgresql
                interface:
                  health:
                    liveness: pg_isready
                    interval: 0
                    timeout: 5
                    retries: 2
            services:
              grafana:
                ip: 10.0.0.20
                hostname: grafana
                depends_on: [postgresql]
                interface:
                  db:
                    database: grafana
                    role: grafana
                  proxy:
                    domain: grafana.lab.test
                    upstream: http://10.0.0.20:3000
                  auth:
                    type: oidc
                    redirect_uris: [https://grafana.lab.test/login]
                  config:
                    theme: dark
              wiki:
                ip: 10.0.0.21
                hostname: wiki
            """;

    private TestManifests() {
    }

    public static ManifestLoader loader() {
        ValidationChain chain = new ValidationChain(false);
        chain.addValidators(List.of(
                new RequiredFieldsValidator(),
                new DependencyReferenceValidator(),
                new DependencyCycleValidator(),
                new PortRangeValidator(),
                new ProxyDomainUniquenessValidator(),
                new AddressConflictValidator(),
                new PhaseAssignmentValidator()));
        return new ManifestLoader(new ManifestBinder(new ObjectMapper(), 30, 300, 3), chain);
    }

    public static Manifest parse(String yaml) {
        return loader().parse(yaml, false);
    }

    /**
     * 只做绑定不做语义校验，用于单独测试某个校验器
     */
    public static Manifest bindOnly(String yaml) {
        try {
            return new ManifestBinder(new ObjectMapper(), 30, 300, 3)
                    .bind(new ObjectMapper(new YAMLFactory()).readTree(yaml))
                    .manifest();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }
}
