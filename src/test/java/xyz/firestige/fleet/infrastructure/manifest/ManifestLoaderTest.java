package xyz.firestige.fleet.infrastructure.manifest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.firestige.fleet.domain.manifest.AuthType;
import xyz.firestige.fleet.domain.manifest.DeploymentPhase;
import xyz.firestige.fleet.domain.manifest.HealthFacet;
import xyz.firestige.fleet.domain.manifest.Manifest;
import xyz.firestige.fleet.domain.manifest.ProxyEndpoint;
import xyz.firestige.fleet.domain.manifest.RestartPolicy;
import xyz.firestige.fleet.domain.manifest.ServiceSpec;
import xyz.firestige.fleet.domain.state.ResourceKind;
import xyz.firestige.fleet.exception.ManifestValidationException;
import xyz.firestige.fleet.support.TestManifests;
import xyz.firestige.fleet.validation.ValidationError;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 清单加载与绑定测试
 */
@Tag("unit")
@DisplayName("ManifestLoader 单元测试")
class ManifestLoaderTest {

    private final ManifestLoader loader = TestManifests.loader();

    @Test
    @DisplayName("场景 1.1: 合法清单绑定为领域模型，核心服务与应用服务合并")
    void loadsValidManifest() {
        Manifest manifest = loader.parse(TestManifests.WITH_INTERFACES, false);

        assertEquals("lab.test", manifest.getNetwork().domain());
        assertEquals(Set.of("postgresql", "grafana", "wiki"), Set.copyOf(manifest.serviceNames()));

        ServiceSpec postgresql = manifest.getService("postgresql");
        assertTrue(postgresql.core());
        assertTrue(postgresql.enabled());
        assertEquals(RestartPolicy.UNLESS_STOPPED, postgresql.restartPolicy());
        assertEquals(List.of(ResourceKind.CONTAINER, ResourceKind.CONFIGURATION_APPLIED), postgresql.requiredKinds());

        ServiceSpec grafana = manifest.getService("grafana");
        assertFalse(grafana.core());
        assertEquals(Set.of("postgresql"), grafana.dependsOn());
        assertEquals(List.of(ResourceKind.CONTAINER, ResourceKind.IDENTITY_REGISTRATION, ResourceKind.CONFIGURATION_APPLIED),
                grafana.requiredKinds());

        assertEquals(List.of(ResourceKind.CONTAINER), manifest.getService("wiki").requiredKinds());
    }

    @Test
    @DisplayName("场景 1.2: 所有违规一次性收集，并带出错路径")
    void collectsAllViolationsWithPaths() {
        // Given: 端口类型错误、端口越界、缺少 ip、代理域名重复、依赖不存在
        String yaml = TestManifests.NETWORK + """
                services:
                  guacamole:
                    hostname: guacamole
                    ports: [8080, "abc", 70000]
                    depends_on: [ghost]
                    interface:
                      proxy:
                        domain: remote.lab.test
                        upstream: http://10.0.0.30:8080
                  wiki:
                    ip: 10.0.0.31
                    hostname: wiki
                    interface:
                      proxy:
                        domain: REMOTE.lab.test
                        upstream: http://10.0.0.31:3000
                """;

        // When
        ManifestValidationException e = assertThrows(ManifestValidationException.class, () -> loader.parse(yaml, false));

        // Then
        Set<String> fields = e.getErrors().stream().map(ValidationError::getField).collect(Collectors.toSet());
        assertTrue(fields.contains("services.guacamole.ports[1]"), fields.toString());
        assertTrue(fields.contains("services.guacamole.ip"), fields.toString());
        assertTrue(fields.contains("services.guacamole.depends_on"), fields.toString());
        assertTrue(fields.contains("services.wiki.interface.proxy"), fields.toString());
        assertTrue(e.getErrors().stream().anyMatch(err -> "OUT_OF_RANGE".equals(err.getErrorCode())), "越界端口应报错");
        assertTrue(e.getErrors().size() >= 5, "应收集全部违规，实际: " + e.getErrors());
    }

    @Test
    @DisplayName("场景 1.3: 依赖成环报 CYCLE_ERROR 并给出环路径")
    void rejectsDependencyCycle() {
        String yaml = TestManifests.NETWORK + """
                services:
                  a:
                    ip: 10.0.0.1
                    hostname: a
                    depends_on: [b]
                  b:
                    ip: 10.0.0.2
                    hostname: b
                    depends_on: [a]
                """;

        ManifestValidationException e = assertThrows(ManifestValidationException.class, () -> loader.parse(yaml, false));

        ValidationError cycle = e.getErrors().stream()
                .filter(err -> "CYCLE_ERROR".equals(err.getErrorCode()))
                .findFirst()
                .orElseThrow();
        assertTrue(cycle.getMessage().contains("a -> b -> a"), cycle.getMessage());
    }

    @Test
    @DisplayName("场景 1.4: 同名服务不能同时出现在 core_services 和 services")
    void rejectsDuplicateServiceAcrossSections() {
        String yaml = TestManifests.NETWORK + """
                core_services:
                  postgresql:
                    ip: 10.0.0.10
                    hostname: postgresql
                services:
                  postgresql:
                    ip: 10.0.0.11
                    hostname: postgresql2
                """;

        ManifestValidationException e = assertThrows(ManifestValidationException.class, () -> loader.parse(yaml, false));

        assertTrue(e.getErrors().stream().anyMatch(err -> "DUPLICATE_SERVICE".equals(err.getErrorCode())));
    }

    @Test
    @DisplayName("场景 1.5: 依赖未启用的服务是错误，未启用的服务不参与地址冲突检查")
    void disabledServices() {
        String yaml = TestManifests.NETWORK + """
                services:
                  old:
                    enable: false
                    ip: 10.0.0.10
                    hostname: app
                  app:
                    ip: 10.0.0.10
                    hostname: app
                  consumer:
                    ip: 10.0.0.12
                    hostname: consumer
                    depends_on: [old]
                """;

        ManifestValidationException e = assertThrows(ManifestValidationException.class, () -> loader.parse(yaml, false));

        List<String> codes = e.getErrors().stream().map(ValidationError::getErrorCode).collect(Collectors.toList());
        assertTrue(codes.contains("DISABLED_DEPENDENCY"), codes.toString());
        assertFalse(codes.contains("DUPLICATE_IP"), codes.toString());
        assertFalse(codes.contains("DUPLICATE_HOSTNAME"), codes.toString());
    }

    @Test
    @DisplayName("场景 1.6: 核心服务不能依赖应用服务，阶段中的服务必须已声明")
    void phaseAssignmentRules() {
        String yaml = TestManifests.NETWORK + """
                core_services:
                  postgresql:
                    ip: 10.0.0.10
                    hostname: postgresql
                    depends_on: [grafana]
                services:
                  grafana:
                    ip: 10.0.0.20
                    hostname: grafana
                deployment_phases:
                  tf_infra: [postgresql, nonexistent]
                """;

        ManifestValidationException e = assertThrows(ManifestValidationException.class, () -> loader.parse(yaml, false));

        List<String> codes = e.getErrors().stream().map(ValidationError::getErrorCode).collect(Collectors.toList());
        assertTrue(codes.contains("UNKNOWN_SERVICE"), codes.toString());
        assertTrue(codes.contains("CORE_DEPENDS_ON_APPLICATION"), codes.toString());
    }

    @Test
    @DisplayName("场景 1.7: proxy 支持单个、列表和具名映射三种写法，统一为列表")
    void normalizesProxyForms() {
        String yaml = TestManifests.NETWORK + """
                services:
                  single:
                    ip: 10.0.0.1
                    hostname: single
                    interface:
                      proxy:
                        domain: single.lab.test
                        upstream: http://10.0.0.1
                  listed:
                    ip: 10.0.0.2
                    hostname: listed
                    interface:
                      proxy:
                        - domain: a.lab.test
                          upstream: http://10.0.0.2:1
                        - name: admin
                          domain: b.lab.test
                          upstream: http://10.0.0.2:2
                          path: /admin
                  named:
                    ip: 10.0.0.3
                    hostname: named
                    interface:
                      proxy:
                        web:
                          domain: web.lab.test
                          upstream: http://10.0.0.3:80
                          tls: false
                        api:
                          domain: api.lab.test
                          upstream: http://10.0.0.3:81
                          authz: false
                """;

        Manifest manifest = loader.parse(yaml, false);

        List<ProxyEndpoint> single = manifest.getService("single").serviceInterface().proxy();
        assertEquals(1, single.size());
        assertEquals("single", single.get(0).name());
        assertEquals("/", single.get(0).path());
        assertTrue(single.get(0).tls());
        assertTrue(single.get(0).authRequired());

        List<ProxyEndpoint> listed = manifest.getService("listed").serviceInterface().proxy();
        assertEquals(List.of("listed-0", "admin"), listed.stream().map(ProxyEndpoint::name).collect(Collectors.toList()));
        assertEquals("/admin", listed.get(1).path());

        List<ProxyEndpoint> named = manifest.getService("named").serviceInterface().proxy();
        assertEquals(List.of("web", "api"), named.stream().map(ProxyEndpoint::name).collect(Collectors.toList()));
        assertFalse(named.get(0).tls());
        assertFalse(named.get(1).authRequired());
    }

    @Test
    @DisplayName("场景 1.8: 认证默认值与 oidc 嵌套写法")
    void authDefaultsAndNestedOidc() {
        String yaml = TestManifests.NETWORK + """
                services:
                  nextcloud:
                    ip: 10.0.0.5
                    hostname: nextcloud
                    interface:
                      auth:
                        type: oidc
                        oidc:
                          client_id: nextcloud
                          redirect_uris: [https://cloud.lab.test/callback]
                """;

        var auth = loader.parse(yaml, false).getService("nextcloud").serviceInterface().auth();

        assertEquals(AuthType.OIDC, auth.type());
        assertEquals("authentik", auth.provider());
        assertEquals("nextcloud", auth.clientId());
        assertEquals(List.of("https://cloud.lab.test/callback"), auth.redirectUris());
        assertEquals(List.of("openid", "email", "profile"), auth.scopes());
        assertEquals("preferred_username", auth.usernameClaim());
        assertEquals("groups", auth.groupsClaim());
        assertTrue(auth.requiresRegistration());
    }

    @Test
    @DisplayName("场景 1.9: 资源容量单位换算，健康检查超时继承清单默认值")
    void resourcesAndHealthDefaults() {
        String yaml = TestManifests.NETWORK + """
                orchestration:
                  health_check_timeout: 90
                  retry_attempts: 5
                services:
                  media:
                    ip: 10.0.0.6
                    hostname: media
                    resources:
                      cpu: 4
                      memory: 2G
                      storage: 512G
                    interface:
                      health:
                        liveness: curl -fs http://localhost:8096/health
                """;

        Manifest manifest = loader.parse(yaml, false);
        ServiceSpec media = manifest.getService("media");

        assertEquals(4, media.resources().cores());
        assertEquals(2048, media.resources().memoryMb());
        assertEquals(512, media.resources().diskGb());
        HealthFacet health = media.serviceInterface().health();
        assertEquals(90, health.timeoutSeconds());
        assertEquals(30, health.intervalSeconds());
        assertEquals(3, health.retries());
        assertEquals(5, manifest.getDefaults().retryAttempts());
    }

    @Test
    @DisplayName("场景 1.10: 旧格式 health_check 字段仍被接受")
    void acceptsLegacyHealthCheck() {
        String yaml = TestManifests.NETWORK + """
                services:
                  dns:
                    ip: 10.0.0.53
                    hostname: dns
                    health_check: dig @127.0.0.1 lab.test
                """;

        ServiceSpec dns = loader.parse(yaml, false).getService("dns");

        assertNotNull(dns.serviceInterface().health());
        assertEquals("dig @127.0.0.1 lab.test", dns.serviceInterface().health().liveness());
    }

    @Test
    @DisplayName("场景 1.11: 按扩展名读取 JSON 清单，阶段分配绑定到固定阶段")
    void loadsJsonFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("manifest.json");
        Files.writeString(file, """
                {
                  "network": {"domain": "lab.test", "gateway": "10.0.0.1", "network_cidr": "10.0.0.0/24", "dns_server": "10.0.0.53"},
                  "services": {"wiki": {"ip": "10.0.0.7", "hostname": "wiki"}},
                  "deployment_phases": {"tf_infra": ["wiki"]}
                }
                """);

        Manifest manifest = loader.load(file);

        assertEquals(List.of("wiki"), manifest.getPhaseAssignments().servicesFor(DeploymentPhase.INFRASTRUCTURE));
    }

    @Test
    @DisplayName("场景 1.12: 语法错误与文件缺失")
    void syntaxAndIoErrors(@TempDir Path dir) {
        ManifestValidationException syntax = assertThrows(ManifestValidationException.class,
                () -> loader.parse("network: [unclosed", false));
        assertEquals("SYNTAX_ERROR", syntax.getErrors().get(0).getErrorCode());

        ManifestValidationException io = assertThrows(ManifestValidationException.class,
                () -> loader.load(dir.resolve("missing.yaml")));
        assertEquals("IO_ERROR", io.getErrors().get(0).getErrorCode());
    }
}
