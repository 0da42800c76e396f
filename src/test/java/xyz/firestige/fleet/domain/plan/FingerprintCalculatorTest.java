package xyz.firestige.fleet.domain.plan;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import xyz.firestige.fleet.domain.manifest.Manifest;
import xyz.firestige.fleet.domain.state.ResourceKind;
import xyz.firestige.fleet.support.TestManifests;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
@DisplayName("FingerprintCalculator 单元测试")
class FingerprintCalculatorTest {

    private final FingerprintCalculator calculator = new FingerprintCalculator();

    @Test
    @DisplayName("场景 5.1: 指纹格式为 sha256: 加 64 位十六进制，相同输入结果稳定")
    void stableFormat() {
        Manifest manifest = TestManifests.parse(TestManifests.WITH_INTERFACES);

        String first = calculator.fingerprint(manifest, manifest.getService("grafana"), ResourceKind.CONTAINER);
        String second = calculator.fingerprint(TestManifests.parse(TestManifests.WITH_INTERFACES),
                manifest.getService("grafana"), ResourceKind.CONTAINER);

        assertTrue(first.matches("sha256:[0-9a-f]{64}"), first);
        assertEquals(first, second);
    }

    @Test
    @DisplayName("场景 5.2: 配置负载的键顺序不影响指纹")
    void keyOrderInsensitive() {
        String a = service("""
                    interface:
                      config:
                        theme: dark
                        locale: zh
                """);
        String b = service("""
                    interface:
                      config:
                        locale: zh
                        theme: dark
                """);

        assertEquals(fp(a, ResourceKind.CONFIGURATION_APPLIED), fp(b, ResourceKind.CONFIGURATION_APPLIED));
    }

    @Test
    @DisplayName("场景 5.3: 接口字段只影响所属资源类型的指纹")
    void fragmentsAreIsolated() {
        String base = service("""
                    interface:
                      auth:
                        type: oidc
                      config:
                        theme: dark
                """);
        String configChanged = service("""
                    interface:
                      auth:
                        type: oidc
                      config:
                        theme: light
                """);
        String authChanged = service("""
                    interface:
                      auth:
                        type: oidc
                        scopes: [openid]
                      config:
                        theme: dark
                """);

        assertEquals(fp(base, ResourceKind.CONTAINER), fp(configChanged, ResourceKind.CONTAINER));
        assertEquals(fp(base, ResourceKind.IDENTITY_REGISTRATION), fp(configChanged, ResourceKind.IDENTITY_REGISTRATION));
        assertNotEquals(fp(base, ResourceKind.CONFIGURATION_APPLIED), fp(configChanged, ResourceKind.CONFIGURATION_APPLIED));

        assertNotEquals(fp(base, ResourceKind.IDENTITY_REGISTRATION), fp(authChanged, ResourceKind.IDENTITY_REGISTRATION));
        assertEquals(fp(base, ResourceKind.CONFIGURATION_APPLIED), fp(authChanged, ResourceKind.CONFIGURATION_APPLIED));
    }

    @Test
    @DisplayName("场景 5.4: 资源规格和网络变化影响容器指纹")
    void containerSensitivity() {
        String base = service("""
                    resources:
                      memory: 1024
                """);
        String resized = service("""
                    resources:
                      memory: 2G
                """);

        assertNotEquals(fp(base, ResourceKind.CONTAINER), fp(resized, ResourceKind.CONTAINER));
        assertNotEquals(fp(base, ResourceKind.CONTAINER),
                fp(base.replace("gateway: 10.0.0.1", "gateway: 10.0.0.254"), ResourceKind.CONTAINER));
    }

    private static String service(String extra) {
        return TestManifests.NETWORK + """
                services:
                  app:
                    ip: 10.0.0.5
                    hostname: app
                """ + extra;
    }

    private String fp(String yaml, ResourceKind kind) {
        Manifest manifest = TestManifests.parse(yaml);
        return calculator.fingerprint(manifest, manifest.getService("app"), kind);
    }
}
