package xyz.firestige.fleet.validation.validator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import xyz.firestige.fleet.support.TestManifests;
import xyz.firestige.fleet.validation.ValidationResult;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
@DisplayName("ProxyDomainUniquenessValidator 单元测试")
class ProxyDomainUniquenessValidatorTest {

    private final ProxyDomainUniquenessValidator validator = new ProxyDomainUniquenessValidator();

    @Test
    @DisplayName("场景 3.10: 同一服务的两个入口使用同一域名也算冲突")
    void duplicateWithinOneService() {
        String yaml = TestManifests.NETWORK + """
                services:
                  app:
                    ip: 10.0.0.5
                    hostname: app
                    interface:
                      proxy:
                        - domain: app.lab.test
                          upstream: http://10.0.0.5:80
                        - domain: App.Lab.Test
                          upstream: http://10.0.0.5:81
                          path: /api
                """;

        ValidationResult result = validator.validate(TestManifests.bindOnly(yaml));

        assertEquals(1, result.getErrors().size());
        assertEquals("DUPLICATE_DOMAIN", result.getErrors().get(0).getErrorCode());
        assertTrue(result.getErrors().get(0).getMessage().contains("app/app-0"));
    }

    @Test
    @DisplayName("场景 3.11: 不同域名通过")
    void distinctDomainsPass() {
        assertTrue(validator.validate(TestManifests.bindOnly(TestManifests.WITH_INTERFACES)).isValid());
    }
}
