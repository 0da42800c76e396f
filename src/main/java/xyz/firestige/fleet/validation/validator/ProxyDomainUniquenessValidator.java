package xyz.firestige.fleet.validation.validator;

import xyz.firestige.fleet.domain.manifest.Manifest;
import xyz.firestige.fleet.domain.manifest.ProxyEndpoint;
import xyz.firestige.fleet.domain.manifest.ServiceSpec;
import xyz.firestige.fleet.validation.ManifestValidator;
import xyz.firestige.fleet.validation.ValidationResult;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 代理域名唯一性校验器（全清单范围，忽略大小写）
 */
public class ProxyDomainUniquenessValidator implements ManifestValidator {

    @Override
    public ValidationResult validate(Manifest manifest) {
        ValidationResult result = new ValidationResult();

        Map<String, String> owners = new HashMap<>();
        for (ServiceSpec service : manifest.getServices().values()) {
            for (ProxyEndpoint endpoint : service.serviceInterface().proxy()) {
                if (endpoint.domain() == null) {
                    continue;
                }
                String domain = endpoint.domain().toLowerCase(Locale.ROOT);
                String owner = service.name() + "/" + endpoint.name();
                String previous = owners.putIfAbsent(domain, owner);
                if (previous != null) {
                    result.addError(
                            RequiredFieldsValidator.sectionOf(service) + "." + service.name() + ".interface.proxy",
                            "代理域名 " + endpoint.domain() + " 已被 " + previous + " 使用",
                            "DUPLICATE_DOMAIN",
                            endpoint.domain());
                }
            }
        }
        return result;
    }

    @Override
    public String getValidatorName() {
        return "ProxyDomainUniquenessValidator";
    }

    @Override
    public int getOrder() {
        return 50;
    }
}
