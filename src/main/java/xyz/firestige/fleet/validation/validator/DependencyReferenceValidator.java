package xyz.firestige.fleet.validation.validator;

import xyz.firestige.fleet.domain.manifest.Manifest;
import xyz.firestige.fleet.domain.manifest.ServiceSpec;
import xyz.firestige.fleet.validation.ManifestValidator;
import xyz.firestige.fleet.validation.ValidationResult;

import java.util.Optional;

/**
 * 依赖引用校验器
 * <p>
 * depends_on 中的每个名字都必须是清单中声明的服务；启用的服务不能依赖未启用的服务
 */
public class DependencyReferenceValidator implements ManifestValidator {

    @Override
    public ValidationResult validate(Manifest manifest) {
        ValidationResult result = new ValidationResult();

        for (ServiceSpec service : manifest.getServices().values()) {
            String field = RequiredFieldsValidator.sectionOf(service) + "." + service.name() + ".depends_on";
            for (String dep : service.dependsOn()) {
                Optional<ServiceSpec> target = manifest.findService(dep);
                if (target.isEmpty()) {
                    result.addError(field, "依赖的服务不存在: " + dep, "MISSING_DEPENDENCY", dep);
                } else if (service.enabled() && !target.get().enabled()) {
                    result.addError(field, "依赖的服务未启用: " + dep, "DISABLED_DEPENDENCY", dep);
                }
            }
        }
        return result;
    }

    @Override
    public String getValidatorName() {
        return "DependencyReferenceValidator";
    }

    @Override
    public int getOrder() {
        return 20;
    }
}
