package xyz.firestige.fleet.validation.validator;

import xyz.firestige.fleet.domain.manifest.Manifest;
import xyz.firestige.fleet.domain.manifest.ServiceSpec;
import xyz.firestige.fleet.validation.ManifestValidator;
import xyz.firestige.fleet.validation.ValidationResult;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * 地址冲突校验器
 * <p>
 * 启用的服务之间 IP、主机名、vmid 不能重复；vmid 必须为正数
 */
public class AddressConflictValidator implements ManifestValidator {

    @Override
    public ValidationResult validate(Manifest manifest) {
        ValidationResult result = new ValidationResult();

        checkUnique(manifest, result, "ip", ServiceSpec::ip, "DUPLICATE_IP");
        checkUnique(manifest, result, "hostname",
                s -> s.hostname() == null ? null : s.hostname().toLowerCase(Locale.ROOT), "DUPLICATE_HOSTNAME");
        checkUnique(manifest, result, "vmid",
                s -> s.vmid() == null ? null : String.valueOf(s.vmid()), "DUPLICATE_VMID");

        for (ServiceSpec service : manifest.getServices().values()) {
            if (service.vmid() != null && service.vmid() <= 0) {
                result.addError(RequiredFieldsValidator.sectionOf(service) + "." + service.name() + ".vmid",
                        "vmid 必须为正整数", "OUT_OF_RANGE", service.vmid());
            }
        }
        return result;
    }

    private static void checkUnique(Manifest manifest, ValidationResult result, String field,
                                    Function<ServiceSpec, String> extractor, String code) {
        Map<String, String> owners = new HashMap<>();
        for (ServiceSpec service : manifest.enabledServices()) {
            String value = extractor.apply(service);
            if (value == null || value.isBlank()) {
                continue;
            }
            String previous = owners.putIfAbsent(value, service.name());
            if (previous != null) {
                result.addError(RequiredFieldsValidator.sectionOf(service) + "." + service.name() + "." + field,
                        field + " 与服务 " + previous + " 重复: " + value, code, value);
            }
        }
    }

    @Override
    public String getValidatorName() {
        return "AddressConflictValidator";
    }

    @Override
    public int getOrder() {
        return 60;
    }
}
