package xyz.firestige.fleet.validation.validator;

import xyz.firestige.fleet.domain.manifest.Manifest;
import xyz.firestige.fleet.domain.manifest.ServiceSpec;
import xyz.firestige.fleet.validation.ManifestValidator;
import xyz.firestige.fleet.validation.ValidationResult;

import java.util.List;

/**
 * 端口范围校验器：[0, 65535]
 */
public class PortRangeValidator implements ManifestValidator {

    static final int MAX_PORT = 65535;

    @Override
    public ValidationResult validate(Manifest manifest) {
        ValidationResult result = new ValidationResult();

        for (ServiceSpec service : manifest.getServices().values()) {
            String base = RequiredFieldsValidator.sectionOf(service) + "." + service.name();
            List<Integer> ports = service.ports();
            for (int i = 0; i < ports.size(); i++) {
                int port = ports.get(i);
                if (port < 0 || port > MAX_PORT) {
                    result.addError(base + ".ports[" + i + "]", "端口超出范围 [0, 65535]", "OUT_OF_RANGE", port);
                }
            }
            if (service.serviceInterface().db() != null) {
                Integer dbPort = service.serviceInterface().db().port();
                if (dbPort != null && (dbPort < 0 || dbPort > MAX_PORT)) {
                    result.addError(base + ".interface.db.port", "端口超出范围 [0, 65535]", "OUT_OF_RANGE", dbPort);
                }
            }
        }
        return result;
    }

    @Override
    public String getValidatorName() {
        return "PortRangeValidator";
    }

    @Override
    public int getOrder() {
        return 40;
    }
}
