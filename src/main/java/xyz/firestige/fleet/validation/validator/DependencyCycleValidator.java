package xyz.firestige.fleet.validation.validator;

import xyz.firestige.fleet.domain.graph.CycleDetector;
import xyz.firestige.fleet.domain.manifest.Manifest;
import xyz.firestige.fleet.domain.manifest.ServiceSpec;
import xyz.firestige.fleet.exception.ErrorType;
import xyz.firestige.fleet.validation.ManifestValidator;
import xyz.firestige.fleet.validation.ValidationResult;

import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;

/**
 * 依赖环校验器，错误码 CYCLE_ERROR，消息中给出环路径
 */
public class DependencyCycleValidator implements ManifestValidator {

    @Override
    public ValidationResult validate(Manifest manifest) {
        ValidationResult result = new ValidationResult();

        Map<String, SortedSet<String>> edges = new TreeMap<>();
        for (ServiceSpec service : manifest.getServices().values()) {
            edges.put(service.name(), service.dependsOn());
        }
        CycleDetector.findCycle(edges).ifPresent(cycle -> {
            ServiceSpec first = manifest.getService(cycle.get(0));
            result.addError(
                    RequiredFieldsValidator.sectionOf(first) + "." + first.name() + ".depends_on",
                    "检测到依赖环: " + String.join(" -> ", cycle),
                    ErrorType.CYCLE_ERROR.name(),
                    List.copyOf(cycle));
        });
        return result;
    }

    @Override
    public String getValidatorName() {
        return "DependencyCycleValidator";
    }

    @Override
    public int getOrder() {
        return 30;
    }
}
