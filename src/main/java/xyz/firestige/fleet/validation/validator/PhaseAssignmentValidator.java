package xyz.firestige.fleet.validation.validator;

import xyz.firestige.fleet.domain.manifest.DeploymentPhase;
import xyz.firestige.fleet.domain.manifest.Manifest;
import xyz.firestige.fleet.domain.manifest.ServiceSpec;
import xyz.firestige.fleet.validation.ManifestValidator;
import xyz.firestige.fleet.validation.ValidationResult;

import java.util.Set;

/**
 * 部署阶段校验器
 * <p>
 * 1. deployment_phases 中列出的服务必须存在
 * 2. 核心服务只能依赖核心服务，否则应用发布阶段会晚于其依赖方
 */
public class PhaseAssignmentValidator implements ManifestValidator {

    @Override
    public ValidationResult validate(Manifest manifest) {
        ValidationResult result = new ValidationResult();

        manifest.getPhaseAssignments().asMap().forEach((phase, names) -> {
            for (int i = 0; i < names.size(); i++) {
                String name = names.get(i);
                if (manifest.findService(name).isEmpty()) {
                    result.addError("deployment_phases." + phase.getManifestKey() + "[" + i + "]",
                            "阶段中引用了不存在的服务: " + name, "UNKNOWN_SERVICE", name);
                }
            }
        });

        Set<String> core = manifest.getPhaseAssignments().coreServiceNames();
        for (ServiceSpec service : manifest.enabledServices()) {
            if (!isCore(service, core)) {
                continue;
            }
            for (String dep : service.dependsOn()) {
                manifest.findService(dep)
                        .filter(target -> !isCore(target, core))
                        .ifPresent(target -> result.addError(
                                RequiredFieldsValidator.sectionOf(service) + "." + service.name() + ".depends_on",
                                "核心服务不能依赖非核心服务: " + dep + "（非核心服务在 "
                                        + DeploymentPhase.APPLICATION_ROLLOUT.getManifestKey() + " 阶段才部署）",
                                "CORE_DEPENDS_ON_APPLICATION", dep));
            }
        }
        return result;
    }

    private static boolean isCore(ServiceSpec service, Set<String> phaseCore) {
        return service.core() || phaseCore.contains(service.name());
    }

    @Override
    public String getValidatorName() {
        return "PhaseAssignmentValidator";
    }

    @Override
    public int getOrder() {
        return 70;
    }
}
