package xyz.firestige.fleet.validation;

import xyz.firestige.fleet.domain.manifest.Manifest;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 校验链
 * 按顺序执行多个校验器，默认收集全部错误
 */
public class ValidationChain {

    /**
     * 校验器列表
     */
    private final List<ManifestValidator> validators = new ArrayList<>();

    /**
     * 是否快速失败（遇到第一个错误就停止）
     */
    private final boolean failFast;

    public ValidationChain() {
        this(false);
    }

    public ValidationChain(boolean failFast) {
        this.failFast = failFast;
    }

    /**
     * 添加校验器
     */
    public ValidationChain addValidator(ManifestValidator validator) {
        this.validators.add(validator);
        this.validators.sort(Comparator.comparingInt(ManifestValidator::getOrder));
        return this;
    }

    /**
     * 添加多个校验器
     */
    public ValidationChain addValidators(List<? extends ManifestValidator> validators) {
        this.validators.addAll(validators);
        this.validators.sort(Comparator.comparingInt(ManifestValidator::getOrder));
        return this;
    }

    /**
     * 校验清单
     */
    public ValidationResult validate(Manifest manifest) {
        ValidationResult result = new ValidationResult();

        for (ManifestValidator validator : validators) {
            ValidationResult validatorResult = validator.validate(manifest);
            result.merge(validatorResult);

            if (failFast && !validatorResult.isValid()) {
                break;
            }
        }

        return result;
    }

    public List<String> getValidatorNames() {
        return validators.stream()
                .map(ManifestValidator::getValidatorName)
                .collect(Collectors.toList());
    }

    public List<ManifestValidator> getValidators() {
        return List.copyOf(validators);
    }

    public boolean isFailFast() {
        return failFast;
    }
}
