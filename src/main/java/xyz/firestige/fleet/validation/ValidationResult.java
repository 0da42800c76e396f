package xyz.firestige.fleet.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 校验结果
 */
public class ValidationResult {

    /**
     * 校验错误列表
     */
    private final List<ValidationError> errors = new ArrayList<>();

    /**
     * 校验警告列表
     */
    private final List<ValidationWarning> warnings = new ArrayList<>();

    /**
     * 创建成功的校验结果
     */
    public static ValidationResult success() {
        return new ValidationResult();
    }

    /**
     * 创建失败的校验结果
     */
    public static ValidationResult failure(ValidationError error) {
        ValidationResult result = new ValidationResult();
        result.addError(error);
        return result;
    }

    public void addError(ValidationError error) {
        this.errors.add(error);
    }

    public void addError(String field, String message, String errorCode, Object rejectedValue) {
        this.errors.add(ValidationError.of(field, message, errorCode, rejectedValue));
    }

    public void addWarning(ValidationWarning warning) {
        this.warnings.add(warning);
    }

    /**
     * 合并另一个校验结果
     */
    public void merge(ValidationResult other) {
        if (other != null) {
            this.errors.addAll(other.getErrors());
            this.warnings.addAll(other.getWarnings());
        }
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public List<ValidationError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<ValidationWarning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    @Override
    public String toString() {
        return "ValidationResult{" +
                "valid=" + isValid() +
                ", errors=" + errors.size() +
                ", warnings=" + warnings.size() +
                '}';
    }
}
