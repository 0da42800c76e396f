package xyz.firestige.fleet.exception;

import xyz.firestige.fleet.validation.ValidationError;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 清单校验异常
 * 一次性携带所有校验错误，而不是遇到第一个就停止
 */
public class ManifestValidationException extends OrchestratorException {

    private final List<ValidationError> errors;

    public ManifestValidationException(List<ValidationError> errors) {
        super(ErrorType.VALIDATION_ERROR, buildMessage(errors));
        this.errors = List.copyOf(errors);
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    private static String buildMessage(List<ValidationError> errors) {
        return "清单校验失败，共 " + errors.size() + " 处错误: " + errors.stream()
                .map(e -> e.getField() + ": " + e.getMessage())
                .collect(Collectors.joining("; "));
    }
}
