package xyz.firestige.fleet.validation;

/**
 * 校验警告，不阻止部署
 */
public class ValidationWarning {

    private final String field;
    private final String message;

    public ValidationWarning(String field, String message) {
        this.field = field;
        this.message = message;
    }

    public static ValidationWarning of(String field, String message) {
        return new ValidationWarning(field, message);
    }

    public String getField() {
        return field;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return field + ": " + message;
    }
}
