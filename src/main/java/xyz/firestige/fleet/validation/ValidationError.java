package xyz.firestige.fleet.validation;

import java.util.Objects;

/**
 * 校验错误
 * field 为出错位置的路径，例如 services.guacamole.ports[1]
 */
public class ValidationError {

    /**
     * 错误字段路径
     */
    private final String field;

    /**
     * 错误消息
     */
    private final String message;

    /**
     * 错误码
     */
    private final String errorCode;

    /**
     * 被拒绝的值
     */
    private final Object rejectedValue;

    public ValidationError(String field, String message, String errorCode, Object rejectedValue) {
        this.field = field;
        this.message = message;
        this.errorCode = errorCode;
        this.rejectedValue = rejectedValue;
    }

    public static ValidationError of(String field, String message) {
        return new ValidationError(field, message, null, null);
    }

    public static ValidationError of(String field, String message, String errorCode) {
        return new ValidationError(field, message, errorCode, null);
    }

    public static ValidationError of(String field, String message, String errorCode, Object rejectedValue) {
        return new ValidationError(field, message, errorCode, rejectedValue);
    }

    public String getField() {
        return field;
    }

    public String getMessage() {
        return message;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Object getRejectedValue() {
        return rejectedValue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationError that)) return false;
        return Objects.equals(field, that.field) &&
                Objects.equals(message, that.message) &&
                Objects.equals(errorCode, that.errorCode);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, message, errorCode);
    }

    @Override
    public String toString() {
        return "ValidationError{" +
                "field='" + field + '\'' +
                ", message='" + message + '\'' +
                ", errorCode='" + errorCode + '\'' +
                ", rejectedValue=" + rejectedValue +
                '}';
    }
}
