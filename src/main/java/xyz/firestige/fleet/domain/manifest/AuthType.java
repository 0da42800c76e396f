package xyz.firestige.fleet.domain.manifest;

import java.util.Arrays;
import java.util.Optional;

/**
 * 认证方式
 */
public enum AuthType {

    OIDC("oidc", true),

    FORWARD_AUTH("forward_auth", true),

    LOCAL("local", false),

    NONE("none", false);

    private final String value;

    /**
     * 是否需要在身份提供方登记应用
     */
    private final boolean registrationRequired;

    AuthType(String value, boolean registrationRequired) {
        this.value = value;
        this.registrationRequired = registrationRequired;
    }

    public String getValue() {
        return value;
    }

    public boolean isRegistrationRequired() {
        return registrationRequired;
    }

    public static Optional<AuthType> fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value))
                .findFirst();
    }
}
