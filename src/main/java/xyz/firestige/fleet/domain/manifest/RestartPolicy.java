package xyz.firestige.fleet.domain.manifest;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * 服务重启策略
 */
public enum RestartPolicy {

    ALWAYS("always"),

    UNLESS_STOPPED("unless-stopped"),

    NEVER("never");

    private final String value;

    RestartPolicy(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<RestartPolicy> fromValue(String value) {
        return Arrays.stream(values())
                .filter(p -> p.value.equalsIgnoreCase(value))
                .findFirst();
    }
}
