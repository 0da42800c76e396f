package xyz.firestige.fleet.infrastructure.external;

/**
 * 登记结果
 */
public record RegistrationResult(String clientId, String clientType) {
}
