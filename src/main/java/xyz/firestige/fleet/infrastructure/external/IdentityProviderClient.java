package xyz.firestige.fleet.infrastructure.external;

/**
 * 身份提供方 API 客户端，调用需幂等
 */
public interface IdentityProviderClient extends ExternalCollaborator {

    RegistrationResult registerApplication(ApplicationRegistration registration);
}
