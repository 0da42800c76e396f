package xyz.firestige.fleet.infrastructure.external;

/**
 * 供应后端：创建或更新容器，调用需幂等
 */
public interface ProvisioningBackend extends ExternalCollaborator {

    ProvisionResult createOrUpdate(ContainerSpec spec);
}
