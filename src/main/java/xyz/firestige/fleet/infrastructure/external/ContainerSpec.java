package xyz.firestige.fleet.infrastructure.external;

import xyz.firestige.fleet.domain.manifest.Manifest;
import xyz.firestige.fleet.domain.manifest.NetworkSpec;
import xyz.firestige.fleet.domain.manifest.ResourceSizing;
import xyz.firestige.fleet.domain.manifest.RestartPolicy;
import xyz.firestige.fleet.domain.manifest.ServiceSpec;
import xyz.firestige.fleet.domain.manifest.TerraformFacet;

import java.util.List;
import java.util.Map;

/**
 * 交给供应后端的容器规格
 */
public record ContainerSpec(String service, String hostname, String ip, Integer vmid, ResourceSizing resources,
                            List<Integer> ports, RestartPolicy restartPolicy, Map<String, String> environment,
                            List<String> volumes, TerraformFacet terraform, NetworkSpec network) {

    public static ContainerSpec from(Manifest manifest, ServiceSpec service) {
        return new ContainerSpec(service.name(), service.hostname(), service.ip(), service.vmid(), service.resources(),
                service.ports(), service.restartPolicy(), service.environment(), service.volumes(),
                service.serviceInterface().terraform(), manifest.getNetwork());
    }
}
