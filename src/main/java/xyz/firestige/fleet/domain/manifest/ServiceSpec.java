package xyz.firestige.fleet.domain.manifest;

import xyz.firestige.fleet.domain.state.ResourceKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 服务规格
 *
 * @param name             服务名（清单内唯一）
 * @param core             是否为核心服务（声明在 core_services 下）
 * @param enabled          是否启用，未启用的服务不参与部署
 * @param ip               IPv4 地址
 * @param hostname         主机名
 * @param vmid             供应后端的数值标识（可选）
 * @param resources        资源规格
 * @param dependsOn        依赖的服务名
 * @param ports            暴露端口
 * @param restartPolicy    重启策略
 * @param environment      环境变量
 * @param volumes          挂载卷
 * @param serviceInterface 服务接口
 */
public record ServiceSpec(String name, boolean core, boolean enabled, String ip, String hostname, Integer vmid,
                          ResourceSizing resources, SortedSet<String> dependsOn, List<Integer> ports,
                          RestartPolicy restartPolicy, Map<String, String> environment, List<String> volumes,
                          ServiceInterface serviceInterface) {

    public ServiceSpec {
        resources = resources == null ? ResourceSizing.UNSPECIFIED : resources;
        dependsOn = Collections.unmodifiableSortedSet(dependsOn == null ? new TreeSet<>() : new TreeSet<>(dependsOn));
        ports = ports == null ? List.of() : List.copyOf(ports);
        restartPolicy = restartPolicy == null ? RestartPolicy.UNLESS_STOPPED : restartPolicy;
        environment = environment == null ? Map.of() : Map.copyOf(environment);
        volumes = volumes == null ? List.of() : List.copyOf(volumes);
        serviceInterface = serviceInterface == null ? ServiceInterface.EMPTY : serviceInterface;
    }

    /**
     * 该服务需要的资源类型，按优先级排序
     * <ul>
     *     <li>container：始终需要</li>
     *     <li>identity_registration：认证方式需要在身份提供方登记时</li>
     *     <li>configuration_applied：声明了配置负载、数据库、代理或健康检查时</li>
     * </ul>
     */
    public List<ResourceKind> requiredKinds() {
        List<ResourceKind> kinds = new ArrayList<>();
        kinds.add(ResourceKind.CONTAINER);
        if (serviceInterface.auth() != null && serviceInterface.auth().requiresRegistration()) {
            kinds.add(ResourceKind.IDENTITY_REGISTRATION);
        }
        if (serviceInterface.hasConfigurationFacets()) {
            kinds.add(ResourceKind.CONFIGURATION_APPLIED);
        }
        return kinds;
    }
}
