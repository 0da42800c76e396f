package xyz.firestige.fleet.domain.manifest;

import java.util.List;
import java.util.Map;

/**
 * 服务接口：服务与编排器之间的契约，所有接口面均可选
 *
 * @param db        数据库接口面
 * @param proxy     反向代理入口（单个、列表或具名映射统一为列表）
 * @param auth      认证接口面
 * @param health    健康检查接口面
 * @param terraform 基础设施供应参数
 * @param config    不透明的配置负载，原样交给配置应用方
 */
public record ServiceInterface(DbFacet db, List<ProxyEndpoint> proxy, AuthFacet auth,
                               HealthFacet health, TerraformFacet terraform, Map<String, Object> config) {

    public static final ServiceInterface EMPTY = new ServiceInterface(null, List.of(), null, null, null, null);

    public ServiceInterface {
        proxy = proxy == null ? List.of() : List.copyOf(proxy);
    }

    /**
     * 是否声明了需要通过配置应用方下发的内容
     */
    public boolean hasConfigurationFacets() {
        return (config != null && !config.isEmpty()) || db != null || !proxy.isEmpty() || health != null;
    }
}
