package xyz.firestige.fleet.infrastructure.external;

import xyz.firestige.fleet.domain.manifest.AuthFacet;

import java.util.List;

/**
 * 在身份提供方登记应用的请求
 *
 * @param service 服务名
 * @param auth    认证接口面
 * @param domains 服务对外域名（用于推导回调地址）
 */
public record ApplicationRegistration(String service, AuthFacet auth, List<String> domains) {
}
