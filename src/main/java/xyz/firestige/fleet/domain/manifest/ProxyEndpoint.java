package xyz.firestige.fleet.domain.manifest;

import java.util.Map;

/**
 * 反向代理入口
 *
 * @param name         入口名（单入口时与服务同名）
 * @param domain       对外域名，全清单唯一
 * @param path         路径前缀，默认 "/"
 * @param upstream     上游地址，例如 guacamole.nixmox.lan:8080
 * @param tls          是否启用 TLS
 * @param authRequired 是否需要身份认证
 * @param headers      附加请求头
 */
public record ProxyEndpoint(String name, String domain, String path, String upstream,
                            boolean tls, boolean authRequired, Map<String, String> headers) {
}
