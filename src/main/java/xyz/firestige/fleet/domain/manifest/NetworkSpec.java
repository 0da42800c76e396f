package xyz.firestige.fleet.domain.manifest;

/**
 * 网络规格（全局单例，只读）
 *
 * @param domain      基础域名
 * @param gateway     网关地址
 * @param networkCidr 网段，例如 192.168.99.0/24
 * @param vlanTag     VLAN 标签
 * @param dnsServer   DNS 服务器地址
 */
public record NetworkSpec(String domain, String gateway, String networkCidr, Integer vlanTag, String dnsServer) {
}
