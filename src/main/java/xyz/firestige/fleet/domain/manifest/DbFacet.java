package xyz.firestige.fleet.domain.manifest;

/**
 * 数据库接口面：声明服务需要的库与角色
 *
 * @param mode terraform | native-migration | standalone | none
 */
public record DbFacet(String database, String role, String host, Integer port, String mode) {
}
