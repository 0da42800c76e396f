package xyz.firestige.fleet.domain.manifest;

import java.util.List;

/**
 * 认证接口面
 *
 * @param type          认证方式
 * @param provider      身份提供方，默认 authentik
 * @param clientId      OIDC client id
 * @param redirectUris  回调地址
 * @param scopes        申请的 scope
 * @param usernameClaim 用户名 claim
 * @param groupsClaim   用户组 claim
 */
public record AuthFacet(AuthType type, String provider, String clientId, List<String> redirectUris,
                        List<String> scopes, String usernameClaim, String groupsClaim) {

    public boolean requiresRegistration() {
        return type != null && type.isRegistrationRequired();
    }
}
