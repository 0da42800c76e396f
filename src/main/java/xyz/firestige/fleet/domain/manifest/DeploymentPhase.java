package xyz.firestige.fleet.domain.manifest;

import java.util.Arrays;
import java.util.Optional;

/**
 * 四个固定的顶层部署阶段，按声明顺序执行
 */
public enum DeploymentPhase {

    INFRASTRUCTURE("tf_infra", "基础设施供应"),

    CORE_CONFIGURATION("nix_core", "核心服务配置"),

    IDENTITY_REGISTRATION("tf_auth_core", "身份登记"),

    APPLICATION_ROLLOUT("services", "应用服务发布");

    /**
     * 清单 deployment_phases 中的键
     */
    private final String manifestKey;

    private final String description;

    DeploymentPhase(String manifestKey, String description) {
        this.manifestKey = manifestKey;
        this.description = description;
    }

    public String getManifestKey() {
        return manifestKey;
    }

    public String getDescription() {
        return description;
    }

    public static Optional<DeploymentPhase> fromManifestKey(String key) {
        return Arrays.stream(values())
                .filter(p -> p.manifestKey.equals(key))
                .findFirst();
    }
}
