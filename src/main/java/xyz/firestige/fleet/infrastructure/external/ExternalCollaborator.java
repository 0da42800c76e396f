package xyz.firestige.fleet.infrastructure.external;

import java.util.Collection;

/**
 * 外部协作方的公共约定，执行前用于预检
 */
public interface ExternalCollaborator {

    String getName();

    /**
     * 是否已配置，未配置的协作方在预检阶段导致整次运行失败
     */
    boolean isConfigured();

    /**
     * 调用时需要的凭据引用
     */
    Collection<String> credentialReferences();
}
