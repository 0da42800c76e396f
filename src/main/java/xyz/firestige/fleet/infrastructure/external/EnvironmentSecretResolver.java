package xyz.firestige.fleet.infrastructure.external;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.fleet.exception.FatalApplyException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;

/**
 * 基于环境变量与文件的凭据解析
 * <p>
 * 引用格式：
 * - env:NAME  读取环境变量
 * - file:/path  读取文件内容（去掉首尾空白）
 * - NAME  等同于 env:NAME
 */
public class EnvironmentSecretResolver implements SecretResolver {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentSecretResolver.class);

    private static final String ENV_PREFIX = "env:";
    private static final String FILE_PREFIX = "file:";

    private final Function<String, String> environment;

    public EnvironmentSecretResolver() {
        this(System::getenv);
    }

    public EnvironmentSecretResolver(Function<String, String> environment) {
        this.environment = environment;
    }

    @Override
    public String resolve(String reference) {
        if (reference == null || reference.isBlank()) {
            throw new FatalApplyException("凭据引用为空");
        }
        if (reference.startsWith(FILE_PREFIX)) {
            Path path = Path.of(reference.substring(FILE_PREFIX.length()));
            try {
                return Files.readString(path, StandardCharsets.UTF_8).trim();
            } catch (IOException e) {
                throw new FatalApplyException("无法读取凭据文件: " + path, e);
            }
        }
        String name = reference.startsWith(ENV_PREFIX) ? reference.substring(ENV_PREFIX.length()) : reference;
        String value = environment.apply(name);
        if (value == null || value.isEmpty()) {
            throw new FatalApplyException("缺少凭据: 环境变量 " + name + " 未设置");
        }
        log.debug("Resolved credential {} from environment", name);
        return value;
    }

    @Override
    public boolean canResolve(String reference) {
        try {
            resolve(reference);
            return true;
        } catch (FatalApplyException e) {
            log.warn("Credential reference {} cannot be resolved: {}", reference, e.getMessage());
            return false;
        }
    }
}
