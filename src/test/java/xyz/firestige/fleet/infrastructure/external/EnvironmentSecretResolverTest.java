package xyz.firestige.fleet.infrastructure.external;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.firestige.fleet.exception.FatalApplyException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
@DisplayName("EnvironmentSecretResolver 单元测试")
class EnvironmentSecretResolverTest {

    private final EnvironmentSecretResolver resolver =
            new EnvironmentSecretResolver(Map.of("PVE_TOKEN", "root@pam!fleet=abc")::get);

    @Test
    @DisplayName("env: 前缀与裸名称都读取环境变量")
    void resolvesEnvironment() {
        assertEquals("root@pam!fleet=abc", resolver.resolve("env:PVE_TOKEN"));
        assertEquals("root@pam!fleet=abc", resolver.resolve("PVE_TOKEN"));
    }

    @Test
    @DisplayName("file: 前缀读取文件并去掉首尾空白")
    void resolvesFile(@TempDir Path dir) throws Exception {
        Path secret = dir.resolve("authentik.token");
        Files.writeString(secret, "  ak-token\n");

        assertEquals("ak-token", resolver.resolve("file:" + secret));
    }

    @Test
    @DisplayName("缺失的凭据抛出致命异常，错误信息不包含任何凭据值")
    void missingCredential(@TempDir Path dir) {
        FatalApplyException e = assertThrows(FatalApplyException.class, () -> resolver.resolve("env:AUTHENTIK_TOKEN"));
        assertTrue(e.getMessage().contains("AUTHENTIK_TOKEN"));
        assertFalse(e.isRetryable());

        assertThrows(FatalApplyException.class, () -> resolver.resolve("file:" + dir.resolve("absent")));
        assertThrows(FatalApplyException.class, () -> resolver.resolve(" "));
    }

    @Test
    @DisplayName("canResolve 不抛出异常")
    void canResolve() {
        assertTrue(resolver.canResolve("PVE_TOKEN"));
        assertFalse(resolver.canResolve("env:UNSET_VARIABLE"));
        assertFalse(resolver.canResolve(null));
    }
}
