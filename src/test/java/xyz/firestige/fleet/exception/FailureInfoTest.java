package xyz.firestige.fleet.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
@DisplayName("FailureInfo 单元测试")
class FailureInfoTest {

    @Test
    @DisplayName("编排器异常按其错误类型转换")
    void fromOrchestratorException() {
        FailureInfo transientInfo = FailureInfo.fromException(
                new TransientApplyException("proxmox busy"), "grafana/container");
        FailureInfo timeoutInfo = FailureInfo.fromException(
                new HealthTimeoutException("grafana", Duration.ofSeconds(60)), "grafana/container");
        FailureInfo fatalInfo = FailureInfo.fromException(
                new FatalApplyException("bad credentials", new IOException("401")), "authentik/identity_registration");

        assertEquals(ErrorType.TRANSIENT_APPLY_ERROR, transientInfo.getErrorType());
        assertTrue(transientInfo.isRetryable());
        assertEquals("grafana/container", transientInfo.getFailedAt());

        assertEquals(ErrorType.HEALTH_TIMEOUT_ERROR, timeoutInfo.getErrorType());
        assertTrue(timeoutInfo.isRetryable());

        assertEquals(ErrorType.FATAL_APPLY_ERROR, fatalInfo.getErrorType());
        assertFalse(fatalInfo.isRetryable());
        assertEquals("IOException: 401", fatalInfo.getRootCause());
    }

    @Test
    @DisplayName("未知异常按类名中的 Timeout / Network / Connection 判断是否可重试")
    void classifiesUnknownExceptions() {
        assertTrue(FailureInfo.isRetryableException(new SocketTimeoutException("read timed out")));
        assertTrue(FailureInfo.isRetryableException(new NetworkGlitchException()));
        assertFalse(FailureInfo.isRetryableException(new IllegalArgumentException("bad")));

        FailureInfo info = FailureInfo.fromException(
                new IllegalStateException("wrapper", new NetworkGlitchException()), "wiki/container");
        assertEquals(ErrorType.FATAL_APPLY_ERROR, info.getErrorType());
        assertTrue(info.getRootCause().startsWith("NetworkGlitchException"));
    }

    private static class NetworkGlitchException extends RuntimeException {
        NetworkGlitchException() {
            super("link flapped");
        }
    }
}
