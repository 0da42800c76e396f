package xyz.firestige.fleet.domain.execution;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
@DisplayName("RetryPolicy 单元测试")
class RetryPolicyTest {

    @Test
    @DisplayName("场景 7.5: maxRetry = 2 时最多执行 3 次")
    void budget() {
        RetryPolicy policy = RetryPolicy.initial(2);

        assertTrue(policy.canRetry());
        policy = policy.incrementRetryCount();
        assertTrue(policy.canRetry());
        policy = policy.incrementRetryCount();

        assertFalse(policy.canRetry());
        assertEquals(3, policy.attempts());
        assertEquals(RetryPolicy.of(2, 2), policy);
    }

    @Test
    @DisplayName("场景 7.6: 重试次数为 0 时不重试")
    void zeroRetries() {
        assertFalse(RetryPolicy.initial(0).canRetry());
        assertEquals(1, RetryPolicy.initial(0).attempts());
    }

    @Test
    @DisplayName("场景 7.7: 负数参数非法")
    void rejectsNegative() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.initial(-1));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.of(-1, 3));
    }
}
