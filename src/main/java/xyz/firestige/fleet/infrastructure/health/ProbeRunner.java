package xyz.firestige.fleet.infrastructure.health;

import java.time.Duration;

/**
 * 单次探针执行
 */
public interface ProbeRunner {

    /**
     * 执行一次探针
     *
     * @param target  探针目标（URL 或命令）
     * @param timeout 本次执行的最长时间
     */
    ProbeResult run(String target, Duration timeout);
}
