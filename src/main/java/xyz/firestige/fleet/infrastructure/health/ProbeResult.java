package xyz.firestige.fleet.infrastructure.health;

/**
 * 探测结果
 *
 * @param healthy 是否健康
 * @param detail  不健康时的原因
 */
public record ProbeResult(boolean healthy, String detail) {

    private static final ProbeResult HEALTHY = new ProbeResult(true, "healthy");

    public static ProbeResult ok() {
        return HEALTHY;
    }

    public static ProbeResult unhealthy(String reason) {
        return new ProbeResult(false, reason);
    }
}
