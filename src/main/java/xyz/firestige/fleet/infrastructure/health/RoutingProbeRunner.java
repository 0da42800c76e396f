package xyz.firestige.fleet.infrastructure.health;

import java.time.Duration;
import java.util.Locale;

/**
 * 按目标形式分派：http(s) URL 走 HTTP 探针，其余按命令执行
 */
public class RoutingProbeRunner implements ProbeRunner {

    private final ProbeRunner httpRunner;
    private final ProbeRunner commandRunner;

    public RoutingProbeRunner(ProbeRunner httpRunner, ProbeRunner commandRunner) {
        this.httpRunner = httpRunner;
        this.commandRunner = commandRunner;
    }

    @Override
    public ProbeResult run(String target, Duration timeout) {
        String lower = target.trim().toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return httpRunner.run(target.trim(), timeout);
        }
        return commandRunner.run(target, timeout);
    }
}
