package xyz.firestige.fleet.infrastructure.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * 命令探针：/bin/sh -c 执行，退出码 0 表示健康
 */
public class CommandProbeRunner implements ProbeRunner {

    private static final Logger log = LoggerFactory.getLogger(CommandProbeRunner.class);

    @Override
    public ProbeResult run(String command, Duration timeout) {
        ProcessBuilder builder = new ProcessBuilder("/bin/sh", "-c", command)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .redirectError(ProcessBuilder.Redirect.DISCARD);
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            return ProbeResult.unhealthy("无法启动探针命令: " + e.getMessage());
        }
        try {
            if (!process.waitFor(Math.max(1, timeout.toMillis()), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                return ProbeResult.unhealthy("探针命令超时（" + timeout.toMillis() + "ms）");
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return ProbeResult.unhealthy("探针被中断");
        }
        int exit = process.exitValue();
        log.debug("Command probe '{}' exited with {}", command, exit);
        return exit == 0 ? ProbeResult.ok() : ProbeResult.unhealthy("探针命令退出码 " + exit);
    }
}
