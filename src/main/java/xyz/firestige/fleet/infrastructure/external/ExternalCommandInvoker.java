package xyz.firestige.fleet.infrastructure.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.fleet.exception.FatalApplyException;
import xyz.firestige.fleet.exception.TransientApplyException;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 外部命令调用
 * <p>
 * 约定：请求 JSON 写入 stdin，响应 JSON 从 stdout 读取。
 * 退出码 0 成功；75（EX_TEMPFAIL）或超时视为暂时性失败；其余退出码视为致命失败。
 * 凭据只通过子进程环境变量传递。
 * 调用以任何方式结束（含超时和线程中断）时，仍存活的子进程及其后代都会被终止并等待退出。
 */
public class ExternalCommandInvoker {

    private static final Logger log = LoggerFactory.getLogger(ExternalCommandInvoker.class);

    static final int EX_TEMPFAIL = 75;
    private static final int MAX_STDERR_CHARS = 2000;
    private static final long TERMINATE_WAIT_MILLIS = 5000;

    private final ObjectMapper objectMapper;

    public ExternalCommandInvoker(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode invoke(String collaborator, List<String> command, Object request,
                           Map<String, String> environment, Duration timeout) {
        Path stdout = null;
        Path stderr = null;
        Process process = null;
        try {
            stdout = Files.createTempFile("fleet-" + collaborator, ".out");
            stderr = Files.createTempFile("fleet-" + collaborator, ".err");
            ProcessBuilder builder = new ProcessBuilder(command)
                    .redirectOutput(stdout.toFile())
                    .redirectError(stderr.toFile());
            builder.environment().putAll(environment);

            log.debug("Invoking {} collaborator: {}", collaborator, command.get(0));
            try {
                process = builder.start();
            } catch (IOException e) {
                throw new FatalApplyException(collaborator + " 命令无法启动: " + command.get(0), e);
            }
            try (OutputStream in = process.getOutputStream()) {
                objectMapper.writeValue(in, request);
            } catch (IOException e) {
                log.warn("{} collaborator closed stdin early: {}", collaborator, e.getMessage());
            }

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new TransientApplyException(collaborator + " 调用超时（" + timeout.toSeconds() + "s）");
            }

            int exit = process.exitValue();
            if (exit == EX_TEMPFAIL) {
                throw new TransientApplyException(collaborator + " 暂时性失败: " + tail(stderr));
            }
            if (exit != 0) {
                throw new FatalApplyException(collaborator + " 失败，退出码 " + exit + ": " + tail(stderr));
            }
            String output = Files.readString(stdout, StandardCharsets.UTF_8).trim();
            return output.isEmpty() ? NullNode.getInstance() : objectMapper.readTree(output);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientApplyException(collaborator + " 调用被中断", e);
        } catch (IOException e) {
            throw new TransientApplyException(collaborator + " 输入输出失败: " + e.getMessage(), e);
        } finally {
            if (process != null) {
                terminate(collaborator, process);
            }
            deleteQuietly(stdout);
            deleteQuietly(stderr);
        }
    }

    private static void terminate(String collaborator, Process process) {
        if (!process.isAlive()) {
            return;
        }
        log.warn("Terminating {} collaborator process pid={}", collaborator, process.pid());
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        // 带着中断标志调用 waitFor 会立即抛出 InterruptedException，先清除，等待结束后恢复
        boolean interrupted = Thread.interrupted();
        try {
            if (!process.waitFor(TERMINATE_WAIT_MILLIS, TimeUnit.MILLISECONDS)) {
                log.error("{} collaborator process pid={} did not exit after destroy", collaborator, process.pid());
            }
        } catch (InterruptedException e) {
            interrupted = true;
            log.error("Interrupted while waiting for {} collaborator process pid={} to exit", collaborator, process.pid());
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static String tail(Path file) throws IOException {
        String content = Files.readString(file, StandardCharsets.UTF_8).trim();
        return content.length() <= MAX_STDERR_CHARS ? content : content.substring(content.length() - MAX_STDERR_CHARS);
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Failed to delete temp file {}: {}", file, e.getMessage());
        }
    }
}
