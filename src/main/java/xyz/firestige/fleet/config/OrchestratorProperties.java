package xyz.firestige.fleet.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 编排器配置属性
 * <p>
 * 支持配置：
 * - 清单与状态文件位置、存储类型
 * - 阶段内并行度
 * - 重试预算与退避策略
 * - 健康检查默认值
 * - 外部协作方命令与凭据引用
 * <p>
 * 优先级：这里的默认值 < 清单中的声明 < 命令行显式覆盖
 */
@Validated
@ConfigurationProperties(prefix = "fleet.orchestrator")
public class OrchestratorProperties {

    /**
     * 默认清单路径
     */
    @NotBlank
    private String manifest = "service-manifest.yaml";

    /**
     * 部署状态文件
     */
    @NotBlank
    private String stateFile = ".fleet/deployment-state.json";

    /**
     * 存储类型
     */
    @NotNull
    private StoreType storeType = StoreType.file;

    /**
     * 阶段内最大并行服务数
     */
    @Min(1)
    private int parallelism = 4;

    /**
     * 收到取消信号后等待在途工作项完成的最长时间
     */
    @NotNull
    private Duration cancellationGrace = Duration.ofMinutes(2);

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Health health = new Health();

    @Valid
    private Collaborators collaborators = new Collaborators();

    public enum StoreType {
        /**
         * JSON 文件存储（生产）
         */
        file,
        /**
         * 内存存储（测试，进程退出后丢失）
         */
        memory
    }

    public enum BackoffType {
        fixed,
        exponential
    }

    public static class Retry {

        /**
         * 重试次数（不含首次执行）
         */
        @Min(0)
        private int attempts = 3;

        /**
         * 首次重试间隔
         */
        @NotNull
        private Duration delay = Duration.ofSeconds(5);

        @NotNull
        private BackoffType backoff = BackoffType.exponential;

        @DecimalMin("1.0")
        private double multiplier = 2.0;

        @NotNull
        private Duration maxDelay = Duration.ofMinutes(2);

        public int getAttempts() {
            return attempts;
        }

        public void setAttempts(int attempts) {
            this.attempts = attempts;
        }

        public Duration getDelay() {
            return delay;
        }

        public void setDelay(Duration delay) {
            this.delay = delay;
        }

        public BackoffType getBackoff() {
            return backoff;
        }

        public void setBackoff(BackoffType backoff) {
            this.backoff = backoff;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }
    }

    public static class Health {

        /**
         * 默认轮询间隔（秒）
         */
        @Min(0)
        private int intervalSeconds = 30;

        /**
         * 默认超时（秒）
         */
        @Min(1)
        private int timeoutSeconds = 300;

        /**
         * 默认存活探针尝试次数
         */
        @Min(1)
        private int retries = 3;

        /**
         * 探针调度线程数
         */
        @Min(1)
        private int probeThreads = 4;

        public int getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(int intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public int getRetries() {
            return retries;
        }

        public void setRetries(int retries) {
            this.retries = retries;
        }

        public int getProbeThreads() {
            return probeThreads;
        }

        public void setProbeThreads(int probeThreads) {
            this.probeThreads = probeThreads;
        }
    }

    public static class Collaborators {

        @Valid
        private Command provisioning = new Command();

        @Valid
        private Command identityProvider = new Command();

        @Valid
        private Command configuration = new Command();

        public Command getProvisioning() {
            return provisioning;
        }

        public void setProvisioning(Command provisioning) {
            this.provisioning = provisioning;
        }

        public Command getIdentityProvider() {
            return identityProvider;
        }

        public void setIdentityProvider(Command identityProvider) {
            this.identityProvider = identityProvider;
        }

        public Command getConfiguration() {
            return configuration;
        }

        public void setConfiguration(Command configuration) {
            this.configuration = configuration;
        }
    }

    /**
     * 以外部命令实现的协作方
     */
    public static class Command {

        /**
         * 命令及参数，为空表示未配置
         */
        private List<String> command = new ArrayList<>();

        /**
         * 子进程环境变量名 -> 凭据引用（env:NAME、file:/path）
         */
        private Map<String, String> credentials = new LinkedHashMap<>();

        /**
         * 单次调用超时
         */
        @NotNull
        private Duration timeout = Duration.ofMinutes(10);

        public boolean isConfigured() {
            return command != null && !command.isEmpty();
        }

        public List<String> getCommand() {
            return command;
        }

        public void setCommand(List<String> command) {
            this.command = command;
        }

        public Map<String, String> getCredentials() {
            return credentials;
        }

        public void setCredentials(Map<String, String> credentials) {
            this.credentials = credentials;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    // Getters and Setters

    public String getManifest() {
        return manifest;
    }

    public void setManifest(String manifest) {
        this.manifest = manifest;
    }

    public String getStateFile() {
        return stateFile;
    }

    public void setStateFile(String stateFile) {
        this.stateFile = stateFile;
    }

    public StoreType getStoreType() {
        return storeType;
    }

    public void setStoreType(StoreType storeType) {
        this.storeType = storeType;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    public Duration getCancellationGrace() {
        return cancellationGrace;
    }

    public void setCancellationGrace(Duration cancellationGrace) {
        this.cancellationGrace = cancellationGrace;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Health getHealth() {
        return health;
    }

    public void setHealth(Health health) {
        this.health = health;
    }

    public Collaborators getCollaborators() {
        return collaborators;
    }

    public void setCollaborators(Collaborators collaborators) {
        this.collaborators = collaborators;
    }
}
