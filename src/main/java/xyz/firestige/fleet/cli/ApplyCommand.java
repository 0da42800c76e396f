package xyz.firestige.fleet.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import xyz.firestige.fleet.application.OrchestrationService;
import xyz.firestige.fleet.application.dto.ApplyResult;
import xyz.firestige.fleet.application.dto.PlanRequest;
import xyz.firestige.fleet.config.OrchestratorProperties;
import xyz.firestige.fleet.domain.execution.CancellationToken;
import xyz.firestige.fleet.exception.CycleException;
import xyz.firestige.fleet.exception.ManifestValidationException;
import xyz.firestige.fleet.exception.OrchestratorException;
import xyz.firestige.fleet.infrastructure.execution.ExecutionOverrides;
import xyz.firestige.fleet.infrastructure.execution.RunOutcome;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 执行部署计划
 * <p>
 * 退出码：0 全部成功；1 失败（含清单错误）；3 部分成功；130 已取消。
 * 收到中断信号时取消运行，并在宽限期内等待在途工作项结束。
 */
@Command(name = "apply", mixinStandardHelpOptions = true,
        description = "Execute the plan phase by phase, recording every successful item")
public class ApplyCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ApplyCommand.class);

    private final OrchestrationService orchestrationService;
    private final OrchestratorProperties properties;

    @ParentCommand
    private FleetCommand parent;

    @Mixin
    private SelectionOptions selection;

    @Option(names = {"--parallelism"}, paramLabel = "N",
            description = "Maximum number of services applied concurrently within a layer")
    private Integer parallelism;

    @Option(names = {"--retries"}, paramLabel = "N",
            description = "Retry budget per work item")
    private Integer retries;

    @Option(names = {"--retry-delay"}, paramLabel = "SEC",
            description = "Base delay between retries in seconds")
    private Long retryDelaySeconds;

    @Spec
    private CommandSpec spec;

    public ApplyCommand(OrchestrationService orchestrationService, OrchestratorProperties properties) {
        this.orchestrationService = orchestrationService;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        CancellationToken token = new CancellationToken();
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            token.cancel("收到中断信号");
            try {
                finished.await(properties.getCancellationGrace().toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "fleet-cancel");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            return execute(token);
        } finally {
            finished.countDown();
            removeHook(hook);
        }
    }

    Integer execute(CancellationToken token) {
        ExecutionOverrides overrides = new ExecutionOverrides(parallelism, retries,
                retryDelaySeconds == null ? null : Duration.ofSeconds(retryDelaySeconds));
        try {
            ApplyResult result = orchestrationService.apply(
                    new PlanRequest(parent.getManifest(), parent.getStateFile(), selection.toDiffOptions()), overrides, token);
            PlanPrinter.printPlan(spec.commandLine().getOut(), result.plan().plan());
            PlanPrinter.printReport(spec.commandLine().getOut(), result.report());
            return result.exitCode();
        } catch (ManifestValidationException e) {
            PlanPrinter.printViolations(spec.commandLine().getErr(), e);
            return RunOutcome.FAILED.getExitCode();
        } catch (CycleException e) {
            PlanPrinter.printCycle(spec.commandLine().getErr(), e);
            return RunOutcome.FAILED.getExitCode();
        } catch (OrchestratorException e) {
            log.error("Apply aborted: {}", e.getMessage(), e);
            spec.commandLine().getErr().println("Apply aborted: " + e.getMessage());
            return RunOutcome.FAILED.getExitCode();
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM 正在退出，钩子已在运行
            log.debug("Shutdown in progress, hook stays registered");
        }
    }
}
