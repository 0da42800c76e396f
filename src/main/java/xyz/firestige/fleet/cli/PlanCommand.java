package xyz.firestige.fleet.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import xyz.firestige.fleet.application.OrchestrationService;
import xyz.firestige.fleet.application.dto.PlanRequest;
import xyz.firestige.fleet.application.dto.PlanResult;
import xyz.firestige.fleet.exception.CycleException;
import xyz.firestige.fleet.exception.ManifestValidationException;

import java.util.concurrent.Callable;

/**
 * 校验清单并输出部署计划，不做任何变更
 * <p>
 * 退出码：0 清单合法；2 存在违规
 */
@Command(name = "plan", mixinStandardHelpOptions = true,
        description = "Validate the manifest and print the ordered work items; never mutates anything")
public class PlanCommand implements Callable<Integer> {

    static final int EXIT_INVALID = 2;

    private final OrchestrationService orchestrationService;

    @ParentCommand
    private FleetCommand parent;

    @Mixin
    private SelectionOptions selection;

    @Spec
    private CommandSpec spec;

    public PlanCommand(OrchestrationService orchestrationService) {
        this.orchestrationService = orchestrationService;
    }

    @Override
    public Integer call() {
        try {
            PlanResult result = orchestrationService.plan(
                    new PlanRequest(parent.getManifest(), parent.getStateFile(), selection.toDiffOptions()));
            PlanPrinter.printPlan(spec.commandLine().getOut(), result.plan());
            return 0;
        } catch (ManifestValidationException e) {
            PlanPrinter.printViolations(spec.commandLine().getErr(), e);
            return EXIT_INVALID;
        } catch (CycleException e) {
            PlanPrinter.printCycle(spec.commandLine().getErr(), e);
            return EXIT_INVALID;
        }
    }
}
