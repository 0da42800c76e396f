package xyz.firestige.fleet.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import xyz.firestige.fleet.application.OrchestrationService;
import xyz.firestige.fleet.domain.state.ResourceKind;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * 显式移除部署记录
 * <p>
 * 只修改状态文件，不触碰实际资源
 */
@Command(name = "decommission", mixinStandardHelpOptions = true,
        description = "Remove deployment records of a service; the underlying resources are not touched")
public class DecommissionCommand implements Callable<Integer> {

    private final OrchestrationService orchestrationService;

    @ParentCommand
    private FleetCommand parent;

    @Parameters(index = "0", paramLabel = "SERVICE", description = "Service whose records are removed")
    private String service;

    @Option(names = {"--kind"}, split = ",", paramLabel = "KIND",
            description = "Only remove these kinds: ${COMPLETION-CANDIDATES} (default: all)")
    private List<ResourceKind> kinds;

    @Spec
    private CommandSpec spec;

    public DecommissionCommand(OrchestrationService orchestrationService) {
        this.orchestrationService = orchestrationService;
    }

    @Override
    public Integer call() {
        Set<ResourceKind> targets = kinds == null || kinds.isEmpty() ? EnumSet.allOf(ResourceKind.class) : EnumSet.copyOf(kinds);
        int removed = orchestrationService.decommission(parent.getStateFile(), service, targets);
        spec.commandLine().getOut().printf("Removed %d record(s) of %s.%n", removed, service);
        spec.commandLine().getOut().flush();
        return 0;
    }
}
