package xyz.firestige.fleet.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * 命令行根命令
 * <p>
 * 全局选项由子命令通过 {@code @ParentCommand} 读取
 */
@Command(
    name = "fleet",
    version = "1.0.0",
    description = "Manifest-driven phased deployment orchestrator",
    mixinStandardHelpOptions = true,
    subcommands = {
        PlanCommand.class,
        ApplyCommand.class,
        StatusCommand.class,
        DecommissionCommand.class
    },
    footerHeading = "%n@|bold Examples:|@%n",
    footer = {
        "",
        "  fleet -m service-manifest.yaml plan",
        "  fleet apply --only grafana --parallelism 2",
        "  fleet apply --force postgresql",
        "  fleet status",
        "  fleet decommission old-wiki --kind container",
        ""
    }
)
public class FleetCommand implements Callable<Integer> {

    @Option(
        names = {"-m", "--manifest"},
        description = "Service manifest (YAML or JSON), defaults to fleet.orchestrator.manifest"
    )
    private String manifest;

    @Option(
        names = {"-s", "--state"},
        description = "Deployment state file, defaults to fleet.orchestrator.state-file"
    )
    private String stateFile;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return CommandLine.ExitCode.OK;
    }

    public String getManifest() {
        return manifest;
    }

    public String getStateFile() {
        return stateFile;
    }
}
