package xyz.firestige.fleet.cli;

import picocli.CommandLine.Option;
import xyz.firestige.fleet.domain.plan.DiffOptions;

import java.util.ArrayList;
import java.util.List;

/**
 * plan / apply 共用的服务选择选项
 */
public class SelectionOptions {

    @Option(
        names = {"--only"},
        split = ",",
        paramLabel = "SERVICE",
        description = "Restrict the plan to these services (dependents are not pulled in)"
    )
    private List<String> only = new ArrayList<>();

    @Option(
        names = {"--skip"},
        split = ",",
        paramLabel = "SERVICE",
        description = "Emit skip items for these services instead of create/update"
    )
    private List<String> skip = new ArrayList<>();

    @Option(
        names = {"--force"},
        split = ",",
        paramLabel = "SERVICE",
        description = "Re-apply these services even when their fingerprints are unchanged"
    )
    private List<String> force = new ArrayList<>();

    public DiffOptions toDiffOptions() {
        return DiffOptions.of(only, skip, force);
    }
}
