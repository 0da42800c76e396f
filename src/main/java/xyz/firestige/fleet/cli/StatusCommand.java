package xyz.firestige.fleet.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import xyz.firestige.fleet.application.OrchestrationService;
import xyz.firestige.fleet.application.dto.StatusEntry;
import xyz.firestige.fleet.application.dto.StatusReport;
import xyz.firestige.fleet.application.dto.SyncState;
import xyz.firestige.fleet.domain.state.HealthSnapshot;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * 输出每个服务、每种资源的部署记录及最近的健康状态
 */
@Command(name = "status", mixinStandardHelpOptions = true,
        description = "Print recorded deployment state per service and kind, plus last-known health")
public class StatusCommand implements Callable<Integer> {

    private final OrchestrationService orchestrationService;

    @ParentCommand
    private FleetCommand parent;

    @Spec
    private CommandSpec spec;

    public StatusCommand(OrchestrationService orchestrationService) {
        this.orchestrationService = orchestrationService;
    }

    @Override
    public Integer call() {
        StatusReport report = orchestrationService.status(parent.getManifest(), parent.getStateFile());
        PrintWriter out = spec.commandLine().getOut();

        out.printf("State file: %s (updated %s)%n", report.stateFile(),
                report.updatedAt() == null ? "never" : report.updatedAt());
        if (report.manifestError() != null) {
            out.printf("Manifest not compared: %s%n", report.manifestError());
        }
        out.println();
        out.printf("%-24s %-22s %-9s %-20s %s%n", "SERVICE", "KIND", "SYNC", "UPDATED", "FINGERPRINT");
        for (StatusEntry entry : report.entries()) {
            out.printf("%-24s %-22s %-9s %-20s %s%n", entry.service(), entry.kind().getWireName(),
                    entry.sync().name().toLowerCase(),
                    entry.updatedAt() == null ? "-" : entry.updatedAt().toString(),
                    entry.fingerprint() == null ? "-" : abbreviate(entry.fingerprint()));
        }

        if (!report.health().isEmpty()) {
            out.printf("%n%-24s %-9s %-20s %s%n", "SERVICE", "HEALTH", "CHECKED", "DETAIL");
            for (HealthSnapshot snapshot : report.health().values()) {
                out.printf("%-24s %-9s %-20s %s%n", snapshot.service(), snapshot.healthy() ? "healthy" : "unhealthy",
                        snapshot.checkedAt(), snapshot.detail() == null ? "" : snapshot.detail());
            }
        }
        out.printf("%n%d in sync, %d drifted, %d pending, %d orphaned.%n",
                report.count(SyncState.IN_SYNC), report.count(SyncState.DRIFTED),
                report.count(SyncState.PENDING), report.count(SyncState.ORPHANED));
        out.flush();
        return 0;
    }

    private static String abbreviate(String fingerprint) {
        return fingerprint.length() > 19 ? fingerprint.substring(0, 19) + "…" : fingerprint;
    }
}
