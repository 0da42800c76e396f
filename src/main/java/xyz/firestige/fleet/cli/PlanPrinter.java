package xyz.firestige.fleet.cli;

import xyz.firestige.fleet.domain.manifest.DeploymentPhase;
import xyz.firestige.fleet.domain.plan.DeploymentPlan;
import xyz.firestige.fleet.domain.plan.WorkItem;
import xyz.firestige.fleet.domain.state.DeploymentRecord;
import xyz.firestige.fleet.exception.CycleException;
import xyz.firestige.fleet.exception.ManifestValidationException;
import xyz.firestige.fleet.infrastructure.execution.PhaseResult;
import xyz.firestige.fleet.infrastructure.execution.RunReport;
import xyz.firestige.fleet.infrastructure.execution.WorkItemResult;
import xyz.firestige.fleet.validation.ValidationError;

import java.io.PrintWriter;
import java.util.List;

/**
 * 命令行输出格式
 */
final class PlanPrinter {

    private PlanPrinter() {
    }

    static void printPlan(PrintWriter out, DeploymentPlan plan) {
        if (plan.isEmpty()) {
            out.println("No changes. Deployment state matches the manifest.");
        } else {
            DeploymentPhase current = null;
            for (WorkItem item : plan.getItems()) {
                if (item.phase() != current) {
                    current = item.phase();
                    out.printf("%n[%s] %s%n", current.getManifestKey(), current.getDescription());
                }
                out.printf("  %-7s %-24s %-22s layer=%d  %s%n",
                        item.action().getValue(), item.service(), item.kind().getWireName(), item.layer(), item.reason());
            }
            out.printf("%nPlan: %d create, %d update, %d skip.%n",
                    count(plan, "create"), count(plan, "update"), count(plan, "skip"));
        }
        printOrphans(out, plan.getOrphans());
        out.flush();
    }

    static void printOrphans(PrintWriter out, List<DeploymentRecord> orphans) {
        if (orphans.isEmpty()) {
            return;
        }
        out.printf("%nOrphaned records (remove with 'fleet decommission <service>'):%n");
        for (DeploymentRecord record : orphans) {
            out.printf("  %-24s %-22s %s%n", record.service(), record.kind().getWireName(), record.updatedAt());
        }
    }

    static void printReport(PrintWriter out, RunReport report) {
        out.printf("%nRun %s: %s (%d ms)%n", report.runId(), report.outcome(), report.duration().toMillis());
        if (report.failure() != null) {
            out.printf("  %s%n", report.failure().getErrorMessage());
        }
        for (PhaseResult phase : report.phases()) {
            out.printf("[%s] %s%n", phase.phase().getManifestKey(), phase.started() ? (phase.passed() ? "passed" : "failed") : "not started");
            for (WorkItemResult result : phase.results()) {
                String detail = result.failure() == null ? "" : "  " + result.failure().getErrorMessage();
                out.printf("  %-15s %-24s %-22s attempts=%d%s%n", result.status(), result.item().service(),
                        result.item().kind().getWireName(), result.attempts(), detail);
            }
        }
        out.flush();
    }

    static void printViolations(PrintWriter err, ManifestValidationException e) {
        err.printf("Manifest is invalid (%d violation(s)):%n", e.getErrors().size());
        for (ValidationError error : e.getErrors()) {
            err.printf("  %s: %s [%s]%n", error.getField(), error.getMessage(), error.getErrorCode());
        }
        err.flush();
    }

    static void printCycle(PrintWriter err, CycleException e) {
        err.printf("Dependency cycle: %s%n", String.join(" -> ", e.getCyclePath()));
        err.flush();
    }

    private static long count(DeploymentPlan plan, String action) {
        return plan.getItems().stream().filter(i -> i.action().getValue().equals(action)).count();
    }
}
