package xyz.firestige.fleet.application.dto;

import xyz.firestige.fleet.infrastructure.execution.RunReport;

public record ApplyResult(PlanResult plan, RunReport report) {

    public int exitCode() {
        return report.exitCode();
    }
}
