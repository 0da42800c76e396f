package xyz.firestige.fleet.application.dto;

import xyz.firestige.fleet.domain.graph.PhaseGraph;
import xyz.firestige.fleet.domain.manifest.Manifest;
import xyz.firestige.fleet.domain.plan.DeploymentPlan;

import java.nio.file.Path;

public record PlanResult(Manifest manifest, PhaseGraph graph, DeploymentPlan plan, Path stateFile) {
}
