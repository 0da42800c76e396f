package xyz.firestige.fleet.infrastructure.event;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import xyz.firestige.fleet.domain.event.PhaseStartedEvent;
import xyz.firestige.fleet.domain.event.WorkItemFailedEvent;
import xyz.firestige.fleet.domain.event.WorkItemSucceededEvent;
import xyz.firestige.fleet.domain.manifest.DeploymentPhase;
import xyz.firestige.fleet.domain.plan.WorkAction;
import xyz.firestige.fleet.domain.plan.WorkItem;
import xyz.firestige.fleet.domain.state.ResourceKind;
import xyz.firestige.fleet.exception.ErrorType;
import xyz.firestige.fleet.exception.FailureInfo;
import xyz.firestige.fleet.infrastructure.metrics.MicrometerMetricsRegistry;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DeploymentProgressListenerTest {

    @Test
    void testPhaseProgressGauge() {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        DeploymentProgressListener listener = new DeploymentProgressListener(new MicrometerMetricsRegistry(meterRegistry));

        listener.onPhaseStarted(new PhaseStartedEvent("run-1", DeploymentPhase.APPLICATION_ROLLOUT, 4));
        assertEquals(0.0, meterRegistry.get("fleet_phase_progress").gauge().value());

        listener.onItemSucceeded(new WorkItemSucceededEvent("run-1", item("grafana"), 1, Duration.ofMillis(5)));
        listener.onItemFailed(new WorkItemFailedEvent("run-1", item("wiki"), 3,
                FailureInfo.of(ErrorType.FATAL_APPLY_ERROR, "quota exceeded", "wiki/container")));

        assertEquals(0.5, meterRegistry.get("fleet_phase_progress").gauge().value(), 1e-9);
    }

    private static WorkItem item(String service) {
        return new WorkItem(service, ResourceKind.CONTAINER, WorkAction.CREATE,
                DeploymentPhase.APPLICATION_ROLLOUT, 1, "sha256:0", "new");
    }
}
