package xyz.firestige.fleet.domain.event;

import java.time.Instant;
import java.util.UUID;

/**
 * 部署领域事件基类
 */
public abstract class DeploymentEvent {

    private final String eventId;
    private final Instant timestamp;
    private final String runId;
    private final String message;

    protected DeploymentEvent(String runId, String message) {
        this.eventId = UUID.randomUUID().toString();
        this.timestamp = Instant.now();
        this.runId = runId;
        this.message = message;
    }

    public String getEventName() {
        return this.getClass().getSimpleName();
    }

    public String getEventId() {
        return eventId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getRunId() {
        return runId;
    }

    public String getMessage() {
        return message;
    }
}
