package xyz.firestige.fleet.support;

import xyz.firestige.fleet.domain.event.DeploymentEvent;
import xyz.firestige.fleet.domain.event.DomainEventPublisher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 按发布顺序记录部署事件
 */
public class RecordingEventPublisher implements DomainEventPublisher {

    private final List<DeploymentEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void publish(DeploymentEvent event) {
        events.add(event);
    }

    public List<DeploymentEvent> getPublishedEvents() {
        return List.copyOf(events);
    }

    public <T extends DeploymentEvent> List<T> getEventsOfType(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }

    public boolean hasEvent(Class<? extends DeploymentEvent> type) {
        return events.stream().anyMatch(type::isInstance);
    }

    /**
     * 事件名序列，用于断言发布顺序
     */
    public List<String> eventNames() {
        return events.stream().map(DeploymentEvent::getEventName).toList();
    }
}
