package xyz.firestige.fleet.infrastructure.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import xyz.firestige.fleet.domain.event.DeploymentEvent;
import xyz.firestige.fleet.domain.event.DomainEventPublisher;

/**
 * 通过 Spring 应用事件发布部署事件
 * <p>
 * 监听器在发布线程上同步执行，同一工作项的事件顺序与发布顺序一致
 */
public class SpringDomainEventPublisher implements DomainEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(SpringDomainEventPublisher.class);

    private final ApplicationEventPublisher applicationEventPublisher;

    public SpringDomainEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @Override
    public void publish(DeploymentEvent event) {
        log.debug("Publishing {} [run={}, id={}]", event.getEventName(), event.getRunId(), event.getEventId());
        applicationEventPublisher.publishEvent(event);
    }
}
