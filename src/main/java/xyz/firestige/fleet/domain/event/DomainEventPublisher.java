package xyz.firestige.fleet.domain.event;

/**
 * 部署事件发布器
 * <p>
 * 执行引擎只依赖此接口，事件传输方式由基础设施层决定
 */
public interface DomainEventPublisher {

    void publish(DeploymentEvent event);
}
