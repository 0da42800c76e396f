package xyz.firestige.fleet.cli;

import org.springframework.context.ApplicationContext;
import picocli.CommandLine;

/**
 * 由 Spring 容器创建命令对象，使命令可以通过构造器注入服务
 * <p>
 * 非命令类（转换器、mixin 等）退回 picocli 默认工厂
 */
public class SpringCommandFactory implements CommandLine.IFactory {

    private final ApplicationContext applicationContext;

    public SpringCommandFactory(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
    }

    @Override
    public <K> K create(Class<K> cls) throws Exception {
        if (cls.isAnnotationPresent(CommandLine.Command.class)) {
            return applicationContext.getAutowireCapableBeanFactory().createBean(cls);
        }
        return CommandLine.defaultFactory().create(cls);
    }
}
