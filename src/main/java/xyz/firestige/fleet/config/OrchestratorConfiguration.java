package xyz.firestige.fleet.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;
import picocli.CommandLine;
import xyz.firestige.fleet.application.OrchestrationService;
import xyz.firestige.fleet.cli.CliRunner;
import xyz.firestige.fleet.cli.SpringCommandFactory;
import xyz.firestige.fleet.domain.event.DomainEventPublisher;
import xyz.firestige.fleet.domain.graph.DependencyGraphBuilder;
import xyz.firestige.fleet.domain.plan.DiffEngine;
import xyz.firestige.fleet.domain.plan.FingerprintCalculator;
import xyz.firestige.fleet.infrastructure.event.DeploymentProgressListener;
import xyz.firestige.fleet.infrastructure.event.SpringDomainEventPublisher;
import xyz.firestige.fleet.infrastructure.execution.ExecutionSettingsResolver;
import xyz.firestige.fleet.infrastructure.execution.PhasedExecutionEngine;
import xyz.firestige.fleet.infrastructure.execution.WorkItemDispatcher;
import xyz.firestige.fleet.infrastructure.execution.WorkItemExecutor;
import xyz.firestige.fleet.infrastructure.external.CommandConfigurationApplier;
import xyz.firestige.fleet.infrastructure.external.CommandIdentityProviderClient;
import xyz.firestige.fleet.infrastructure.external.CommandProvisioningBackend;
import xyz.firestige.fleet.infrastructure.external.ConfigurationApplier;
import xyz.firestige.fleet.infrastructure.external.EnvironmentSecretResolver;
import xyz.firestige.fleet.infrastructure.external.ExternalCommandInvoker;
import xyz.firestige.fleet.infrastructure.external.IdentityProviderClient;
import xyz.firestige.fleet.infrastructure.external.ProvisioningBackend;
import xyz.firestige.fleet.infrastructure.external.SecretResolver;
import xyz.firestige.fleet.infrastructure.health.CommandProbeRunner;
import xyz.firestige.fleet.infrastructure.health.HealthCheckService;
import xyz.firestige.fleet.infrastructure.health.HttpProbeRunner;
import xyz.firestige.fleet.infrastructure.health.RoutingProbeRunner;
import xyz.firestige.fleet.infrastructure.manifest.ManifestBinder;
import xyz.firestige.fleet.infrastructure.manifest.ManifestLoader;
import xyz.firestige.fleet.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.fleet.infrastructure.metrics.MicrometerMetricsRegistry;
import xyz.firestige.fleet.infrastructure.persistence.StateStoreProvider;
import xyz.firestige.fleet.validation.ValidationChain;
import xyz.firestige.fleet.validation.validator.AddressConflictValidator;
import xyz.firestige.fleet.validation.validator.DependencyCycleValidator;
import xyz.firestige.fleet.validation.validator.DependencyReferenceValidator;
import xyz.firestige.fleet.validation.validator.PhaseAssignmentValidator;
import xyz.firestige.fleet.validation.validator.PortRangeValidator;
import xyz.firestige.fleet.validation.validator.ProxyDomainUniquenessValidator;
import xyz.firestige.fleet.validation.validator.RequiredFieldsValidator;

import java.time.Duration;
import java.util.List;

/**
 * 编排器装配
 * <p>
 * 外部协作方与凭据解析均可由使用方提供同类型 Bean 覆盖（测试中替换为桩实现）
 */
@Configuration
@EnableConfigurationProperties(OrchestratorProperties.class)
public class OrchestratorConfiguration {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfiguration.class);

    // ====== 清单 ======

    @Bean
    public ValidationChain manifestValidationChain() {
        ValidationChain chain = new ValidationChain(false);
        chain.addValidators(List.of(
                new RequiredFieldsValidator(),
                new DependencyReferenceValidator(),
                new DependencyCycleValidator(),
                new PortRangeValidator(),
                new ProxyDomainUniquenessValidator(),
                new AddressConflictValidator(),
                new PhaseAssignmentValidator()));
        return chain;
    }

    @Bean
    public ManifestLoader manifestLoader(ObjectMapper objectMapper, ValidationChain manifestValidationChain,
                                         OrchestratorProperties properties) {
        OrchestratorProperties.Health health = properties.getHealth();
        ManifestBinder binder = new ManifestBinder(objectMapper,
                health.getIntervalSeconds(), health.getTimeoutSeconds(), health.getRetries());
        return new ManifestLoader(binder, manifestValidationChain);
    }

    // ====== 规划 ======

    @Bean
    public DependencyGraphBuilder dependencyGraphBuilder() {
        return new DependencyGraphBuilder();
    }

    @Bean
    public FingerprintCalculator fingerprintCalculator() {
        return new FingerprintCalculator();
    }

    @Bean
    public DiffEngine diffEngine(FingerprintCalculator fingerprintCalculator) {
        return new DiffEngine(fingerprintCalculator);
    }

    @Bean
    public StateStoreProvider stateStoreProvider(OrchestratorProperties properties) {
        log.info("State store: type={}, file={}", properties.getStoreType(), properties.getStateFile());
        return new StateStoreProvider(properties);
    }

    // ====== 外部协作方 ======

    @Bean
    @ConditionalOnMissingBean
    public SecretResolver secretResolver() {
        return new EnvironmentSecretResolver();
    }

    @Bean
    public ExternalCommandInvoker externalCommandInvoker(ObjectMapper objectMapper) {
        return new ExternalCommandInvoker(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProvisioningBackend provisioningBackend(OrchestratorProperties properties, ExternalCommandInvoker invoker,
                                                   SecretResolver secretResolver) {
        return new CommandProvisioningBackend(properties.getCollaborators().getProvisioning(), invoker, secretResolver);
    }

    @Bean
    @ConditionalOnMissingBean
    public IdentityProviderClient identityProviderClient(OrchestratorProperties properties, ExternalCommandInvoker invoker,
                                                         SecretResolver secretResolver) {
        return new CommandIdentityProviderClient(properties.getCollaborators().getIdentityProvider(), invoker, secretResolver);
    }

    @Bean
    @ConditionalOnMissingBean
    public ConfigurationApplier configurationApplier(OrchestratorProperties properties, ExternalCommandInvoker invoker,
                                                     SecretResolver secretResolver) {
        return new CommandConfigurationApplier(properties.getCollaborators().getConfiguration(), invoker, secretResolver);
    }

    // ====== 健康检查 ======

    @Bean
    @ConditionalOnMissingBean
    public RestTemplate healthRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Bean(destroyMethod = "close")
    public HealthCheckService healthCheckService(RestTemplate healthRestTemplate, OrchestratorProperties properties) {
        RoutingProbeRunner runner = new RoutingProbeRunner(new HttpProbeRunner(healthRestTemplate), new CommandProbeRunner());
        return new HealthCheckService(runner, properties.getHealth().getProbeThreads());
    }

    // ====== 执行 ======

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public MetricsRegistry metricsRegistry(MeterRegistry meterRegistry) {
        return new MicrometerMetricsRegistry(meterRegistry);
    }

    @Bean
    @ConditionalOnMissingBean(DomainEventPublisher.class)
    public DomainEventPublisher domainEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        return new SpringDomainEventPublisher(applicationEventPublisher);
    }

    @Bean
    public DeploymentProgressListener deploymentProgressListener(MetricsRegistry metricsRegistry) {
        return new DeploymentProgressListener(metricsRegistry);
    }

    @Bean
    public WorkItemDispatcher workItemDispatcher(ProvisioningBackend provisioningBackend,
                                                 IdentityProviderClient identityProviderClient,
                                                 ConfigurationApplier configurationApplier,
                                                 SecretResolver secretResolver) {
        return new WorkItemDispatcher(provisioningBackend, identityProviderClient, configurationApplier, secretResolver);
    }

    @Bean
    public WorkItemExecutor workItemExecutor(WorkItemDispatcher dispatcher, HealthCheckService healthCheckService,
                                             DomainEventPublisher domainEventPublisher, MetricsRegistry metricsRegistry) {
        return new WorkItemExecutor(dispatcher, healthCheckService, domainEventPublisher, metricsRegistry);
    }

    @Bean
    public PhasedExecutionEngine phasedExecutionEngine(WorkItemDispatcher dispatcher, WorkItemExecutor executor,
                                                       DomainEventPublisher domainEventPublisher,
                                                       MetricsRegistry metricsRegistry,
                                                       OrchestratorProperties properties) {
        return new PhasedExecutionEngine(dispatcher, executor, domainEventPublisher, metricsRegistry,
                properties.getCancellationGrace());
    }

    @Bean
    public ExecutionSettingsResolver executionSettingsResolver(OrchestratorProperties properties) {
        return new ExecutionSettingsResolver(properties);
    }

    // ====== 应用 ======

    @Bean
    public OrchestrationService orchestrationService(OrchestratorProperties properties,
                                                     ManifestLoader manifestLoader,
                                                     DependencyGraphBuilder dependencyGraphBuilder,
                                                     DiffEngine diffEngine,
                                                     FingerprintCalculator fingerprintCalculator,
                                                     StateStoreProvider stateStoreProvider,
                                                     ExecutionSettingsResolver executionSettingsResolver,
                                                     PhasedExecutionEngine phasedExecutionEngine) {
        return new OrchestrationService(properties, manifestLoader, dependencyGraphBuilder, diffEngine,
                fingerprintCalculator, stateStoreProvider, executionSettingsResolver, phasedExecutionEngine);
    }

    @Bean
    public CommandLine.IFactory commandFactory(ApplicationContext applicationContext) {
        return new SpringCommandFactory(applicationContext);
    }

    @Bean
    @ConditionalOnProperty(name = "fleet.cli.enabled", havingValue = "true", matchIfMissing = true)
    public CliRunner cliRunner(CommandLine.IFactory commandFactory) {
        return new CliRunner(commandFactory);
    }
}
