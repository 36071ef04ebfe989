package xyz.vvrf.reactor.flow.spring.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.flow.client.crawler.RemoteWebCrawlerClient;
import xyz.vvrf.reactor.flow.client.crawler.WebCrawlerClient;
import xyz.vvrf.reactor.flow.client.html.HtmlParser;
import xyz.vvrf.reactor.flow.client.html.JsoupHtmlParser;
import xyz.vvrf.reactor.flow.client.http.HttpGateway;
import xyz.vvrf.reactor.flow.client.http.WebClientHttpGateway;
import xyz.vvrf.reactor.flow.client.llm.LlmClient;
import xyz.vvrf.reactor.flow.client.llm.LlmClientRegistry;
import xyz.vvrf.reactor.flow.client.llm.OllamaLlmClient;
import xyz.vvrf.reactor.flow.client.llm.OpenAiLlmClient;
import xyz.vvrf.reactor.flow.config.InMemoryNodeConfigStore;
import xyz.vvrf.reactor.flow.config.NodeConfigResolver;
import xyz.vvrf.reactor.flow.config.NodeConfigStore;
import xyz.vvrf.reactor.flow.execution.FlowEngine;
import xyz.vvrf.reactor.flow.execution.NodeExecutor;
import xyz.vvrf.reactor.flow.execution.StandardFlowEngine;
import xyz.vvrf.reactor.flow.execution.StandardNodeExecutor;
import xyz.vvrf.reactor.flow.monitor.FlowMonitorListener;
import xyz.vvrf.reactor.flow.monitor.LoggingFlowMonitorListener;
import xyz.vvrf.reactor.flow.monitor.MicrometerFlowMonitorListener;
import xyz.vvrf.reactor.flow.monitor.RealtimeFlowMonitorListener;
import xyz.vvrf.reactor.flow.registry.DefaultNodeTypes;
import xyz.vvrf.reactor.flow.registry.NodeRegistry;
import xyz.vvrf.reactor.flow.registry.NodeServices;
import xyz.vvrf.reactor.flow.registry.SimpleNodeRegistry;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 流程框架的 Spring Boot 自动配置类。
 * 职责:
 * 1. 启用并绑定 {@link FlowFrameworkProperties}。
 * 2. 提供节点执行调度器 ("flowNodeExecutionScheduler")，类型由属性配置。
 * 3. 提供外部协作者（HTTP、LLM、爬虫、HTML 解析）的默认实现。
 * 4. 提供注册了全部内置节点类型的 {@link NodeRegistry}。
 * 5. 收集所有 {@link FlowMonitorListener} Bean 并创建 {@link NodeExecutor} 与 {@link FlowEngine}。
 * <p>
 * 所有 Bean 均可通过定义同类型（或同名）的 Bean 覆盖。
 */
@Configuration
@EnableConfigurationProperties(FlowFrameworkProperties.class)
@AutoConfigureAfter(name = {
        "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
})
@Slf4j
public class FlowFrameworkAutoConfiguration {

    public FlowFrameworkAutoConfiguration() {
        log.info("Reactor 流程框架自动配置 (FlowFrameworkAutoConfiguration) 已加载。");
    }

    /**
     * 提供节点执行的 Reactor Scheduler。
     * 如果已存在名为 "flowNodeExecutionScheduler" 的 Bean，则不创建此默认 Bean。
     */
    @Bean(name = "flowNodeExecutionScheduler")
    @ConditionalOnMissingBean(name = "flowNodeExecutionScheduler")
    public Scheduler flowNodeExecutionScheduler(FlowFrameworkProperties properties) {
        FlowFrameworkProperties.SchedulerProps schedulerProps = properties.getScheduler();
        String namePrefix = schedulerProps.getNamePrefix();

        switch (schedulerProps.getType()) {
            case PARALLEL:
                int parallelism = schedulerProps.getParallel().getParallelism();
                log.info("正在创建 'flowNodeExecutionScheduler' (Parallel): prefix={}, parallelism={}", namePrefix, parallelism);
                return Schedulers.newParallel(namePrefix, parallelism, true);
            case SINGLE:
                log.info("正在创建 'flowNodeExecutionScheduler' (Single): prefix={}", namePrefix);
                return Schedulers.newSingle(namePrefix, true);
            case IMMEDIATE:
                log.info("使用 Schedulers.immediate() 作为 'flowNodeExecutionScheduler'，节点在调用线程上执行。");
                return Schedulers.immediate();
            case BOUNDED_ELASTIC:
            default:
                FlowFrameworkProperties.BoundedElasticProps beProps = schedulerProps.getBoundedElastic();
                log.info("正在创建 'flowNodeExecutionScheduler' (BoundedElastic): prefix={}, cap={}, queue={}, ttl={}s",
                        namePrefix, beProps.getThreadCap(), beProps.getQueuedTaskCap(), beProps.getTtlSeconds());
                return Schedulers.newBoundedElastic(beProps.getThreadCap(), beProps.getQueuedTaskCap(),
                        namePrefix, beProps.getTtlSeconds(), true);
        }
    }

    @Bean
    @ConditionalOnMissingBean(ObjectMapper.class)
    public ObjectMapper flowObjectMapper() {
        return new ObjectMapper();
    }

    @Bean
    @ConditionalOnMissingBean(NodeConfigStore.class)
    public InMemoryNodeConfigStore flowNodeConfigStore() {
        return new InMemoryNodeConfigStore();
    }

    @Bean
    @ConditionalOnMissingBean(NodeConfigResolver.class)
    public NodeConfigResolver flowNodeConfigResolver(ObjectMapper objectMapper, NodeConfigStore configStore) {
        return new NodeConfigResolver(objectMapper, configStore);
    }

    @Bean
    @ConditionalOnMissingBean(HttpGateway.class)
    public HttpGateway flowHttpGateway(ObjectProvider<WebClient.Builder> webClientBuilder,
                                       ObjectMapper objectMapper,
                                       FlowFrameworkProperties properties) {
        WebClient webClient = webClientBuilder.getIfAvailable(WebClient::builder).build();
        return new WebClientHttpGateway(webClient, objectMapper, properties.getHttp().getTimeout());
    }

    @Bean
    @ConditionalOnMissingBean(LlmClientRegistry.class)
    public LlmClientRegistry flowLlmClientRegistry(ObjectProvider<WebClient.Builder> webClientBuilder,
                                                   ObjectProvider<LlmClient> additionalClients,
                                                   FlowFrameworkProperties properties) {
        FlowFrameworkProperties.Llm llm = properties.getLlm();
        WebClient webClient = webClientBuilder.getIfAvailable(WebClient::builder).build();
        LlmClientRegistry registry = new LlmClientRegistry(Arrays.asList(
                new OllamaLlmClient(webClient, llm.getOllamaUrl(), llm.getTimeout()),
                new OpenAiLlmClient(webClient, llm.getOpenaiUrl(), llm.getOpenaiApiKey(), llm.getTimeout())));
        additionalClients.orderedStream().forEach(registry::register);
        log.info("LLM providers available: {}", registry.getProviders());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean(WebCrawlerClient.class)
    public WebCrawlerClient flowWebCrawlerClient(ObjectProvider<WebClient.Builder> webClientBuilder,
                                                 FlowFrameworkProperties properties) {
        WebClient webClient = webClientBuilder.getIfAvailable(WebClient::builder)
                .baseUrl(properties.getCrawler().getBaseUrl())
                .build();
        return new RemoteWebCrawlerClient(webClient, properties.getCrawler().getExtraTimeout());
    }

    @Bean
    @ConditionalOnMissingBean(HtmlParser.class)
    public HtmlParser flowHtmlParser() {
        return new JsoupHtmlParser();
    }

    /**
     * 注册了全部内置节点类型的注册表。用户可注入此 Bean 注册自定义类型。
     */
    @Bean
    @ConditionalOnMissingBean(NodeRegistry.class)
    public NodeRegistry flowNodeRegistry(NodeConfigResolver configResolver,
                                         HttpGateway httpGateway,
                                         LlmClientRegistry llmClients,
                                         WebCrawlerClient webCrawlerClient,
                                         HtmlParser htmlParser) {
        SimpleNodeRegistry registry = new SimpleNodeRegistry();
        DefaultNodeTypes.registerAll(registry, NodeServices.builder()
                .configResolver(configResolver)
                .httpGateway(httpGateway)
                .llmClients(llmClients)
                .webCrawlerClient(webCrawlerClient)
                .htmlParser(htmlParser)
                .build());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean(LoggingFlowMonitorListener.class)
    @ConditionalOnProperty(prefix = "flow.monitor", name = "logging-enabled", havingValue = "true", matchIfMissing = true)
    public LoggingFlowMonitorListener flowLoggingMonitorListener() {
        return new LoggingFlowMonitorListener();
    }

    @Bean
    @ConditionalOnMissingBean(RealtimeFlowMonitorListener.class)
    @ConditionalOnProperty(prefix = "flow.monitor", name = "realtime-enabled", havingValue = "true")
    public RealtimeFlowMonitorListener flowRealtimeMonitorListener(FlowFrameworkProperties properties) {
        return new RealtimeFlowMonitorListener(properties.getMonitor().getRealtimeRetention(), Schedulers.boundedElastic());
    }

    /**
     * 收集在应用上下文中定义的所有 FlowMonitorListener Bean，作为名为 "flowMonitorListeners" 的不可变列表 Bean 提供。
     */
    @Bean(name = "flowMonitorListeners")
    @ConditionalOnMissingBean(name = "flowMonitorListeners")
    public List<FlowMonitorListener> flowMonitorListeners(ObjectProvider<FlowMonitorListener> listenersProvider) {
        List<FlowMonitorListener> listeners = listenersProvider.orderedStream().collect(Collectors.toList());
        if (listeners.isEmpty()) {
            log.info("在 Spring 上下文中未找到 FlowMonitorListener Bean。");
        } else {
            log.info("收集到 {} 个 FlowMonitorListener Bean: {}", listeners.size(),
                    listeners.stream().map(l -> l.getClass().getSimpleName()).collect(Collectors.joining(", ")));
        }
        return Collections.unmodifiableList(listeners);
    }

    @Bean
    @ConditionalOnMissingBean(NodeExecutor.class)
    public NodeExecutor flowNodeExecutor(NodeRegistry nodeRegistry,
                                         @Qualifier("flowNodeExecutionScheduler") Scheduler flowNodeExecutionScheduler,
                                         @Qualifier("flowMonitorListeners") List<FlowMonitorListener> flowMonitorListeners) {
        return new StandardNodeExecutor(nodeRegistry, flowNodeExecutionScheduler, flowMonitorListeners);
    }

    @Bean
    @ConditionalOnMissingBean(FlowEngine.class)
    public FlowEngine flowEngine(NodeExecutor nodeExecutor,
                                 @Qualifier("flowMonitorListeners") List<FlowMonitorListener> flowMonitorListeners) {
        return new StandardFlowEngine(nodeExecutor, flowMonitorListeners);
    }

    @Configuration
    @ConditionalOnClass(MeterRegistry.class)
    static class MicrometerMonitorConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean(MicrometerFlowMonitorListener.class)
        public MicrometerFlowMonitorListener flowMicrometerMonitorListener(MeterRegistry meterRegistry) {
            return new MicrometerFlowMonitorListener(meterRegistry);
        }
    }
}
