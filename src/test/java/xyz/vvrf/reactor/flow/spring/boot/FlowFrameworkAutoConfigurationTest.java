package xyz.vvrf.reactor.flow.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.flow.core.Edge;
import xyz.vvrf.reactor.flow.core.FlowGraph;
import xyz.vvrf.reactor.flow.core.NodeStatus;
import xyz.vvrf.reactor.flow.execution.ExecutionContext;
import xyz.vvrf.reactor.flow.execution.FlowEngine;
import xyz.vvrf.reactor.flow.monitor.FlowMonitorListener;
import xyz.vvrf.reactor.flow.monitor.LoggingFlowMonitorListener;
import xyz.vvrf.reactor.flow.monitor.MicrometerFlowMonitorListener;
import xyz.vvrf.reactor.flow.monitor.RealtimeFlowMonitorListener;
import xyz.vvrf.reactor.flow.registry.NodeRegistry;
import xyz.vvrf.reactor.flow.registry.SimpleNodeRegistry;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static xyz.vvrf.reactor.flow.test.util.TestFlows.node;

class FlowFrameworkAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(FlowFrameworkAutoConfiguration.class));

    @Test
    void defaultsRegisterAllBuiltInNodeTypes() {
        runner.run(context -> {
            assertThat(context).hasSingleBean(FlowEngine.class);
            assertThat(context).hasSingleBean(LoggingFlowMonitorListener.class);
            assertThat(context).doesNotHaveBean(RealtimeFlowMonitorListener.class);
            assertThat(context).doesNotHaveBean(MicrometerFlowMonitorListener.class);
            assertThat(context.getBean(NodeRegistry.class).getRegisteredTypes()).containsExactlyInAnyOrder(
                    "conditional", "group", "merger", "input", "output", "json-extractor",
                    "api", "llm", "web-crawler", "html-parser");
        });
    }

    @Test
    void propertiesBindToNestedGroups() {
        runner.withPropertyValues(
                        "flow.http.timeout=5s",
                        "flow.llm.openai-api-key=sk-secret",
                        "flow.crawler.base-url=http://crawler:9000")
                .run(context -> {
                    FlowFrameworkProperties properties = context.getBean(FlowFrameworkProperties.class);
                    assertThat(properties.getHttp().getTimeout()).isEqualTo(Duration.ofSeconds(5));
                    assertThat(properties.getCrawler().getBaseUrl()).isEqualTo("http://crawler:9000");
                    assertThat(properties.getLlm().getOllamaUrl()).isEqualTo("http://localhost:11434");
                    assertThat(properties.toString()).doesNotContain("sk-secret");
                });
    }

    @Test
    void listenersFollowMonitorProperties() {
        runner.withPropertyValues("flow.monitor.logging-enabled=false", "flow.monitor.realtime-enabled=true")
                .withUserConfiguration(MeterRegistryConfig.class)
                .run(context -> {
                    assertThat(context).doesNotHaveBean(LoggingFlowMonitorListener.class);
                    assertThat(context).hasSingleBean(RealtimeFlowMonitorListener.class);
                    assertThat(context).hasSingleBean(MicrometerFlowMonitorListener.class);
                    @SuppressWarnings("unchecked")
                    List<FlowMonitorListener> listeners =
                            (List<FlowMonitorListener>) context.getBean("flowMonitorListeners");
                    assertThat(listeners).hasSize(2);
                });
    }

    @Test
    void immediateSchedulerRunsGraphEndToEnd() {
        runner.withPropertyValues("flow.scheduler.type=IMMEDIATE").run(context -> {
            assertThat(context.getBean("flowNodeExecutionScheduler", Scheduler.class)).isSameAs(Schedulers.immediate());

            FlowGraph graph = FlowGraph.of(
                    Arrays.asList(node("in", "input"), node("out", "output")),
                    Arrays.asList(Edge.of("in", "out")));
            ExecutionContext result = context.getBean(FlowEngine.class)
                    .executeAll(graph, "hello")
                    .block(Duration.ofSeconds(5));

            assertThat(result.getNodeState("out").getStatus()).isEqualTo(NodeStatus.SUCCESS);
            // input 节点以批量模式输出列表
            assertThat(result.getDisplayContent("out")).hasValueSatisfying(text -> assertThat(text).contains("\"hello\""));
        });
    }

    @Test
    void userRegistryTakesPrecedence() {
        runner.withUserConfiguration(CustomRegistryConfig.class).run(context -> {
            assertThat(context).hasSingleBean(NodeRegistry.class);
            assertThat(context.getBean(NodeRegistry.class).getRegisteredTypes()).isEmpty();
        });
    }

    @Configuration
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class CustomRegistryConfig {
        @Bean
        NodeRegistry customNodeRegistry() {
            return new SimpleNodeRegistry();
        }
    }
}
