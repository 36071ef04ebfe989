package xyz.vvrf.reactor.flow.registry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.client.llm.LlmClientRegistry;
import xyz.vvrf.reactor.flow.core.Edge;
import xyz.vvrf.reactor.flow.core.FlowGraph;
import xyz.vvrf.reactor.flow.core.FlowNode;
import xyz.vvrf.reactor.flow.core.NodeDescriptor;
import xyz.vvrf.reactor.flow.core.NodeStatus;
import xyz.vvrf.reactor.flow.execution.ExecutionContext;
import xyz.vvrf.reactor.flow.node.PassthroughNode;
import xyz.vvrf.reactor.flow.test.util.TestFlows;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static xyz.vvrf.reactor.flow.test.util.TestFlows.node;

class SimpleNodeRegistryTest {

    private final SimpleNodeRegistry registry = new SimpleNodeRegistry();

    @Test
    void duplicateRegistrationIsRejected() {
        registry.register("x", PassthroughNode::new);

        assertThatThrownBy(() -> registry.register("x", PassthroughNode::new))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'x'");
        assertThat(registry.isRegistered("x")).isTrue();
        assertThat(registry.getRegisteredTypes()).containsExactly("x");
    }

    @Test
    void unknownTypeFallsBackToPassthrough() {
        FlowNode node = registry.create(NodeDescriptor.of("n", "mystery"));

        assertThat(node).isInstanceOf(PassthroughNode.class);
        assertThat(node.getType()).isEqualTo("mystery");
    }

    @Test
    void constructorReturningNullIsAnError() {
        registry.register("broken", d -> null);

        assertThatThrownBy(() -> registry.create(NodeDescriptor.of("n", "broken")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("未知类型节点在流程中原样传递输入")
    void unknownTypePassesInputThroughInAFlow() {
        TestFlows flows = new TestFlows();
        FlowGraph graph = FlowGraph.of(
                Arrays.asList(node("u", "no-such-type"), node("next", TestFlows.ECHO)),
                Collections.singletonList(Edge.of("u", "next")));

        ExecutionContext context = flows.run(graph, "hello");

        assertThat(context.getNodeState("u").getStatus()).isEqualTo(NodeStatus.SUCCESS);
        assertThat(flows.inputsOf("next")).containsExactly("hello");
    }

    @Test
    void defaultNodeTypesRegistersAllBuiltInsWhenServicesPresent() {
        TestFlows flows = new TestFlows(
                request -> Mono.empty(),
                new LlmClientRegistry(Collections.emptyList()),
                request -> Mono.empty());

        assertThat(flows.getRegistry().getRegisteredTypes()).contains(
                "input", "output", "api", "llm", "json-extractor", "web-crawler", "html-parser",
                "conditional", "group", "merger");
    }

    @Test
    void defaultNodeTypesSkipsTypesWithoutServices() {
        SimpleNodeRegistry fresh = new SimpleNodeRegistry();
        DefaultNodeTypes.registerAll(fresh, NodeServices.builder()
                .configResolver(new TestFlows().getConfigResolver())
                .build());

        assertThat(fresh.getRegisteredTypes()).containsExactlyInAnyOrder(
                "input", "output", "json-extractor", "conditional", "group", "merger");
    }
}
