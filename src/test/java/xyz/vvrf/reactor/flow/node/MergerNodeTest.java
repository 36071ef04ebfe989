package xyz.vvrf.reactor.flow.node;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import xyz.vvrf.reactor.flow.core.Edge;
import xyz.vvrf.reactor.flow.core.FlowGraph;
import xyz.vvrf.reactor.flow.core.NodeDescriptor;
import xyz.vvrf.reactor.flow.core.NodeStatus;
import xyz.vvrf.reactor.flow.execution.ExecutionContext;
import xyz.vvrf.reactor.flow.execution.ExecutionScope;
import xyz.vvrf.reactor.flow.test.util.TestFlows;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static xyz.vvrf.reactor.flow.test.util.TestFlows.config;
import static xyz.vvrf.reactor.flow.test.util.TestFlows.node;

class MergerNodeTest {

    private final TestFlows flows = new TestFlows();

    @Test
    @DisplayName("每次到达都向下游传播当前累积列表")
    void reEmitsGrowingListOnEveryArrival() {
        FlowGraph graph = FlowGraph.of(
                Arrays.asList(
                        node("src", TestFlows.ECHO),
                        node("x", JsonExtractorNode.TYPE, "path", "x"),
                        node("y", JsonExtractorNode.TYPE, "path", "y"),
                        node("z", JsonExtractorNode.TYPE, "path", "z"),
                        node("m", MergerNode.TYPE),
                        node("after", TestFlows.ECHO)),
                Arrays.asList(
                        Edge.of("src", "x"), Edge.of("src", "y"), Edge.of("src", "z"),
                        Edge.of("x", "m"), Edge.of("y", "m"), Edge.of("z", "m"),
                        Edge.of("m", "after")));

        ExecutionContext context = flows.run(graph, config("x", 1, "y", 2, "z", 3));

        assertThat(flows.inputsOf("after")).containsExactly(
                Collections.singletonList(1), Arrays.asList(1, 2), Arrays.asList(1, 2, 3));
        assertThat(context.getOutput("m")).hasSize(3);
    }

    @Test
    void collectionInputsAreFlattened() {
        MergerNode merger = new MergerNode(NodeDescriptor.of("m", MergerNode.TYPE), flows.getConfigResolver());
        ExecutionScope scope = flows.newScope();

        StepVerifier.create(merger.execute(Arrays.asList("a", "b"), scope))
                .expectNext(Arrays.asList("a", "b"))
                .verifyComplete();
        StepVerifier.create(merger.execute(null, scope))
                .expectNext(Arrays.asList("a", "b"))
                .verifyComplete();
        StepVerifier.create(merger.execute("c", scope))
                .expectNext(Arrays.asList("a", "b", "c"))
                .verifyComplete();

        merger.reset();
        assertThat(merger.getItems()).isEmpty();
    }

    @Test
    @DisplayName("object 策略按配置键、id、item_<i> 依次取键")
    void objectStrategyKeysItems() {
        MergerNode merger = new MergerNode(
                NodeDescriptor.of("m", MergerNode.TYPE, config("strategy", "object", "keys", Collections.singletonList("name"))),
                flows.getConfigResolver());
        ExecutionScope scope = flows.newScope();

        merger.execute(config("name", "alpha", "v", 1), scope).block();
        merger.execute(config("id", 7, "v", 2), scope).block();
        Object result = merger.execute("plain", scope).block();

        assertThat(result).isInstanceOf(Map.class);
        @SuppressWarnings("unchecked")
        Map<String, Object> keyed = (Map<String, Object>) result;
        assertThat(keyed).containsOnlyKeys("alpha", "7", "item_2");
        assertThat(keyed.get("item_2")).isEqualTo("plain");
    }

    @Test
    void objectStrategyKeyedById() {
        MergerNode merger = new MergerNode(
                NodeDescriptor.of("m", MergerNode.TYPE, config("strategy", "object", "keys", Collections.singletonList("id"))),
                flows.getConfigResolver());
        ExecutionScope scope = flows.newScope();
        Map<String, Object> x = config("id", "x", "v", 1);
        Map<String, Object> y = config("id", "y", "v", 2);

        merger.execute(x, scope).block();
        Object result = merger.execute(y, scope).block();

        Map<String, Object> expected = new LinkedHashMap<>();
        expected.put("x", x);
        expected.put("y", y);
        assertThat(result).isEqualTo(expected);
    }

    @Test
    void sameInputAgainGrowsList() {
        MergerNode merger = new MergerNode(NodeDescriptor.of("m", MergerNode.TYPE), flows.getConfigResolver());
        ExecutionScope scope = flows.newScope();

        StepVerifier.create(merger.execute("a", scope))
                .expectNext(Collections.singletonList("a"))
                .verifyComplete();
        StepVerifier.create(merger.execute("a", scope))
                .expectNext(Arrays.asList("a", "a"))
                .verifyComplete();
        assertThat(scope.getContext().getOutput("m"))
                .containsExactly(Collections.singletonList("a"), Arrays.asList("a", "a"));
    }

    @RepeatedTest(50)
    @DisplayName("并行调度下输出列表与最终状态仍按到达顺序递增")
    void concurrentArrivalsStoreInMergeOrder() {
        FlowGraph graph = FlowGraph.of(
                Arrays.asList(
                        node("src", TestFlows.ECHO),
                        node("p0", TestFlows.ECHO), node("p1", TestFlows.ECHO),
                        node("p2", TestFlows.ECHO), node("p3", TestFlows.ECHO),
                        node("m", MergerNode.TYPE)),
                Arrays.asList(
                        Edge.of("src", "p0"), Edge.of("src", "p1"), Edge.of("src", "p2"), Edge.of("src", "p3"),
                        Edge.of("p0", "m"), Edge.of("p1", "m"), Edge.of("p2", "m"), Edge.of("p3", "m")));

        ExecutionContext context = flows.engine(Schedulers.boundedElastic())
                .executeAll(graph, "v")
                .block(Duration.ofSeconds(10));

        List<Object> outputs = context.getOutput("m");
        assertThat(outputs).hasSize(4);
        for (int i = 0; i < outputs.size(); i++) {
            assertThat((List<?>) outputs.get(i)).hasSize(i + 1);
        }
        assertThat((List<?>) context.getNodeState("m").getResult()).hasSize(4);
        assertThat(context.getNodeState("m").getStatus()).isEqualTo(NodeStatus.SUCCESS);
    }
}
