package xyz.vvrf.reactor.flow.node;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.flow.core.Edge;
import xyz.vvrf.reactor.flow.core.FlowGraph;
import xyz.vvrf.reactor.flow.core.NodeDescriptor;
import xyz.vvrf.reactor.flow.core.NodeStatus;
import xyz.vvrf.reactor.flow.execution.ExecutionContext;
import xyz.vvrf.reactor.flow.test.util.TestFlows;

import java.util.Arrays;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static xyz.vvrf.reactor.flow.test.util.TestFlows.config;
import static xyz.vvrf.reactor.flow.test.util.TestFlows.node;

class ConditionalNodeTest {

    private final TestFlows flows = new TestFlows();

    private FlowGraph branch(NodeDescriptor condition) {
        return FlowGraph.of(
                Arrays.asList(condition, node("yes", TestFlows.ECHO), node("no", TestFlows.ECHO), node("plain", TestFlows.ECHO)),
                Arrays.asList(
                        Edge.of("cond", "yes", Edge.TRUE_HANDLE),
                        Edge.of("cond", "no", Edge.FALSE_HANDLE),
                        Edge.of("cond", "plain")));
    }

    @Test
    @DisplayName("5 > 3 走 true 分支，子节点收到原始输入")
    void trueBranchReceivesOriginalInput() {
        ExecutionContext context = flows.run(branch(node("cond", ConditionalNode.TYPE,
                "conditionType", "numberGreaterThan", "conditionValue", 3)), 5);

        assertThat(flows.inputsOf("yes")).containsExactly(5);
        assertThat(flows.invokedNodeIds()).doesNotContain("no", "plain");

        @SuppressWarnings("unchecked")
        Map<String, Object> output = (Map<String, Object>) context.getOutput("cond").get(0);
        assertThat(output).containsEntry("input", 5)
                .containsEntry("path", "true")
                .containsEntry("conditionResult", true);
    }

    @Test
    void nonNumericInputTakesFalseBranch() {
        flows.run(branch(node("cond", ConditionalNode.TYPE,
                "conditionType", "numberGreaterThan", "conditionValue", 3)), "abc");

        assertThat(flows.inputsOf("no")).containsExactly("abc");
        assertThat(flows.invokedNodeIds()).doesNotContain("yes");
    }

    @Test
    void legacyAliasAndNestedConditionShape() {
        flows.run(branch(node("cond", ConditionalNode.TYPE,
                "condition", config("type", "contains", "value", "ell"))), "hello");

        assertThat(flows.inputsOf("yes")).containsExactly("hello");
    }

    @Test
    void unconfiguredConditionComparesWithTrue() {
        flows.run(branch(node("cond", ConditionalNode.TYPE)), true);

        assertThat(flows.inputsOf("yes")).containsExactly(true);
    }

    @Test
    @DisplayName("求值异常按 false 处理，节点本身成功")
    void evaluationErrorIsTreatedAsFalse() {
        ExecutionContext context = flows.run(branch(node("cond", ConditionalNode.TYPE,
                "conditionType", "jsonPathExistsTruthy", "conditionValue", "a[")), "{\"a\": 1}");

        assertThat(context.getNodeState("cond").getStatus()).isEqualTo(NodeStatus.SUCCESS);
        assertThat(flows.inputsOf("no")).containsExactly("{\"a\": 1}");
    }

    @Test
    void configStoreOverridesDescriptorBetweenRuns() {
        FlowGraph graph = branch(node("cond", ConditionalNode.TYPE,
                "conditionType", "numberLessThan", "conditionValue", 10));
        flows.getConfigStore().update("cond", config("conditionValue", 1));

        flows.run(graph, 5);

        assertThat(flows.inputsOf("no")).containsExactly(5);
    }
}
