package xyz.vvrf.reactor.flow.node;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.config.NodeConfigResolver;
import xyz.vvrf.reactor.flow.core.Edge;
import xyz.vvrf.reactor.flow.core.NodeDescriptor;
import xyz.vvrf.reactor.flow.exception.ConditionEvaluationException;
import xyz.vvrf.reactor.flow.execution.ExecutionScope;
import xyz.vvrf.reactor.flow.node.config.ConditionalConfig;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 条件分支节点。
 * 输出 {@code {input, path, conditionResult}}，只沿与结果匹配的 trueHandle / falseHandle 出边传播，
 * 子节点收到的是原始输入。
 */
@Slf4j
public class ConditionalNode extends AbstractFlowNode<ConditionalConfig> {

    public static final String TYPE = "conditional";

    static final String KEY_INPUT = "input";
    static final String KEY_PATH = "path";
    static final String KEY_RESULT = "conditionResult";

    public ConditionalNode(NodeDescriptor descriptor, NodeConfigResolver configResolver) {
        super(descriptor, configResolver, ConditionalConfig.class);
    }

    @Override
    protected Mono<Object> doExecute(Object input, ConditionalConfig config, ExecutionScope scope) {
        ConditionEvaluator.Condition condition = ConditionEvaluator.normalize(config);
        boolean result;
        try {
            result = ConditionEvaluator.evaluate(condition, input);
        } catch (RuntimeException e) {
            ConditionEvaluationException error = new ConditionEvaluationException(getId(),
                    "Condition evaluation error: " + e.getMessage(), e);
            log.warn("[RunId: {}] {} Treating as false.", scope.getContext().getRunId(), error.getMessage());
            trace(scope, error.getMessage());
            result = false;
        }
        trace(scope, String.format("%s evaluated to %s", condition, result));

        Map<String, Object> outcome = new LinkedHashMap<>();
        outcome.put(KEY_INPUT, input);
        outcome.put(KEY_PATH, result ? "true" : "false");
        outcome.put(KEY_RESULT, result);
        return Mono.just(outcome);
    }

    @Override
    public List<Edge> selectOutgoingEdges(Object output, List<Edge> outgoing) {
        String handle = Boolean.TRUE.equals(resultOf(output)) ? Edge.TRUE_HANDLE : Edge.FALSE_HANDLE;
        return outgoing.stream()
                .filter(edge -> edge.getSourceHandle().map(handle::equals).orElse(false))
                .collect(Collectors.toList());
    }

    @Override
    public Object valueForChildren(Object output) {
        return (output instanceof Map) ? ((Map<?, ?>) output).get(KEY_INPUT) : output;
    }

    private static Object resultOf(Object output) {
        return (output instanceof Map) ? ((Map<?, ?>) output).get(KEY_RESULT) : null;
    }
}
