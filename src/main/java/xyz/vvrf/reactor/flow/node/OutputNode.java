package xyz.vvrf.reactor.flow.node;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.config.NodeConfigResolver;
import xyz.vvrf.reactor.flow.core.NodeDescriptor;
import xyz.vvrf.reactor.flow.execution.ExecutionScope;
import xyz.vvrf.reactor.flow.node.config.OutputConfig;
import xyz.vvrf.reactor.flow.util.Values;

/**
 * 输出节点：按 text/json 格式生成展示内容写入上下文，并原样传递输入，以便继续连接下游节点。
 */
public class OutputNode extends AbstractFlowNode<OutputConfig> {

    public static final String TYPE = "output";

    static final String NO_INPUT_MESSAGE = "[No input provided to output node]";

    public OutputNode(NodeDescriptor descriptor, NodeConfigResolver configResolver) {
        super(descriptor, configResolver, OutputConfig.class);
    }

    @Override
    protected Mono<Object> doExecute(Object input, OutputConfig config, ExecutionScope scope) {
        String display = format(input, config.getFormat());
        scope.getContext().putDisplayContent(getId(), display);
        trace(scope, String.format("formatted %d character(s) as %s", display.length(), config.getFormat()));
        return Mono.justOrEmpty(input);
    }

    static String format(Object input, String format) {
        if (input == null) {
            return NO_INPUT_MESSAGE;
        }
        if ("json".equalsIgnoreCase(format)) {
            if (input instanceof String) {
                return Values.parseJson((String) input)
                        .map(parsed -> Values.toJson(parsed, true))
                        .orElse((String) input);
            }
            return Values.toJson(input, true);
        }
        if (Values.isStructured(input)) {
            return Values.toJson(input, true);
        }
        return Values.asString(input);
    }
}
