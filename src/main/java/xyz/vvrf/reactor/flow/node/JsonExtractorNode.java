package xyz.vvrf.reactor.flow.node;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.config.NodeConfigResolver;
import xyz.vvrf.reactor.flow.core.NodeDescriptor;
import xyz.vvrf.reactor.flow.exception.NodeStructureException;
import xyz.vvrf.reactor.flow.execution.ExecutionScope;
import xyz.vvrf.reactor.flow.node.config.JsonExtractorConfig;
import xyz.vvrf.reactor.flow.util.JsonPaths;
import xyz.vvrf.reactor.flow.util.Values;

import java.util.Optional;

/**
 * 按点路径从 JSON 输入中提取值。未命中时返回 defaultValue，没有默认值则终止本分支。
 */
public class JsonExtractorNode extends AbstractFlowNode<JsonExtractorConfig> {

    public static final String TYPE = "json-extractor";

    public JsonExtractorNode(NodeDescriptor descriptor, NodeConfigResolver configResolver) {
        super(descriptor, configResolver, JsonExtractorConfig.class);
    }

    @Override
    protected Mono<Object> doExecute(Object input, JsonExtractorConfig config, ExecutionScope scope) {
        if (input == null) {
            trace(scope, "input is null, nothing to extract");
            return Mono.empty();
        }
        String path = config.getPath();
        if (isBlank(path)) {
            trace(scope, "no path configured, returning input as-is");
            return Mono.just(input);
        }

        Object root = input instanceof String ? Values.parseJson((String) input).orElse(input) : input;
        Optional<Object> value;
        try {
            value = JsonPaths.read(root, path);
        } catch (IllegalArgumentException e) {
            throw new NodeStructureException(getId(), "Invalid JSON path '" + path + "': " + e.getMessage(), e);
        }

        if (value.isPresent()) {
            return Mono.just(value.get());
        }
        if (config.getDefaultValue() != null) {
            trace(scope, String.format("no value at '%s', using default", path));
            return Mono.just(config.getDefaultValue());
        }
        trace(scope, String.format("no value at '%s'", path));
        return Mono.empty();
    }
}
