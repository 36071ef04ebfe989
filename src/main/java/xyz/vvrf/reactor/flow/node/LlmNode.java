package xyz.vvrf.reactor.flow.node;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.client.llm.LlmClient;
import xyz.vvrf.reactor.flow.client.llm.LlmClientRegistry;
import xyz.vvrf.reactor.flow.client.llm.LlmRequest;
import xyz.vvrf.reactor.flow.config.NodeConfigResolver;
import xyz.vvrf.reactor.flow.core.NodeDescriptor;
import xyz.vvrf.reactor.flow.exception.FlowNodeException;
import xyz.vvrf.reactor.flow.exception.NodeConfigurationException;
import xyz.vvrf.reactor.flow.exception.NodeTransformException;
import xyz.vvrf.reactor.flow.execution.ExecutionScope;
import xyz.vvrf.reactor.flow.node.config.LlmConfig;
import xyz.vvrf.reactor.flow.util.TemplateResolver;
import xyz.vvrf.reactor.flow.util.Values;

import java.util.*;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * LLM 调用节点。prompt 中的 {@code {{input}}} 按输入类型渲染；vision 模式从输入中筛选图片路径。
 */
@Slf4j
public class LlmNode extends AbstractFlowNode<LlmConfig> {

    public static final String TYPE = "llm";

    private static final Pattern IMAGE_PATH = Pattern.compile("\\.(jpg|jpeg|png|gif|bmp)$", Pattern.CASE_INSENSITIVE);

    private final LlmClientRegistry clientRegistry;

    public LlmNode(NodeDescriptor descriptor, NodeConfigResolver configResolver, LlmClientRegistry clientRegistry) {
        super(descriptor, configResolver, LlmConfig.class);
        this.clientRegistry = Objects.requireNonNull(clientRegistry, "LlmClientRegistry 不能为空");
    }

    @Override
    protected Mono<Object> doExecute(Object input, LlmConfig config, ExecutionScope scope) {
        requireField(config.getPrompt(), "prompt");
        requireField(config.getModel(), "model");
        requireField(config.getProvider(), "provider");

        LlmClient client = clientRegistry.find(config.getProvider())
                .orElseThrow(() -> new NodeConfigurationException(getId(),
                        "Unsupported LLM provider: " + config.getProvider()));

        String prompt = TemplateResolver.resolve(config.getPrompt(), input, LlmNode::renderInput);
        List<String> images = Collections.emptyList();
        if (LlmConfig.MODE_VISION.equalsIgnoreCase(config.getMode())) {
            images = imagePaths(input);
            if (images.isEmpty()) {
                throw new NodeConfigurationException(getId(),
                        "Vision mode requires at least one image input (jpg, jpeg, png, gif, bmp).");
            }
        }

        LlmRequest request = LlmRequest.builder()
                .model(config.getModel())
                .prompt(prompt)
                .temperature(config.getTemperature() != null ? config.getTemperature() : 0.7)
                .images(images)
                .baseUrl(config.getBaseUrl())
                .build();
        trace(scope, String.format("calling %s model '%s' (%d image(s))", client.getProvider(), config.getModel(), images.size()));

        return client.generate(request)
                .map(text -> (Object) text)
                .onErrorMap(e -> !(e instanceof FlowNodeException),
                        e -> new NodeTransformException(getId(), "LLM call failed: " + e.getMessage(), e));
    }

    private void requireField(String value, String name) {
        if (isBlank(value)) {
            throw new NodeConfigurationException(getId(), String.format("LLM %s is required.", name));
        }
    }

    /**
     * 字符串原样插入；列表逐项换行拼接（对象项格式化为 JSON）；对象格式化为 JSON。
     */
    static String renderInput(Object input) {
        if (input == null) {
            return "";
        }
        if (input instanceof String) {
            return (String) input;
        }
        if (input instanceof Collection) {
            return ((Collection<?>) input).stream()
                    .map(item -> item instanceof String ? (String) item
                            : Values.isStructured(item) ? Values.toJson(item, true) : Values.asString(item))
                    .collect(Collectors.joining("\n"));
        }
        if (input instanceof Map) {
            return Values.toJson(input, true);
        }
        return Values.asString(input);
    }

    static List<String> imagePaths(Object input) {
        List<Object> candidates = input == null ? Collections.emptyList() : Values.toItems(input);
        return candidates.stream()
                .filter(String.class::isInstance)
                .map(String.class::cast)
                .map(String::trim)
                .filter(path -> IMAGE_PATH.matcher(path).find())
                .collect(Collectors.toList());
    }
}
