package xyz.vvrf.reactor.flow.node;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.client.html.HtmlParser;
import xyz.vvrf.reactor.flow.config.NodeConfigResolver;
import xyz.vvrf.reactor.flow.core.NodeDescriptor;
import xyz.vvrf.reactor.flow.exception.NodeStructureException;
import xyz.vvrf.reactor.flow.execution.ExecutionScope;
import xyz.vvrf.reactor.flow.node.config.HtmlParserConfig;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * HTML 解析节点。没有配置规则或输入中找不到 HTML 时原样传递输入。
 */
public class HtmlParserNode extends AbstractFlowNode<HtmlParserConfig> {

    public static final String TYPE = "html-parser";

    private final HtmlParser htmlParser;

    public HtmlParserNode(NodeDescriptor descriptor, NodeConfigResolver configResolver, HtmlParser htmlParser) {
        super(descriptor, configResolver, HtmlParserConfig.class);
        this.htmlParser = Objects.requireNonNull(htmlParser, "HtmlParser 不能为空");
    }

    @Override
    protected Mono<Object> doExecute(Object input, HtmlParserConfig config, ExecutionScope scope) {
        if (config.getExtractionRules() == null || config.getExtractionRules().isEmpty()) {
            trace(scope, "no extraction rules, passing input through");
            return Mono.justOrEmpty(input);
        }
        Optional<String> html = htmlOf(input);
        if (!html.isPresent()) {
            trace(scope, "no HTML found in input, passing input through");
            return Mono.justOrEmpty(input);
        }

        Map<String, Object> extracted;
        try {
            extracted = htmlParser.extract(html.get(), config.getExtractionRules());
        } catch (IllegalArgumentException e) {
            throw new NodeStructureException(getId(), e.getMessage(), e);
        }
        trace(scope, String.format("extracted %d field(s)", extracted.size()));
        return Mono.just(extracted);
    }

    static Optional<String> htmlOf(Object input) {
        if (input instanceof String) {
            return Optional.of((String) input);
        }
        if (input instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) input;
            for (String key : new String[]{"html", "text"}) {
                if (map.get(key) instanceof String) {
                    return Optional.of((String) map.get(key));
                }
            }
            for (Object value : map.values()) {
                if (value instanceof String && looksLikeHtml((String) value)) {
                    return Optional.of((String) value);
                }
            }
        }
        return Optional.empty();
    }

    private static boolean looksLikeHtml(String value) {
        String trimmed = value.trim();
        return trimmed.startsWith("<") && trimmed.contains(">");
    }
}
