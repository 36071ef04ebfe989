package xyz.vvrf.reactor.flow.node;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.client.http.HttpGateway;
import xyz.vvrf.reactor.flow.client.http.HttpRequestSpec;
import xyz.vvrf.reactor.flow.config.NodeConfigResolver;
import xyz.vvrf.reactor.flow.core.NodeDescriptor;
import xyz.vvrf.reactor.flow.exception.FlowNodeException;
import xyz.vvrf.reactor.flow.exception.NodeConfigurationException;
import xyz.vvrf.reactor.flow.exception.NodeTransformException;
import xyz.vvrf.reactor.flow.execution.ExecutionScope;
import xyz.vvrf.reactor.flow.node.config.ApiConfig;
import xyz.vvrf.reactor.flow.util.TemplateResolver;
import xyz.vvrf.reactor.flow.util.Values;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * HTTP 调用节点。url、请求头、查询参数与请求体支持 {@code {{input}}} / {@code {{path}}} 模板。
 * 未配置请求体的非 GET 请求以输入作为请求体。
 */
@Slf4j
public class ApiNode extends AbstractFlowNode<ApiConfig> {

    public static final String TYPE = "api";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {};

    private final HttpGateway httpGateway;
    private final ObjectMapper objectMapper;

    public ApiNode(NodeDescriptor descriptor, NodeConfigResolver configResolver, HttpGateway httpGateway) {
        super(descriptor, configResolver, ApiConfig.class);
        this.httpGateway = Objects.requireNonNull(httpGateway, "HttpGateway 不能为空");
        this.objectMapper = configResolver.getObjectMapper();
    }

    @Override
    protected Mono<Object> doExecute(Object input, ApiConfig config, ExecutionScope scope) {
        HttpRequestSpec request = buildRequest(input, config);
        trace(scope, "calling " + request);

        return httpGateway.exchange(request)
                .onErrorMap(e -> !(e instanceof FlowNodeException),
                        e -> new NodeTransformException(getId(),
                                e.getMessage() != null ? e.getMessage() : "API call failed: " + e.getClass().getSimpleName(), e));
    }

    HttpRequestSpec buildRequest(Object input, ApiConfig config) {
        if (isBlank(config.getUrl())) {
            throw new NodeConfigurationException(getId(), "API URL is required.");
        }
        String url = TemplateResolver.resolve(config.getUrl(), input).trim();
        if (url.isEmpty()) {
            throw new NodeConfigurationException(getId(), "API URL resolves to empty or null.");
        }
        String method = isBlank(config.getMethod()) ? "GET" : config.getMethod().trim().toUpperCase(Locale.ROOT);

        HttpRequestSpec.HttpRequestSpecBuilder builder = HttpRequestSpec.builder()
                .method(method)
                .url(url);
        resolveHeaders(config.getHeaders(), input).forEach(builder::header);
        if (config.getQueryParams() != null) {
            config.getQueryParams().forEach((key, value) -> {
                if (value != null) {
                    builder.queryParam(key, resolveValue(value, input));
                }
            });
        }
        builder.body(resolveBody(method, config.getBody(), input));
        return builder.build();
    }

    private Map<String, String> resolveHeaders(Object headers, Object input) {
        Map<String, String> resolved = new LinkedHashMap<>();
        if (headers == null) {
            return resolved;
        }
        Map<String, Object> raw;
        if (headers instanceof Map) {
            raw = objectMapper.convertValue(headers, MAP_TYPE);
        } else {
            String text = headers.toString().trim();
            if (text.isEmpty()) {
                return resolved;
            }
            try {
                raw = objectMapper.readValue(text, MAP_TYPE);
            } catch (JsonProcessingException e) {
                throw new NodeConfigurationException(getId(), "Invalid headers JSON: " + e.getOriginalMessage(), e);
            }
        }
        raw.forEach((key, value) -> {
            if (value != null) {
                resolved.put(key, resolveValue(value, input));
            }
        });
        return resolved;
    }

    private Object resolveBody(String method, Object body, Object input) {
        if (body instanceof String) {
            String template = (String) body;
            if (template.trim().isEmpty()) {
                return defaultBody(method, input);
            }
            String resolved = TemplateResolver.resolve(template, input);
            return Values.parseJson(resolved).orElse(resolved);
        }
        if (body != null) {
            return body;
        }
        return defaultBody(method, input);
    }

    private static Object defaultBody(String method, Object input) {
        if ("GET".equals(method) || input == null) {
            return null;
        }
        return Values.isStructured(input) ? input : Values.toJson(input, false);
    }

    private static String resolveValue(Object value, Object input) {
        return value instanceof String ? TemplateResolver.resolve((String) value, input) : Values.asString(value);
    }
}
