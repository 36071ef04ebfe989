package xyz.vvrf.reactor.flow.client.llm;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Ollama {@code /api/generate} 客户端（非流式）。
 */
@Slf4j
public class OllamaLlmClient implements LlmClient {

    public static final String PROVIDER = "ollama";

    private final WebClient webClient;
    private final String defaultBaseUrl;
    private final Duration timeout;

    public OllamaLlmClient(WebClient webClient, String defaultBaseUrl, Duration timeout) {
        this.webClient = Objects.requireNonNull(webClient, "WebClient 不能为空");
        this.defaultBaseUrl = Objects.requireNonNull(defaultBaseUrl, "Ollama 地址不能为空");
        this.timeout = Objects.requireNonNull(timeout, "超时不能为空");
    }

    @Override
    public String getProvider() {
        return PROVIDER;
    }

    @Override
    public Mono<String> generate(LlmRequest request) {
        return Mono.defer(() -> {
            String baseUrl = request.getBaseUrl() != null ? request.getBaseUrl() : defaultBaseUrl;
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model", request.getModel());
            body.put("prompt", request.getPrompt());
            body.put("stream", false);
            Map<String, Object> options = new LinkedHashMap<>();
            options.put("temperature", request.getTemperature());
            body.put("options", options);
            List<String> images = request.getImages();
            if (!images.isEmpty()) {
                body.put("images", images.stream().map(ImageEncoder::toBase64).collect(Collectors.toList()));
            }
            log.debug("Ollama generate: model={}, images={}, url={}", request.getModel(), images.size(), baseUrl);

            return webClient.post()
                    .uri(stripTrailingSlash(baseUrl) + "/api/generate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .map(json -> json.path("response").asText(""));
        });
    }

    static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
