package xyz.vvrf.reactor.flow.client.llm;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.*;

/**
 * OpenAI 兼容的 {@code /v1/chat/completions} 客户端。
 */
@Slf4j
public class OpenAiLlmClient implements LlmClient {

    public static final String PROVIDER = "openai";

    private final WebClient webClient;
    private final String defaultBaseUrl;
    private final String apiKey;
    private final Duration timeout;

    public OpenAiLlmClient(WebClient webClient, String defaultBaseUrl, String apiKey, Duration timeout) {
        this.webClient = Objects.requireNonNull(webClient, "WebClient 不能为空");
        this.defaultBaseUrl = Objects.requireNonNull(defaultBaseUrl, "OpenAI 地址不能为空");
        this.apiKey = apiKey;
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

            Object content;
            if (request.getImages().isEmpty()) {
                content = request.getPrompt();
            } else {
                List<Map<String, Object>> parts = new ArrayList<>();
                parts.add(mapOf("type", "text", "text", request.getPrompt()));
                for (String image : request.getImages()) {
                    String dataUrl = "data:" + ImageEncoder.mimeType(image) + ";base64," + ImageEncoder.toBase64(image);
                    parts.add(mapOf("type", "image_url", "image_url", Collections.singletonMap("url", dataUrl)));
                }
                content = parts;
            }

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model", request.getModel());
            body.put("temperature", request.getTemperature());
            body.put("messages", Collections.singletonList(mapOf("role", "user", "content", content)));
            log.debug("OpenAI chat completion: model={}, images={}", request.getModel(), request.getImages().size());

            return webClient.post()
                    .uri(OllamaLlmClient.stripTrailingSlash(baseUrl) + "/v1/chat/completions")
                    .headers(h -> {
                        if (apiKey != null && !apiKey.isEmpty()) {
                            h.set(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
                        }
                    })
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .map(json -> json.path("choices").path(0).path("message").path("content").asText(""));
        });
    }

    private static Map<String, Object> mapOf(String k1, Object v1, String k2, Object v2) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(k1, v1);
        map.put(k2, v2);
        return map;
    }
}
