package xyz.vvrf.reactor.flow.client.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * 基于 Spring WebClient 的 HttpGateway。
 */
@Slf4j
public class WebClientHttpGateway implements HttpGateway {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public WebClientHttpGateway(WebClient webClient, ObjectMapper objectMapper, Duration timeout) {
        this.webClient = Objects.requireNonNull(webClient, "WebClient 不能为空");
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper 不能为空");
        this.timeout = Objects.requireNonNull(timeout, "超时不能为空");
    }

    @Override
    public Mono<Object> exchange(HttpRequestSpec request) {
        return Mono.defer(() -> {
            HttpMethod method = HttpMethod.resolve(request.getMethod().toUpperCase());
            if (method == null) {
                return Mono.error(new IllegalArgumentException("Unsupported HTTP method: " + request.getMethod()));
            }
            URI uri = buildUri(request);
            log.debug("HTTP {} {}", method, uri);

            WebClient.RequestBodySpec spec = webClient.method(method)
                    .uri(uri)
                    .headers(h -> request.getHeaders().forEach(h::set));

            WebClient.RequestHeadersSpec<?> withBody = spec;
            Object body = request.getBody();
            if (body != null) {
                if (body instanceof CharSequence) {
                    withBody = spec.bodyValue(body.toString());
                } else {
                    withBody = spec.contentType(MediaType.APPLICATION_JSON).bodyValue(body);
                }
            }

            return withBody.exchangeToMono(response -> response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .flatMap(text -> {
                                int status = response.rawStatusCode();
                                if (status < 200 || status >= 300) {
                                    return Mono.error(new HttpCallException(status, errorDetail(text, status)));
                                }
                                return Mono.just(parseBody(text));
                            }))
                    .timeout(timeout);
        });
    }

    private URI buildUri(HttpRequestSpec request) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(request.getUrl());
        for (Map.Entry<String, String> param : request.getQueryParams().entrySet()) {
            builder.queryParam(param.getKey(), param.getValue());
        }
        return builder.encode().build().toUri();
    }

    private Object parseBody(String text) {
        if (text.isEmpty()) {
            return text;
        }
        try {
            return objectMapper.readValue(text, Object.class);
        } catch (JsonProcessingException e) {
            return text;
        }
    }

    @SuppressWarnings("unchecked")
    private String errorDetail(String text, int status) {
        Object parsed = parseBody(text);
        if (parsed instanceof Map) {
            Map<String, Object> map = (Map<String, Object>) parsed;
            for (String key : new String[]{"detail", "message", "error"}) {
                if (map.get(key) != null) {
                    return String.valueOf(map.get(key));
                }
            }
        }
        return text.isEmpty() ? "HTTP status " + status : text;
    }
}
