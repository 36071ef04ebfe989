package xyz.vvrf.reactor.flow.node;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import xyz.vvrf.reactor.flow.client.http.HttpCallException;
import xyz.vvrf.reactor.flow.client.http.HttpGateway;
import xyz.vvrf.reactor.flow.client.http.HttpRequestSpec;
import xyz.vvrf.reactor.flow.core.NodeDescriptor;
import xyz.vvrf.reactor.flow.exception.NodeConfigurationException;
import xyz.vvrf.reactor.flow.exception.NodeTransformException;
import xyz.vvrf.reactor.flow.execution.ExecutionScope;
import xyz.vvrf.reactor.flow.test.util.TestFlows;

import java.util.Collections;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static xyz.vvrf.reactor.flow.test.util.TestFlows.config;

class ApiNodeTest {

    private final HttpGateway gateway = mock(HttpGateway.class);
    private final TestFlows flows = new TestFlows(gateway, null, null);
    private final ExecutionScope scope = flows.newScope();

    @BeforeEach
    void stubGateway() {
        when(gateway.exchange(any(HttpRequestSpec.class)))
                .thenReturn(Mono.just(Collections.singletonMap("ok", true)));
    }

    private ApiNode api(Object... configKeyValues) {
        return new ApiNode(NodeDescriptor.of("api", ApiNode.TYPE, config(configKeyValues)), flows.getConfigResolver(), gateway);
    }

    private HttpRequestSpec sentRequest() {
        ArgumentCaptor<HttpRequestSpec> captor = ArgumentCaptor.forClass(HttpRequestSpec.class);
        verify(gateway).exchange(captor.capture());
        return captor.getValue();
    }

    @Test
    @DisplayName("url、请求头、查询参数中的模板变量被解析")
    void resolvesTemplates() {
        StepVerifier.create(api(
                        "url", "https://example.com/users/{{user.id}}",
                        "headers", "{\"X-Token\": \"{{token}}\"}",
                        "queryParams", config("q", "{{input.user.name}}", "limit", 10))
                        .execute(config("user", config("id", 42, "name", "ann"), "token", "t-1"), scope))
                .expectNext(Collections.singletonMap("ok", true))
                .verifyComplete();

        HttpRequestSpec request = sentRequest();
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getUrl()).isEqualTo("https://example.com/users/42");
        assertThat(request.getHeaders()).containsEntry("X-Token", "t-1");
        assertThat(request.getQueryParams()).containsEntry("q", "ann").containsEntry("limit", "10");
        assertThat(request.getBody()).isNull();
    }

    @Test
    void postWithoutBodySendsInput() {
        Map<String, Object> input = config("name", "x");

        api("url", "https://example.com", "method", "post").execute(input, scope).block();

        HttpRequestSpec request = sentRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getBody()).isEqualTo(input);
    }

    @Test
    void bodyTemplateIsParsedAsJsonWhenPossible() {
        api("url", "https://example.com", "method", "PUT", "body", "{\"value\": \"{{input}}\"}").execute("hi", scope).block();

        assertThat(sentRequest().getBody()).isEqualTo(Collections.singletonMap("value", "hi"));
    }

    @Test
    void blankResolvedUrlIsConfigurationError() {
        StepVerifier.create(api("url", "{{input}}").execute("", scope))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(NodeConfigurationException.class)
                        .hasMessage("API URL resolves to empty or null."))
                .verify();
        verifyNoInteractions(gateway);
    }

    @Test
    void invalidHeadersJsonIsConfigurationError() {
        StepVerifier.create(api("url", "https://example.com", "headers", "{not json").execute(null, scope))
                .expectError(NodeConfigurationException.class)
                .verify();
    }

    @Test
    void httpErrorBecomesTransformError() {
        when(gateway.exchange(any(HttpRequestSpec.class)))
                .thenReturn(Mono.error(new HttpCallException(404, "not found")));

        StepVerifier.create(api("url", "https://example.com").execute(null, scope))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(NodeTransformException.class)
                        .hasMessage("API Call Error (404): not found"))
                .verify();
    }
}
