package xyz.vvrf.reactor.flow.client.llm;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class LlmHttpClientsTest {

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    private WebClient replying(String json) {
        return WebClient.builder()
                .exchangeFunction(request -> {
                    lastRequest.set(request);
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(json)
                            .build());
                })
                .build();
    }

    @Test
    void ollamaReadsResponseField() {
        OllamaLlmClient client = new OllamaLlmClient(
                replying("{\"model\":\"llama3\",\"response\":\"Hi there\",\"done\":true}"),
                "http://localhost:11434/", Duration.ofSeconds(5));

        StepVerifier.create(client.generate(LlmRequest.builder().model("llama3").prompt("Hello").build()))
                .expectNext("Hi there")
                .verifyComplete();
        assertThat(lastRequest.get().url().toString()).isEqualTo("http://localhost:11434/api/generate");
    }

    @Test
    void requestBaseUrlOverridesDefault() {
        OllamaLlmClient client = new OllamaLlmClient(replying("{\"response\":\"\"}"),
                "http://localhost:11434", Duration.ofSeconds(5));

        StepVerifier.create(client.generate(LlmRequest.builder()
                        .model("llama3").prompt("Hello").baseUrl("http://gpu-box:11434").build()))
                .expectNext("")
                .verifyComplete();
        assertThat(lastRequest.get().url().getHost()).isEqualTo("gpu-box");
    }

    @Test
    void openAiReadsFirstChoiceAndSendsBearerToken() {
        OpenAiLlmClient client = new OpenAiLlmClient(
                replying("{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"42\"}}]}"),
                "https://api.openai.com", "sk-test", Duration.ofSeconds(5));

        StepVerifier.create(client.generate(LlmRequest.builder().model("gpt-4o").prompt("answer?").build()))
                .expectNext("42")
                .verifyComplete();
        ClientRequest request = lastRequest.get();
        assertThat(request.url().toString()).isEqualTo("https://api.openai.com/v1/chat/completions");
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer sk-test");
    }

    @Test
    void imageMimeTypes() {
        assertThat(ImageEncoder.mimeType("photo.JPG")).isEqualTo("image/jpeg");
        assertThat(ImageEncoder.mimeType("data:image/gif;base64,AAAA")).isEqualTo("image/gif");
        assertThat(ImageEncoder.toBase64("data:image/gif;base64,AAAA")).isEqualTo("AAAA");
    }
}
