package xyz.vvrf.reactor.flow.client.crawler;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class RemoteWebCrawlerClientTest {

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    private RemoteWebCrawlerClient client(String json) {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://crawler:8000")
                .exchangeFunction(request -> {
                    lastRequest.set(request);
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(json)
                            .build());
                })
                .build();
        return new RemoteWebCrawlerClient(webClient, Duration.ofSeconds(1));
    }

    @Test
    void postsToFetchEndpointAndMapsSnakeCaseFields() {
        CrawlResult result = client("{\"status\":\"success\",\"url\":\"https://example.com\",\"title\":\"Example\","
                + "\"text\":\"Hello\",\"extracted_data\":{\"h1\":\"Hello\"},\"elapsed\":1.2}")
                .crawl(CrawlRequest.builder().url("https://example.com").timeout(1000).build())
                .block(Duration.ofSeconds(5));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getTitle()).isEqualTo("Example");
        assertThat(result.getExtractedData()).containsEntry("h1", "Hello");
        assertThat(lastRequest.get().method()).isEqualTo(HttpMethod.POST);
        assertThat(lastRequest.get().url().toString()).isEqualTo("http://crawler:8000/api/web-crawler/fetch");
    }

    @Test
    void missingUrlIsFilledFromRequest() {
        CrawlResult result = client("{\"status\":\"error\",\"error\":\"navigation timeout\"}")
                .crawl(CrawlRequest.builder().url("https://slow.example.com").build())
                .block(Duration.ofSeconds(5));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getUrl()).isEqualTo("https://slow.example.com");
        assertThat(result.getError()).isEqualTo("navigation timeout");
        assertThat(result.toMap()).doesNotContainKey("html");
    }
}
