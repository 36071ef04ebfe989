package xyz.vvrf.reactor.flow.client.crawler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Objects;

/**
 * 调用爬虫后端 {@code POST /api/web-crawler/fetch} 的客户端。
 */
@Slf4j
public class RemoteWebCrawlerClient implements WebCrawlerClient {

    static final String FETCH_PATH = "/api/web-crawler/fetch";

    private final WebClient webClient;
    private final Duration extraTimeout;

    /**
     * @param webClient    已配置 baseUrl 的 WebClient
     * @param extraTimeout 在请求自身的抓取超时之外额外等待的时间
     */
    public RemoteWebCrawlerClient(WebClient webClient, Duration extraTimeout) {
        this.webClient = Objects.requireNonNull(webClient, "WebClient 不能为空");
        this.extraTimeout = Objects.requireNonNull(extraTimeout, "超时不能为空");
    }

    @Override
    public Mono<CrawlResult> crawl(CrawlRequest request) {
        Duration timeout = Duration.ofMillis(request.getTimeout() != null ? request.getTimeout() : 30000).plus(extraTimeout);
        log.debug("Crawling {} (wait for: {}, timeout: {})", request.getUrl(), request.getWaitForSelector(), timeout);
        return webClient.post()
                .uri(FETCH_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(CrawlResult.class)
                .timeout(timeout)
                .doOnNext(result -> {
                    if (result.getUrl() == null) {
                        result.setUrl(request.getUrl());
                    }
                });
    }
}
