package xyz.vvrf.reactor.flow.client.crawler;

import reactor.core.publisher.Mono;

/**
 * 网页抓取后端契约。
 */
public interface WebCrawlerClient {

    /**
     * @return 抓取结果；后端报告的失败以 status=error 的结果返回，传输层失败以错误信号结束
     */
    Mono<CrawlResult> crawl(CrawlRequest request);
}
