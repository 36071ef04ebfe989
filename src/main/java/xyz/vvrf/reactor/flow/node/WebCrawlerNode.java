package xyz.vvrf.reactor.flow.node;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.client.crawler.CrawlRequest;
import xyz.vvrf.reactor.flow.client.crawler.CrawlResult;
import xyz.vvrf.reactor.flow.client.crawler.WebCrawlerClient;
import xyz.vvrf.reactor.flow.config.NodeConfigResolver;
import xyz.vvrf.reactor.flow.core.NodeDescriptor;
import xyz.vvrf.reactor.flow.exception.FlowNodeException;
import xyz.vvrf.reactor.flow.exception.NodeConfigurationException;
import xyz.vvrf.reactor.flow.exception.NodeTransformException;
import xyz.vvrf.reactor.flow.execution.ExecutionScope;
import xyz.vvrf.reactor.flow.node.config.WebCrawlerConfig;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Objects;

/**
 * 网页抓取节点。url 取自配置，或取自以 http 开头的字符串输入。
 */
public class WebCrawlerNode extends AbstractFlowNode<WebCrawlerConfig> {

    public static final String TYPE = "web-crawler";

    private final WebCrawlerClient crawlerClient;

    public WebCrawlerNode(NodeDescriptor descriptor, NodeConfigResolver configResolver, WebCrawlerClient crawlerClient) {
        super(descriptor, configResolver, WebCrawlerConfig.class);
        this.crawlerClient = Objects.requireNonNull(crawlerClient, "WebCrawlerClient 不能为空");
    }

    @Override
    protected Mono<Object> doExecute(Object input, WebCrawlerConfig config, ExecutionScope scope) {
        String url = resolveUrl(input, config);
        CrawlRequest request = CrawlRequest.builder()
                .url(url)
                .waitForSelector(isBlank(config.getWaitForSelector()) ? null : config.getWaitForSelector())
                .timeout(config.getTimeout() != null ? config.getTimeout() : 30000)
                .extractSelectors(config.getExtractSelectors() == null || config.getExtractSelectors().isEmpty()
                        ? null : new LinkedHashMap<>(config.getExtractSelectors()))
                .headers(config.getHeaders() == null || config.getHeaders().isEmpty()
                        ? null : new LinkedHashMap<>(config.getHeaders()))
                .includeHtml(config.getIncludeHtml() == null || config.getIncludeHtml())
                .build();
        trace(scope, "crawling " + url);

        return crawlerClient.crawl(request)
                .onErrorMap(e -> !(e instanceof FlowNodeException),
                        e -> new NodeTransformException(getId(), "Web crawl failed: " + e.getMessage(), e))
                .flatMap(result -> {
                    if (!result.isSuccess()) {
                        return Mono.error(new NodeTransformException(getId(), "Crawler reported failure: "
                                + (result.getError() != null ? result.getError() : "Unknown error")));
                    }
                    return Mono.just(formatResult(result, config.getOutputFormat()));
                });
    }

    private String resolveUrl(Object input, WebCrawlerConfig config) {
        if (!isBlank(config.getUrl())) {
            return config.getUrl().trim();
        }
        if (input instanceof String && ((String) input).trim().startsWith("http")) {
            return ((String) input).trim();
        }
        throw new NodeConfigurationException(getId(), "URL is required for web crawler node.");
    }

    private Object formatResult(CrawlResult result, String outputFormat) {
        String format = outputFormat != null ? outputFormat.toLowerCase(Locale.ROOT) : "full";
        switch (format) {
            case "html":
                if (result.getHtml() == null) {
                    throw new NodeTransformException(getId(), "Crawler response contains no HTML.");
                }
                return result.getHtml();
            case "text":
                return result.getText() != null ? result.getText() : "";
            case "extracted":
                return result.getExtractedData() != null ? result.getExtractedData() : new LinkedHashMap<>();
            case "full":
            default:
                return result.toMap();
        }
    }
}
