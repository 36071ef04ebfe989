package xyz.vvrf.reactor.flow.registry;

import lombok.Builder;
import lombok.Getter;
import xyz.vvrf.reactor.flow.client.crawler.WebCrawlerClient;
import xyz.vvrf.reactor.flow.client.html.HtmlParser;
import xyz.vvrf.reactor.flow.client.http.HttpGateway;
import xyz.vvrf.reactor.flow.client.llm.LlmClientRegistry;
import xyz.vvrf.reactor.flow.config.NodeConfigResolver;

/**
 * 内置节点所需的外部协作者。
 * 某项为 null 时，对应的节点类型不会被注册。
 */
@Getter
@Builder
public class NodeServices {
    private final NodeConfigResolver configResolver;
    private final HttpGateway httpGateway;
    private final LlmClientRegistry llmClients;
    private final WebCrawlerClient webCrawlerClient;
    private final HtmlParser htmlParser;
}
