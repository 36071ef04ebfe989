package xyz.vvrf.reactor.flow.registry;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.node.*;

import java.util.Objects;

/**
 * 注册内置节点类型。
 */
@Slf4j
public final class DefaultNodeTypes {

    private DefaultNodeTypes() {
    }

    /**
     * 将内置节点类型注册到给定的注册表。
     * 结构节点（conditional、group、merger、input、output、json-extractor）总是注册；
     * 依赖外部服务的节点仅在对应协作者存在时注册。
     *
     * @throws IllegalArgumentException 如果某个类型已被注册
     */
    public static void registerAll(NodeRegistry registry, NodeServices services) {
        Objects.requireNonNull(registry, "NodeRegistry 不能为空");
        Objects.requireNonNull(services, "NodeServices 不能为空");
        Objects.requireNonNull(services.getConfigResolver(), "NodeConfigResolver 不能为空");

        registry.register(ConditionalNode.TYPE, d -> new ConditionalNode(d, services.getConfigResolver()));
        registry.register(GroupNode.TYPE, d -> new GroupNode(d, services.getConfigResolver()));
        registry.register(MergerNode.TYPE, d -> new MergerNode(d, services.getConfigResolver()));
        registry.register(InputNode.TYPE, d -> new InputNode(d, services.getConfigResolver()));
        registry.register(OutputNode.TYPE, d -> new OutputNode(d, services.getConfigResolver()));
        registry.register(JsonExtractorNode.TYPE, d -> new JsonExtractorNode(d, services.getConfigResolver()));

        if (services.getHttpGateway() != null) {
            registry.register(ApiNode.TYPE, d -> new ApiNode(d, services.getConfigResolver(), services.getHttpGateway()));
        } else {
            log.warn("No HttpGateway available, node type '{}' will not be registered.", ApiNode.TYPE);
        }
        if (services.getLlmClients() != null) {
            registry.register(LlmNode.TYPE, d -> new LlmNode(d, services.getConfigResolver(), services.getLlmClients()));
        } else {
            log.warn("No LlmClientRegistry available, node type '{}' will not be registered.", LlmNode.TYPE);
        }
        if (services.getWebCrawlerClient() != null) {
            registry.register(WebCrawlerNode.TYPE,
                    d -> new WebCrawlerNode(d, services.getConfigResolver(), services.getWebCrawlerClient()));
        } else {
            log.warn("No WebCrawlerClient available, node type '{}' will not be registered.", WebCrawlerNode.TYPE);
        }
        if (services.getHtmlParser() != null) {
            registry.register(HtmlParserNode.TYPE,
                    d -> new HtmlParserNode(d, services.getConfigResolver(), services.getHtmlParser()));
        } else {
            log.warn("No HtmlParser available, node type '{}' will not be registered.", HtmlParserNode.TYPE);
        }
        log.info("Registered built-in node types: {}", registry.getRegisteredTypes());
    }
}
