package xyz.vvrf.reactor.flow.client.http;

import reactor.core.publisher.Mono;

/**
 * HTTP 客户端契约。
 */
public interface HttpGateway {

    /**
     * 发送请求。
     *
     * @return 响应体：能解析为 JSON 时为 Map/List/标量，否则为文本；空响应体为空字符串
     *         非 2xx 响应以 {@link HttpCallException} 结束
     */
    Mono<Object> exchange(HttpRequestSpec request);
}
