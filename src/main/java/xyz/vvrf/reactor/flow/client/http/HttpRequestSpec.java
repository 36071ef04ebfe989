package xyz.vvrf.reactor.flow.client.http;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.Map;

/**
 * HTTP 调用参数（不可变）。
 */
@Getter
@Builder
public class HttpRequestSpec {
    @Builder.Default
    private final String method = "GET";
    private final String url;
    @Singular
    private final Map<String, String> headers;
    @Singular
    private final Map<String, String> queryParams;
    /** 请求体；Map/List 以 JSON 发送，字符串原样发送，null 表示无请求体。*/
    private final Object body;

    @Override
    public String toString() {
        return String.format("%s %s (query=%s, body=%s)", method, url, queryParams, body != null);
    }
}
