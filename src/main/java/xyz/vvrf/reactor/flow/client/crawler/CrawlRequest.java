package xyz.vvrf.reactor.flow.client.crawler;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;

import java.util.Map;

/**
 * 抓取请求，按爬虫后端的字段名序列化。
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CrawlRequest {
    private final String url;
    @JsonProperty("wait_for_selector")
    private final String waitForSelector;
    @JsonProperty("extract_selectors")
    private final Map<String, String> extractSelectors;
    /** 毫秒 */
    private final Integer timeout;
    private final Map<String, String> headers;
    @JsonProperty("include_html")
    private final Boolean includeHtml;
}
