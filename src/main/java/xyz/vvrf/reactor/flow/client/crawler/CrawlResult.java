package xyz.vvrf.reactor.flow.client.crawler;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 爬虫后端的响应。status 为 "success" 或 "error"。
 */
@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class CrawlResult {
    private String status;
    private String url;
    private String title;
    private String text;
    private String html;
    @JsonProperty("extracted_data")
    private Map<String, Object> extractedData = new LinkedHashMap<>();
    private String error;

    public boolean isSuccess() {
        return "success".equalsIgnoreCase(status);
    }

    /**
     * 完整结果的 Map 视图，供节点输出。
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("status", status);
        map.put("url", url);
        map.put("title", title);
        map.put("text", text);
        if (html != null) {
            map.put("html", html);
        }
        map.put("extracted_data", extractedData);
        return map;
    }
}
