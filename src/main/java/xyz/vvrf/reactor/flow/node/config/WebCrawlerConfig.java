package xyz.vvrf.reactor.flow.node.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class WebCrawlerConfig {
    private String url;
    private String waitForSelector;
    /** 毫秒 */
    private Integer timeout = 30000;
    /** 名称 -> CSS 选择器 */
    private Map<String, String> extractSelectors = new LinkedHashMap<>();
    private Boolean includeHtml = Boolean.TRUE;
    private Map<String, String> headers = new LinkedHashMap<>();
    /** full / html / text / extracted */
    private String outputFormat = "full";
}
