package xyz.vvrf.reactor.flow.node.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiConfig {
    private String method = "GET";
    private String url;
    /** Map 或 JSON 字符串。*/
    private Object headers;
    private Map<String, Object> queryParams = new LinkedHashMap<>();
    /** 请求体模板：字符串（可含模板变量，能解析为 JSON 时按 JSON 发送）或结构化对象。*/
    private Object body;
}
