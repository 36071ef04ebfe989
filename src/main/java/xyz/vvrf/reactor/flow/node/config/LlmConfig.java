package xyz.vvrf.reactor.flow.node.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class LlmConfig {

    public static final String MODE_TEXT = "text";
    public static final String MODE_VISION = "vision";

    private String provider = "ollama";
    private String model;
    private String prompt;
    private Double temperature = 0.7;
    private String mode = MODE_TEXT;
    /** 覆盖 provider 的默认服务地址。*/
    private String baseUrl;
}
