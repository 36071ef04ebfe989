package xyz.vvrf.reactor.flow.client.llm;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

@Getter
@Builder
public class LlmRequest {
    private final String model;
    private final String prompt;
    @Builder.Default
    private final double temperature = 0.7;
    /** 图片文件路径（vision 模式）。*/
    @Singular
    private final List<String> images;
    /** 覆盖客户端的默认服务地址，可为 null。*/
    private final String baseUrl;
}
