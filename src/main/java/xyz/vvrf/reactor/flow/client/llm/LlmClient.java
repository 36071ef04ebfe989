package xyz.vvrf.reactor.flow.client.llm;

import reactor.core.publisher.Mono;

/**
 * LLM 提供方客户端契约。
 */
public interface LlmClient {

    /**
     * @return provider 标识，如 "ollama"、"openai"
     */
    String getProvider();

    /**
     * @return 模型的回复文本
     */
    Mono<String> generate(LlmRequest request);
}
