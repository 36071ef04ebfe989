package xyz.vvrf.reactor.flow.client.llm;

import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * provider 标识到 LlmClient 的映射。标识不区分大小写。
 */
@Slf4j
public class LlmClientRegistry {

    private final Map<String, LlmClient> clients = new ConcurrentHashMap<>();

    public LlmClientRegistry(Collection<? extends LlmClient> initialClients) {
        if (initialClients != null) {
            initialClients.forEach(this::register);
        }
    }

    public void register(LlmClient client) {
        Objects.requireNonNull(client, "LlmClient 不能为空");
        String key = client.getProvider().toLowerCase(Locale.ROOT);
        LlmClient previous = clients.put(key, client);
        if (previous != null) {
            log.warn("LLM provider '{}' re-registered: {} replaces {}", key,
                    client.getClass().getSimpleName(), previous.getClass().getSimpleName());
        }
    }

    public Optional<LlmClient> find(String provider) {
        if (provider == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(clients.get(provider.toLowerCase(Locale.ROOT)));
    }

    public Set<String> getProviders() {
        return Collections.unmodifiableSet(new TreeSet<>(clients.keySet()));
    }
}
