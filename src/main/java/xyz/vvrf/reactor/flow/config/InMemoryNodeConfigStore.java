package xyz.vvrf.reactor.flow.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于内存的 NodeConfigStore。线程安全。
 */
public class InMemoryNodeConfigStore implements NodeConfigStore {

    private final Map<String, Map<String, Object>> configs = new ConcurrentHashMap<>();

    @Override
    public Optional<Map<String, Object>> find(String nodeId) {
        return Optional.ofNullable(configs.get(nodeId));
    }

    /**
     * 整体替换节点配置。
     */
    public void put(String nodeId, Map<String, Object> config) {
        Objects.requireNonNull(nodeId, "节点 ID 不能为空");
        configs.put(nodeId, Collections.unmodifiableMap(new LinkedHashMap<>(config)));
    }

    /**
     * 合并更新单个节点的部分配置。
     */
    public void update(String nodeId, Map<String, Object> changes) {
        Objects.requireNonNull(nodeId, "节点 ID 不能为空");
        configs.compute(nodeId, (id, existing) -> {
            Map<String, Object> merged = existing != null ? new LinkedHashMap<>(existing) : new LinkedHashMap<>();
            merged.putAll(changes);
            return Collections.unmodifiableMap(merged);
        });
    }

    public void remove(String nodeId) {
        configs.remove(nodeId);
    }

    public void clear() {
        configs.clear();
    }
}
