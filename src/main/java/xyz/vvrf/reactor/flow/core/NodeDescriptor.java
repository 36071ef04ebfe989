package xyz.vvrf.reactor.flow.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 描述图中的一个节点实例（不可变数据类）。
 * 包含节点 ID、类型标签、节点配置以及可选的父节点（分组）ID。
 * 在一次运行期间保持不变，由图持有，节点只读。
 */
public final class NodeDescriptor {
    private final String id;
    private final String type;
    private final Map<String, Object> config;
    private final String parentId; // 所属分组 ID，顶层节点为 null

    public NodeDescriptor(String id, String type, Map<String, Object> config, String parentId) {
        this.id = Objects.requireNonNull(id, "节点 ID 不能为空");
        this.type = Objects.requireNonNull(type, "节点类型不能为空");
        this.config = (config != null)
                ? Collections.unmodifiableMap(new LinkedHashMap<>(config))
                : Collections.emptyMap();
        this.parentId = parentId;
    }

    public static NodeDescriptor of(String id, String type) {
        return new NodeDescriptor(id, type, null, null);
    }

    public static NodeDescriptor of(String id, String type, Map<String, Object> config) {
        return new NodeDescriptor(id, type, config, null);
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    /**
     * @return 配置 Map 的不可变视图。
     */
    public Map<String, Object> getConfig() {
        return config;
    }

    public Optional<String> getParentId() {
        return Optional.ofNullable(parentId);
    }

    /**
     * 返回一个归属于指定分组的新描述符。
     */
    public NodeDescriptor withParent(String newParentId) {
        return new NodeDescriptor(id, type, config, newParentId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeDescriptor that = (NodeDescriptor) o;
        return id.equals(that.id) &&
                type.equals(that.type) &&
                config.equals(that.config) &&
                Objects.equals(parentId, that.parentId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, config, parentId);
    }

    @Override
    public String toString() {
        return String.format("Node[id=%s, type=%s, parent=%s, config=%s]", id, type, parentId, config);
    }
}
