package xyz.vvrf.reactor.flow.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.core.NodeDescriptor;
import xyz.vvrf.reactor.flow.exception.NodeConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 将节点描述中的配置与 {@link NodeConfigStore} 中的当前配置合并（后者优先），
 * 并转换为各节点类型的强类型配置类。
 */
@Slf4j
public class NodeConfigResolver {

    private final ObjectMapper objectMapper;
    private final NodeConfigStore configStore;

    public NodeConfigResolver(ObjectMapper objectMapper, NodeConfigStore configStore) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper 不能为空");
        this.configStore = (configStore != null) ? configStore : nodeId -> Optional.empty();
    }

    /**
     * 只使用描述中的配置。
     */
    public static NodeConfigResolver descriptorOnly(ObjectMapper objectMapper) {
        return new NodeConfigResolver(objectMapper, null);
    }

    public Map<String, Object> resolveRaw(NodeDescriptor descriptor) {
        Map<String, Object> merged = new LinkedHashMap<>(descriptor.getConfig());
        configStore.find(descriptor.getId()).ifPresent(merged::putAll);
        return Collections.unmodifiableMap(merged);
    }

    /**
     * @throws NodeConfigurationException 配置无法转换为目标类型时
     */
    public <T> T resolve(NodeDescriptor descriptor, Class<T> configType) {
        Map<String, Object> raw = resolveRaw(descriptor);
        try {
            return objectMapper.convertValue(raw, configType);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid configuration for node '{}' ({}): {}", descriptor.getId(), configType.getSimpleName(), e.getMessage());
            throw new NodeConfigurationException(descriptor.getId(),
                    String.format("Invalid configuration for node '%s': %s", descriptor.getId(), e.getMessage()), e);
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
