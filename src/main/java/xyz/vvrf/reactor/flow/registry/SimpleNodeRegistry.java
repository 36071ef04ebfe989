package xyz.vvrf.reactor.flow.registry;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.core.FlowNode;
import xyz.vvrf.reactor.flow.core.NodeDescriptor;
import xyz.vvrf.reactor.flow.node.PassthroughNode;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * NodeRegistry 的简单内存实现。
 * 线程安全。
 */
@Slf4j
public class SimpleNodeRegistry implements NodeRegistry {

    private final Map<String, NodeConstructor> constructors = new ConcurrentHashMap<>();

    @Override
    public void register(String type, NodeConstructor constructor) {
        Objects.requireNonNull(type, "节点类型不能为空");
        Objects.requireNonNull(constructor, "节点构造函数不能为空");

        if (constructors.putIfAbsent(type, constructor) != null) {
            throw new IllegalArgumentException(String.format("节点类型 '%s' 在注册表中已存在。", type));
        }
        log.info("已注册节点类型 '{}'", type);
    }

    @Override
    public boolean isRegistered(String type) {
        return type != null && constructors.containsKey(type);
    }

    @Override
    public Set<String> getRegisteredTypes() {
        return Collections.unmodifiableSet(new TreeSet<>(constructors.keySet()));
    }

    @Override
    public FlowNode create(NodeDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "节点描述不能为空");
        NodeConstructor constructor = constructors.get(descriptor.getType());
        if (constructor == null) {
            log.warn("Unknown node type '{}' for node '{}'. Falling back to passthrough.",
                    descriptor.getType(), descriptor.getId());
            return new PassthroughNode(descriptor);
        }

        FlowNode node = constructor.create(descriptor);
        if (node == null) {
            throw new IllegalStateException(String.format("节点类型 '%s' 的构造函数返回了 null 实例。", descriptor.getType()));
        }
        return node;
    }
}
