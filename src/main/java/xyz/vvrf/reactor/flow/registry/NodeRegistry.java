package xyz.vvrf.reactor.flow.registry;

import xyz.vvrf.reactor.flow.core.FlowNode;
import xyz.vvrf.reactor.flow.core.NodeDescriptor;

import java.util.Set;

/**
 * 节点注册表接口。
 * 负责管理类型标签到节点构造函数的映射，并根据节点描述创建实例。
 */
public interface NodeRegistry {

    /**
     * 注册一个节点构造函数。
     *
     * @param type        类型标签 (在此注册表内唯一, 不能为空)
     * @param constructor 构造函数 (不能为空, 不能返回 null)
     * @throws IllegalArgumentException 如果类型标签已被注册
     */
    void register(String type, NodeConstructor constructor);

    boolean isRegistered(String type);

    Set<String> getRegisteredTypes();

    /**
     * 根据描述创建节点实例。
     * 未注册的类型会得到一个直通节点：记录警告并原样返回输入，保证图不会仅因未知类型而中断。
     *
     * @param descriptor 节点描述 (不能为空)
     * @return 新的节点实例，永不为 null
     */
    FlowNode create(NodeDescriptor descriptor);

    /**
     * 节点构造函数。
     */
    @FunctionalInterface
    interface NodeConstructor {
        FlowNode create(NodeDescriptor descriptor);
    }
}
