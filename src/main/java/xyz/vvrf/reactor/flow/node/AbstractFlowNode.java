package xyz.vvrf.reactor.flow.node;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.config.NodeConfigResolver;
import xyz.vvrf.reactor.flow.core.FlowNode;
import xyz.vvrf.reactor.flow.core.NodeDescriptor;
import xyz.vvrf.reactor.flow.execution.ExecutionScope;

import java.util.Objects;

/**
 * 带强类型配置的节点基类。
 * 每次执行开始时读取当前配置并转换为 {@code T}，因此运行之间的配置修改无需重建节点即可生效。
 *
 * @param <T> 配置类型
 */
public abstract class AbstractFlowNode<T> implements FlowNode {

    private final NodeDescriptor descriptor;
    private final NodeConfigResolver configResolver;
    private final Class<T> configType;

    protected AbstractFlowNode(NodeDescriptor descriptor, NodeConfigResolver configResolver, Class<T> configType) {
        this.descriptor = Objects.requireNonNull(descriptor, "节点描述不能为空");
        this.configResolver = Objects.requireNonNull(configResolver, "配置解析器不能为空");
        this.configType = Objects.requireNonNull(configType, "配置类型不能为空");
    }

    @Override
    public String getId() {
        return descriptor.getId();
    }

    @Override
    public String getType() {
        return descriptor.getType();
    }

    protected NodeDescriptor getDescriptor() {
        return descriptor;
    }

    @Override
    public final Mono<Object> execute(Object input, ExecutionScope scope) {
        return Mono.defer(() -> {
            T config = configResolver.resolve(descriptor, configType);
            return doExecute(input, config, scope);
        });
    }

    /**
     * 节点自身逻辑。
     *
     * @return 输出值；空 Mono 终止本分支
     */
    protected abstract Mono<Object> doExecute(Object input, T config, ExecutionScope scope);

    /**
     * 写入运行日志。
     */
    protected void trace(ExecutionScope scope, String message) {
        scope.getContext().log(String.format("%s(%s): %s", getType(), getId(), message));
    }

    protected static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
