package xyz.vvrf.reactor.flow.node;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.core.FlowNode;
import xyz.vvrf.reactor.flow.core.NodeDescriptor;
import xyz.vvrf.reactor.flow.execution.ExecutionScope;

import java.util.Objects;

/**
 * 未知类型的替代节点：记录警告并原样返回输入。
 */
@Slf4j
public class PassthroughNode implements FlowNode {

    private final NodeDescriptor descriptor;

    public PassthroughNode(NodeDescriptor descriptor) {
        this.descriptor = Objects.requireNonNull(descriptor, "节点描述不能为空");
    }

    @Override
    public String getId() {
        return descriptor.getId();
    }

    @Override
    public String getType() {
        return descriptor.getType();
    }

    @Override
    public Mono<Object> execute(Object input, ExecutionScope scope) {
        log.warn("[RunId: {}] Node '{}' has unregistered type '{}', passing input through.",
                scope.getContext().getRunId(), getId(), getType());
        scope.getContext().log(String.format("Node %s: unknown type '%s', passing input through", getId(), getType()));
        return Mono.justOrEmpty(input);
    }
}
