package xyz.vvrf.reactor.flow.node;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.config.NodeConfigResolver;
import xyz.vvrf.reactor.flow.core.FlowGraph;
import xyz.vvrf.reactor.flow.core.NodeDescriptor;
import xyz.vvrf.reactor.flow.execution.ExecutionContext;
import xyz.vvrf.reactor.flow.execution.ExecutionScope;
import xyz.vvrf.reactor.flow.node.config.GroupConfig;

import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 分组节点：在 parentId 等于本节点 ID 的子图内执行一条独立的子流水线。
 * <p>
 * 并发执行子图的所有内部根节点，全部完成后按叶节点顺序拼接每个内部叶节点的全部累积输出作为结果。
 * 内部节点的错误只标记在该节点上，分组照常收集。同一次遍历中经多条路径到达的内部节点只执行一次。
 */
@Slf4j
public class GroupNode extends AbstractFlowNode<GroupConfig> {

    public static final String TYPE = "group";

    private final AtomicInteger traversalCounter = new AtomicInteger();

    public GroupNode(NodeDescriptor descriptor, NodeConfigResolver configResolver) {
        super(descriptor, configResolver, GroupConfig.class);
    }

    @Override
    protected Mono<Object> doExecute(Object input, GroupConfig config, ExecutionScope scope) {
        final ExecutionContext context = scope.getContext();
        final FlowGraph subgraph = scope.getGraph().getRootGraph().subgraph(getId());

        if (subgraph.isEmpty()) {
            trace(scope, "empty group, nothing to execute");
            return Mono.just(new ArrayList<>());
        }
        List<String> roots = subgraph.getRootNodeIds();
        if (roots.isEmpty()) {
            log.warn("[RunId: {}] Group '{}' has {} node(s) but no internal root.", context.getRunId(), getId(), subgraph.getNodes().size());
            trace(scope, "no internal root nodes found");
            return Mono.just(new ArrayList<>());
        }
        final List<String> leaves = subgraph.getLeafNodeIds();

        String traversalKey = "group:" + getId() + "#" + traversalCounter.incrementAndGet();
        ExecutionScope inner = scope.forSubgraph(subgraph, traversalKey);
        trace(scope, String.format("executing %d internal root(s) %s", roots.size(), roots));

        return inner.processAll(roots, input)
                .then(Mono.fromSupplier(() -> {
                    List<Object> collected = new ArrayList<>();
                    for (String leafId : leaves) {
                        collected.addAll(context.getOutput(leafId));
                    }
                    trace(scope, String.format("collected %d item(s) from leaves %s", collected.size(), leaves));
                    return (Object) collected;
                }));
    }

    /**
     * 每个收集到的元素单独写入本节点的输出列表，然后以完整列表标记成功。
     */
    @Override
    public void recordOutput(ExecutionContext context, Object output) {
        if (output instanceof List) {
            for (Object item : (List<?>) output) {
                context.storeOutput(getId(), item);
            }
        } else {
            context.storeOutput(getId(), output);
        }
        context.markSuccess(getId(), output);
    }
}
