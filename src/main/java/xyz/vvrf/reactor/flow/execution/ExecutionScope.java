package xyz.vvrf.reactor.flow.execution;

import lombok.Getter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.core.FlowGraph;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;

/**
 * 显式传递给每个节点的执行范围：当前上下文、当前作用域的图以及用于调用子节点的执行器。
 * <p>
 * 分组遍历时会带上一个遍历键，执行器据此保证同一节点在一次遍历中只执行一次。
 */
@Getter
public final class ExecutionScope {

    private final ExecutionContext context;
    private final FlowGraph graph;
    private final NodeExecutor executor;
    private final String traversalKey;

    public ExecutionScope(ExecutionContext context, FlowGraph graph, NodeExecutor executor) {
        this(context, graph, executor, null);
    }

    private ExecutionScope(ExecutionContext context, FlowGraph graph, NodeExecutor executor, String traversalKey) {
        this.context = context;
        this.graph = Objects.requireNonNull(graph, "FlowGraph 不能为空");
        this.executor = Objects.requireNonNull(executor, "NodeExecutor 不能为空");
        this.traversalKey = traversalKey;
    }

    public Optional<String> getTraversalKey() {
        return Optional.ofNullable(traversalKey);
    }

    /**
     * 换用另一个上下文（通常是迭代上下文），图与遍历键不变。
     */
    public ExecutionScope withContext(ExecutionContext newContext) {
        return new ExecutionScope(newContext, graph, executor, traversalKey);
    }

    /**
     * 进入子图作用域，并开启一次新的去重遍历。
     */
    public ExecutionScope forSubgraph(FlowGraph subgraph, String newTraversalKey) {
        return new ExecutionScope(context, subgraph, executor, newTraversalKey);
    }

    public Mono<Void> process(String nodeId, Object input) {
        return executor.process(nodeId, input, this);
    }

    /**
     * 并发调用多个节点，全部完成后结束。
     */
    public Mono<Void> processAll(Collection<String> nodeIds, Object input) {
        return Flux.fromIterable(nodeIds)
                .flatMap(nodeId -> executor.process(nodeId, input, this))
                .then();
    }
}
