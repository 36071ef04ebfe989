package xyz.vvrf.reactor.flow.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import xyz.vvrf.reactor.flow.core.Edge;
import xyz.vvrf.reactor.flow.core.FlowGraph;
import xyz.vvrf.reactor.flow.core.FlowNode;
import xyz.vvrf.reactor.flow.core.NodeDescriptor;
import xyz.vvrf.reactor.flow.monitor.FlowMonitorListener;
import xyz.vvrf.reactor.flow.registry.NodeRegistry;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * NodeExecutor 的标准实现。
 * <p>
 * 生命周期：
 * <ol>
 *     <li>要求存在执行上下文；获取（或创建）节点实例并标记为 RUNNING。</li>
 *     <li>在节点执行调度器上调用 {@link FlowNode#execute}。</li>
 *     <li>有值：记录输出，解析子节点，并发调用所有子节点并等待其完成。</li>
 *     <li>空：以 null 结果标记成功，不解析子节点。</li>
 *     <li>错误：标记 ERROR，不调用子节点，正常完成。</li>
 * </ol>
 */
@Slf4j
public class StandardNodeExecutor implements NodeExecutor {

    private final NodeRegistry nodeRegistry;
    private final Scheduler nodeExecutionScheduler;
    private final List<FlowMonitorListener> monitorListeners;

    /**
     * 创建 StandardNodeExecutor 实例。
     *
     * @param nodeRegistry           节点注册表
     * @param nodeExecutionScheduler 节点执行的 Reactor Scheduler
     * @param monitorListeners       监控监听器列表，可为 null
     */
    public StandardNodeExecutor(NodeRegistry nodeRegistry,
                                Scheduler nodeExecutionScheduler,
                                List<FlowMonitorListener> monitorListeners) {
        this.nodeRegistry = Objects.requireNonNull(nodeRegistry, "NodeRegistry 不能为空");
        this.nodeExecutionScheduler = Objects.requireNonNull(nodeExecutionScheduler, "节点执行调度器不能为空");
        this.monitorListeners = (monitorListeners != null)
                ? Collections.unmodifiableList(new ArrayList<>(monitorListeners))
                : Collections.emptyList();
        log.info("StandardNodeExecutor initialized. Scheduler: {}, listeners: {}",
                nodeExecutionScheduler.getClass().getSimpleName(), this.monitorListeners.size());
    }

    @Override
    public Mono<Void> process(String nodeId, Object input, ExecutionScope scope) {
        if (scope == null || scope.getContext() == null) {
            return Mono.error(new IllegalStateException(
                    String.format("节点 '%s' 未绑定 ExecutionContext，无法执行。", nodeId)));
        }
        return Mono.defer(() -> processInternal(nodeId, input, scope));
    }

    private Mono<Void> processInternal(String nodeId, Object input, ExecutionScope scope) {
        final ExecutionContext context = scope.getContext();
        final String runId = context.getRunId();

        Optional<NodeDescriptor> descriptorOpt = scope.getGraph().getNode(nodeId);
        if (!descriptorOpt.isPresent()) {
            log.warn("[RunId: {}] Node '{}' is not part of {}. Ignoring.", runId, nodeId, scope.getGraph());
            return Mono.empty();
        }
        final NodeDescriptor descriptor = descriptorOpt.get();

        Optional<String> traversalKey = scope.getTraversalKey();
        if (traversalKey.isPresent() && !context.tryMarkNodeExecuted(traversalKey.get() + "/" + nodeId)) {
            log.debug("[RunId: {}] Node '{}' already executed in traversal '{}'. Skipping re-entry.",
                    runId, nodeId, traversalKey.get());
            return Mono.empty();
        }

        final FlowNode node;
        try {
            node = context.getOrCreateNode(descriptor, nodeRegistry::create);
        } catch (Exception e) {
            log.error("[RunId: {}] Failed to create node '{}' (type: {}).", runId, nodeId, descriptor.getType(), e);
            context.markError(nodeId, describe(e));
            safeNotifyListeners(l -> l.onNodeFailure(runId, nodeId, descriptor.getType(), Duration.ZERO, e));
            return Mono.empty();
        }

        context.markRunning(nodeId);
        final Instant startTime = Instant.now();
        safeNotifyListeners(l -> l.onNodeStart(runId, nodeId, node.getType()));
        log.debug("[RunId: {}] Executing node '{}' (type: {}, impl: {}).",
                runId, nodeId, node.getType(), node.getClass().getSimpleName());

        return Mono.defer(() -> node.execute(input, scope))
                .subscribeOn(nodeExecutionScheduler)
                .map(Outcome::value)
                .switchIfEmpty(Mono.fromSupplier(Outcome::stopped))
                .onErrorResume(error -> Mono.just(Outcome.failed(error)))
                .flatMap(outcome -> complete(node, outcome, scope, startTime));
    }

    private Mono<Void> complete(FlowNode node, Outcome outcome, ExecutionScope scope, Instant startTime) {
        final ExecutionContext context = scope.getContext();
        final String runId = context.getRunId();
        final String nodeId = node.getId();

        if (outcome.error != null) {
            return fail(node, outcome.error, context, startTime);
        }

        if (outcome.stopped) {
            context.markSuccess(nodeId, null);
            log.debug("[RunId: {}] Node '{}' returned no value. Branch terminated.", runId, nodeId);
            safeNotifyListeners(l -> l.onNodeSuccess(runId, nodeId, node.getType(), elapsed(startTime), null));
            return Mono.empty();
        }

        final Object output = outcome.output;
        final List<String> childIds;
        final Object forwarded;
        try {
            node.recordOutput(context, output);
            childIds = resolveChildren(node, output, scope.getGraph());
            forwarded = node.valueForChildren(output);
        } catch (Exception e) {
            return fail(node, e, context, startTime);
        }
        safeNotifyListeners(l -> l.onNodeSuccess(runId, nodeId, node.getType(), elapsed(startTime), output));

        if (childIds.isEmpty()) {
            log.trace("[RunId: {}] Node '{}' has no children. Branch ends here.", runId, nodeId);
            return Mono.empty();
        }
        log.debug("[RunId: {}] Node '{}' propagating to children {}.", runId, nodeId, childIds);
        return Flux.fromIterable(childIds)
                .flatMap(childId -> process(childId, forwarded, scope))
                .then();
    }

    private Mono<Void> fail(FlowNode node, Throwable error, ExecutionContext context, Instant startTime) {
        String runId = context.getRunId();
        String message = describe(error);
        log.warn("[RunId: {}] Node '{}' (type: {}) failed: {}", runId, node.getId(), node.getType(), message);
        log.debug("[RunId: {}] Failure details for node '{}'.", runId, node.getId(), error);
        context.markError(node.getId(), message);
        safeNotifyListeners(l -> l.onNodeFailure(runId, node.getId(), node.getType(), elapsed(startTime), error));
        return Mono.empty();
    }

    private List<String> resolveChildren(FlowNode node, Object output, FlowGraph graph) {
        List<Edge> outgoing = graph.getOutgoingEdges(node.getId());
        if (outgoing.isEmpty()) {
            return Collections.emptyList();
        }
        return node.selectOutgoingEdges(output, outgoing).stream()
                .map(Edge::getTarget)
                .filter(graph::containsNode)
                .distinct()
                .collect(Collectors.toList());
    }

    private static Duration elapsed(Instant startTime) {
        return Duration.between(startTime, Instant.now());
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private void safeNotifyListeners(Consumer<FlowMonitorListener> notification) {
        if (monitorListeners.isEmpty()) {
            return;
        }
        for (FlowMonitorListener listener : monitorListeners) {
            try {
                notification.accept(listener);
            } catch (Exception e) {
                log.error("Flow monitor listener {} threw during notification: {}", listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }

    /**
     * execute 的三种结局：有值、空、错误。
     */
    private static final class Outcome {
        private final Object output;
        private final boolean stopped;
        private final Throwable error;

        private Outcome(Object output, boolean stopped, Throwable error) {
            this.output = output;
            this.stopped = stopped;
            this.error = error;
        }

        static Outcome value(Object output) {
            return new Outcome(output, false, null);
        }

        static Outcome stopped() {
            return new Outcome(null, true, null);
        }

        static Outcome failed(Throwable error) {
            return new Outcome(null, false, error);
        }
    }
}
