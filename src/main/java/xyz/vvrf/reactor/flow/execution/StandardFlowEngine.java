package xyz.vvrf.reactor.flow.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.core.FlowGraph;
import xyz.vvrf.reactor.flow.monitor.FlowMonitorListener;
import xyz.vvrf.reactor.flow.util.GraphUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.function.Consumer;

/**
 * FlowEngine 的标准实现。
 * 每个 execute 调用创建一个 ExecutionContext，并发启动所有根节点，等待全部分支完成。
 * 单个分支的失败不会影响其它分支，也不会使整个运行失败。
 */
@Slf4j
public class StandardFlowEngine implements FlowEngine {

    private final NodeExecutor nodeExecutor;
    private final List<FlowMonitorListener> monitorListeners;

    public StandardFlowEngine(NodeExecutor nodeExecutor, List<FlowMonitorListener> monitorListeners) {
        this.nodeExecutor = Objects.requireNonNull(nodeExecutor, "NodeExecutor cannot be null");
        this.monitorListeners = (monitorListeners != null)
                ? Collections.unmodifiableList(new ArrayList<>(monitorListeners))
                : Collections.emptyList();
        log.info("StandardFlowEngine initialized. Executor: {}, listeners: {}",
                nodeExecutor.getClass().getSimpleName(), this.monitorListeners.size());
    }

    @Override
    public Mono<ExecutionContext> execute(FlowGraph graph, String triggerNodeId, Object input, String runId) {
        Objects.requireNonNull(graph, "FlowGraph cannot be null");

        return Mono.defer(() -> {
            GraphUtils.detectCycles(graph);

            final List<String> roots;
            if (triggerNodeId != null) {
                if (!graph.containsNode(triggerNodeId)) {
                    return Mono.error(new IllegalArgumentException(
                            String.format("Trigger node '%s' does not exist in the graph.", triggerNodeId)));
                }
                roots = Collections.singletonList(triggerNodeId);
            } else {
                roots = graph.getRootNodeIds();
            }

            final ExecutionContext context = new ExecutionContext(runId, triggerNodeId);
            final ExecutionScope scope = new ExecutionScope(context, graph, nodeExecutor);
            final String actualRunId = context.getRunId();
            final Instant startTime = Instant.now();

            if (roots.isEmpty()) {
                log.info("[RunId: {}] {} has no root nodes, nothing to execute.", actualRunId, graph);
            } else {
                log.info("[RunId: {}] Starting run from {} root node(s): {}", actualRunId, roots.size(), roots);
            }
            context.log(String.format("Run started from %s", roots));
            safeNotifyListeners(l -> l.onRunStart(actualRunId, graph, triggerNodeId));

            return Flux.fromIterable(roots)
                    .flatMap(rootId -> nodeExecutor.process(rootId, input, scope))
                    .then()
                    .doOnSuccess(v -> {
                        Duration duration = Duration.between(startTime, Instant.now());
                        log.info("[RunId: {}] Run completed in {}ms.", actualRunId, duration.toMillis());
                        context.log("Run completed");
                        safeNotifyListeners(l -> l.onRunComplete(actualRunId, duration, context.getNodeStates(), null));
                    })
                    .doOnError(e -> {
                        Duration duration = Duration.between(startTime, Instant.now());
                        log.error("[RunId: {}] Run failed with unexpected error: {}", actualRunId, e.getMessage(), e);
                        safeNotifyListeners(l -> l.onRunComplete(actualRunId, duration, context.getNodeStates(), e));
                    })
                    .thenReturn(context);
        });
    }

    private void safeNotifyListeners(Consumer<FlowMonitorListener> notification) {
        for (FlowMonitorListener listener : monitorListeners) {
            try {
                notification.accept(listener);
            } catch (Exception e) {
                log.error("Flow monitor listener {} threw during notification: {}", listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }
}
