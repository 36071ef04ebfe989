package xyz.vvrf.reactor.flow.monitor;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.flow.core.FlowGraph;
import xyz.vvrf.reactor.flow.core.NodeState;
import xyz.vvrf.reactor.flow.core.NodeStatus;
import xyz.vvrf.reactor.flow.util.Values;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * 将运行事件发布为按运行 ID 划分的实时事件流。
 * 每个运行的事件缓存在一个 replay sink 中，后到的订阅者也能收到完整历史；
 * 运行完成后经过保留时长清理。
 */
@Slf4j
public class RealtimeFlowMonitorListener implements FlowMonitorListener {

    private static final int REPLAY_LIMIT = 2000;
    private static final int SUMMARY_MAX_LENGTH = 200;

    // Key: runId
    private final Map<String, Sinks.Many<NodeStateEvent>> sinksByRunId = new ConcurrentHashMap<>();
    // Key: runId, Value: nodeId -> 最新事件
    private final Map<String, Map<String, NodeStateEvent>> currentNodeStates = new ConcurrentHashMap<>();

    private final Duration retention;
    private final Scheduler cleanupScheduler;

    public RealtimeFlowMonitorListener() {
        this(Duration.ofMinutes(30), Schedulers.boundedElastic());
    }

    public RealtimeFlowMonitorListener(Duration retention, Scheduler cleanupScheduler) {
        this.retention = Objects.requireNonNull(retention, "保留时长不能为空");
        this.cleanupScheduler = Objects.requireNonNull(cleanupScheduler, "清理调度器不能为空");
    }

    /**
     * 订阅某次运行的事件流。运行完成后流随之完成。
     * 运行开始前即可订阅；若保留时长内该运行仍未开始，流以完成结束并释放资源。
     */
    public Flux<NodeStateEvent> getEventStream(String runId) {
        AtomicBoolean created = new AtomicBoolean();
        Sinks.Many<NodeStateEvent> sink = sinksByRunId.computeIfAbsent(runId, key -> {
            created.set(true);
            return newSink();
        });
        if (created.get()) {
            cleanupScheduler.schedule(() -> {
                if (!currentNodeStates.containsKey(runId) && sinksByRunId.remove(runId, sink)) {
                    sink.tryEmitComplete();
                    log.debug("Released event stream of run {} which never started.", runId);
                }
            }, retention.toMillis(), TimeUnit.MILLISECONDS);
        }
        return sink.asFlux()
                .doOnSubscribe(s -> log.debug("New subscriber for run: {}", runId))
                .doOnCancel(() -> log.debug("Subscriber cancelled for run: {}", runId));
    }

    /**
     * 某次运行中各节点的最新事件快照。
     */
    public Map<String, NodeStateEvent> getCurrentStates(String runId) {
        Map<String, NodeStateEvent> states = currentNodeStates.get(runId);
        return states != null ? Collections.unmodifiableMap(new LinkedHashMap<>(states)) : Collections.emptyMap();
    }

    @Override
    public void onRunStart(String runId, FlowGraph graph, String triggerNodeId) {
        currentNodeStates.put(runId, new ConcurrentHashMap<>());
        emit(NodeStateEvent.builder()
                .runId(runId)
                .eventType(NodeStateEvent.EventType.RUN_START)
                .build());
    }

    @Override
    public void onRunComplete(String runId, Duration totalDuration, Map<String, NodeState> finalStates, Throwable error) {
        Map<String, NodeStatus> statuses = finalStates.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().getStatus()));
        emit(NodeStateEvent.builder()
                .runId(runId)
                .eventType(NodeStateEvent.EventType.RUN_COMPLETE)
                .durationMillis(totalDuration.toMillis())
                .runSuccess(error == null)
                .finalNodeStatuses(statuses)
                .errorSummary(summarizeError(error))
                .build());

        Sinks.Many<NodeStateEvent> sink = sinksByRunId.get(runId);
        if (sink != null) {
            sink.tryEmitComplete();
        }
        cleanupScheduler.schedule(() -> {
            sinksByRunId.remove(runId);
            currentNodeStates.remove(runId);
            log.debug("Cleaned up monitoring resources for run: {}", runId);
        }, retention.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void onNodeStart(String runId, String nodeId, String nodeType) {
        updateNodeState(runId, nodeId, nodeType, NodeStatus.RUNNING, null, null, null);
    }

    @Override
    public void onNodeSuccess(String runId, String nodeId, String nodeType, Duration duration, Object result) {
        updateNodeState(runId, nodeId, nodeType, NodeStatus.SUCCESS, duration, result, null);
    }

    @Override
    public void onNodeFailure(String runId, String nodeId, String nodeType, Duration duration, Throwable error) {
        updateNodeState(runId, nodeId, nodeType, NodeStatus.ERROR, duration, null, error);
    }

    private void updateNodeState(String runId, String nodeId, String nodeType, NodeStatus status,
                                 Duration duration, Object result, Throwable error) {
        NodeStateEvent event = NodeStateEvent.builder()
                .runId(runId)
                .eventType(NodeStateEvent.EventType.NODE_UPDATE)
                .nodeId(nodeId)
                .nodeType(nodeType)
                .nodeStatus(status)
                .durationMillis(duration != null ? duration.toMillis() : null)
                .resultSummary(result != null ? summarize(Values.asString(result)) : null)
                .errorSummary(summarizeError(error))
                .build();
        currentNodeStates.computeIfAbsent(runId, k -> new ConcurrentHashMap<>()).put(nodeId, event);
        emit(event);
    }

    boolean isTracking(String runId) {
        return sinksByRunId.containsKey(runId);
    }

    private Sinks.Many<NodeStateEvent> sinkFor(String runId) {
        return sinksByRunId.computeIfAbsent(runId, key -> newSink());
    }

    private static Sinks.Many<NodeStateEvent> newSink() {
        return Sinks.many().replay().limit(REPLAY_LIMIT);
    }

    private void emit(NodeStateEvent event) {
        Sinks.Many<NodeStateEvent> sink = sinkFor(event.getRunId());
        Sinks.EmitResult result;
        // 多个调度器线程可能并发发布，非串行失败时重试
        do {
            result = sink.tryEmitNext(event);
        } while (result == Sinks.EmitResult.FAIL_NON_SERIALIZED);
        if (result.isFailure()) {
            log.debug("Dropped monitoring event for run {}: {}", event.getRunId(), result);
        }
    }

    private static String summarizeError(Throwable error) {
        if (error == null) {
            return null;
        }
        return summarize(error.getClass().getSimpleName() + ": " + error.getMessage());
    }

    private static String summarize(String text) {
        if (text == null) {
            return null;
        }
        return text.length() > SUMMARY_MAX_LENGTH ? text.substring(0, SUMMARY_MAX_LENGTH) + "..." : text;
    }
}
