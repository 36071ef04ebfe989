package xyz.vvrf.reactor.flow.execution;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.core.FlowNode;
import xyz.vvrf.reactor.flow.core.NodeDescriptor;
import xyz.vvrf.reactor.flow.core.NodeState;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * 单次运行（或 foreach 的单次迭代）的共享状态。
 * <p>
 * 只做簿记：节点状态、累积输出、日志、迭代元数据以及去重集合。所有方法都是同步调用，
 * 可能同时被多个调度线程访问，内部使用并发容器与同步列表。
 * <p>
 * 通过 {@link #createIterationContext(int, int, Object)} 创建的迭代上下文与父上下文共享
 * runId、触发节点、输出、状态、日志与节点实例，但拥有独立的迭代元数据和去重集合。
 */
@Slf4j
public class ExecutionContext {

    @Getter private final String runId;
    @Getter private final String triggerNodeId;
    @Getter private final Instant startTime;

    private final Integer iterationIndex;
    private final Integer iterationTotal;
    private final Object iterationItem;

    // 以下状态在整个运行内共享
    private final Map<String, List<Object>> outputs;
    private final Map<String, NodeState> statuses;
    private final List<String> logs;
    private final Map<String, FlowNode> nodeInstances;
    private final Map<String, String> displayContents;

    // 每个上下文独立
    private final Set<String> executedNodeIds = ConcurrentHashMap.newKeySet();

    public ExecutionContext(String runId, String triggerNodeId) {
        this.runId = (runId != null && !runId.trim().isEmpty())
                ? runId
                : "flow-run-" + UUID.randomUUID().toString().substring(0, 8);
        this.triggerNodeId = triggerNodeId;
        this.startTime = Instant.now();
        this.iterationIndex = null;
        this.iterationTotal = null;
        this.iterationItem = null;
        this.outputs = new ConcurrentHashMap<>();
        this.statuses = new ConcurrentHashMap<>();
        this.logs = Collections.synchronizedList(new ArrayList<>());
        this.nodeInstances = new ConcurrentHashMap<>();
        this.displayContents = new ConcurrentHashMap<>();
        log.debug("[RunId: {}] ExecutionContext created (trigger: {}).", this.runId, triggerNodeId);
    }

    private ExecutionContext(ExecutionContext parent, int index, int total, Object item) {
        this.runId = parent.runId;
        this.triggerNodeId = parent.triggerNodeId;
        this.startTime = parent.startTime;
        this.iterationIndex = index;
        this.iterationTotal = total;
        this.iterationItem = item;
        this.outputs = parent.outputs;
        this.statuses = parent.statuses;
        this.logs = parent.logs;
        this.nodeInstances = parent.nodeInstances;
        this.displayContents = parent.displayContents;
    }

    // --- 状态 ---

    public void markRunning(String nodeId) {
        statuses.put(nodeId, NodeState.running());
    }

    public void markSuccess(String nodeId, Object result) {
        statuses.put(nodeId, NodeState.success(result));
    }

    public void markError(String nodeId, String message) {
        statuses.put(nodeId, NodeState.error(message != null ? message : "Unknown error"));
        log(String.format("Node %s failed: %s", nodeId, message));
    }

    public NodeState getNodeState(String nodeId) {
        return statuses.getOrDefault(nodeId, NodeState.idle());
    }

    /**
     * @return 当前所有节点状态的快照
     */
    public Map<String, NodeState> getNodeStates() {
        return Collections.unmodifiableMap(new HashMap<>(statuses));
    }

    // --- 输出 ---

    /**
     * 追加一条输出并将节点标记为成功。
     */
    public void storeOutput(String nodeId, Object value) {
        outputs.computeIfAbsent(nodeId, k -> Collections.synchronizedList(new ArrayList<>())).add(value);
        markSuccess(nodeId, value);
    }

    /**
     * @return 节点全部输出的快照，按写入顺序；没有输出时返回空列表
     */
    public List<Object> getOutput(String nodeId) {
        List<Object> values = outputs.get(nodeId);
        if (values == null) {
            return Collections.emptyList();
        }
        synchronized (values) {
            return Collections.unmodifiableList(new ArrayList<>(values));
        }
    }

    public void putDisplayContent(String nodeId, String content) {
        displayContents.put(nodeId, content);
    }

    public Optional<String> getDisplayContent(String nodeId) {
        return Optional.ofNullable(displayContents.get(nodeId));
    }

    // --- 迭代 ---

    public ExecutionContext createIterationContext(int index, int total) {
        return createIterationContext(index, total, null);
    }

    public ExecutionContext createIterationContext(int index, int total, Object item) {
        return new ExecutionContext(this, index, total, item);
    }

    public boolean isIteration() {
        return iterationIndex != null;
    }

    public OptionalInt getIterationIndex() {
        return iterationIndex != null ? OptionalInt.of(iterationIndex) : OptionalInt.empty();
    }

    public OptionalInt getIterationTotal() {
        return iterationTotal != null ? OptionalInt.of(iterationTotal) : OptionalInt.empty();
    }

    public Optional<Object> getIterationItem() {
        return Optional.ofNullable(iterationItem);
    }

    // --- 去重 ---

    public boolean hasExecutedNode(String key) {
        return executedNodeIds.contains(key);
    }

    public void markNodeExecuted(String key) {
        executedNodeIds.add(key);
    }

    /**
     * 原子性地检查并记录。
     *
     * @return 如果是首次记录则返回 true
     */
    public boolean tryMarkNodeExecuted(String key) {
        return executedNodeIds.add(key);
    }

    // --- 节点实例 ---

    /**
     * 获取或创建节点实例。每次运行中每个节点 ID 只创建一次实例，迭代上下文共享父上下文的实例。
     *
     * @param descriptor 节点描述
     * @param factory    仅当实例不存在时调用
     */
    public FlowNode getOrCreateNode(NodeDescriptor descriptor, Function<NodeDescriptor, FlowNode> factory) {
        return nodeInstances.computeIfAbsent(descriptor.getId(), key -> {
            log.debug("[RunId: {}] Creating node instance '{}' (type: {}).", runId, key, descriptor.getType());
            return factory.apply(descriptor);
        });
    }

    // --- 日志 ---

    public void log(String message) {
        String line = isIteration()
                ? String.format("[%d/%d] %s", iterationIndex + 1, iterationTotal, message)
                : message;
        logs.add(line);
        log.debug("[RunId: {}] {}", runId, line);
    }

    public List<String> getLogs() {
        synchronized (logs) {
            return Collections.unmodifiableList(new ArrayList<>(logs));
        }
    }

    @Override
    public String toString() {
        return isIteration()
                ? String.format("ExecutionContext[run=%s, iteration=%d/%d]", runId, iterationIndex, iterationTotal)
                : String.format("ExecutionContext[run=%s]", runId);
    }
}
