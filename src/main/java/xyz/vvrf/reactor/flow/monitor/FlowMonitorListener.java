package xyz.vvrf.reactor.flow.monitor;

import xyz.vvrf.reactor.flow.core.FlowGraph;
import xyz.vvrf.reactor.flow.core.NodeState;

import java.time.Duration;
import java.util.Map;

/**
 * 用于监控流程执行事件的监听器接口。
 * 包括运行级别和节点级别的事件。实现抛出的异常会被调用方捕获并记录，不影响执行。
 */
public interface FlowMonitorListener {

    /**
     * 运行开始时调用。
     *
     * @param runId         运行 ID
     * @param graph         本次运行的图
     * @param triggerNodeId 触发节点 ID；为 null 表示执行所有根节点
     */
    void onRunStart(String runId, FlowGraph graph, String triggerNodeId);

    /**
     * 运行完成时调用。
     *
     * @param runId         运行 ID
     * @param totalDuration 总耗时
     * @param finalStates   所有节点的最终状态
     * @param error         运行因意外错误而终止时的异常，否则为 null
     */
    void onRunComplete(String runId, Duration totalDuration, Map<String, NodeState> finalStates, Throwable error);

    void onNodeStart(String runId, String nodeId, String nodeType);

    /**
     * 节点成功完成时调用。
     *
     * @param result 节点输出；为 null 表示节点终止了本分支
     */
    void onNodeSuccess(String runId, String nodeId, String nodeType, Duration duration, Object result);

    void onNodeFailure(String runId, String nodeId, String nodeType, Duration duration, Throwable error);
}
