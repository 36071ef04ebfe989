package xyz.vvrf.reactor.flow.monitor;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.core.FlowGraph;
import xyz.vvrf.reactor.flow.core.NodeState;
import xyz.vvrf.reactor.flow.core.NodeStatus;

import java.time.Duration;
import java.util.Map;

@Slf4j
public class LoggingFlowMonitorListener implements FlowMonitorListener {

    @Override
    public void onRunStart(String runId, FlowGraph graph, String triggerNodeId) {
        log.info("[MONITOR] 运行:[{}] 开始。 节点数:[{}], 触发节点:[{}]",
                runId, graph.getNodes().size(), triggerNodeId != null ? triggerNodeId : "<all roots>");
    }

    @Override
    public void onRunComplete(String runId, Duration totalDuration, Map<String, NodeState> finalStates, Throwable error) {
        long failed = finalStates.values().stream().filter(s -> s.getStatus() == NodeStatus.ERROR).count();
        if (error != null) {
            log.error("[MONITOR] 运行:[{}] 异常终止。 耗时:[{}ms], 错误:[{}]",
                    runId, totalDuration.toMillis(), error.getMessage(), error);
        } else {
            log.info("[MONITOR] 运行:[{}] 完成。 耗时:[{}ms], 已执行节点:[{}], 失败节点:[{}]",
                    runId, totalDuration.toMillis(), finalStates.size(), failed);
        }
    }

    @Override
    public void onNodeStart(String runId, String nodeId, String nodeType) {
        log.info("[MONITOR] 运行:[{}] 节点:[{}] 开始。 类型:[{}]", runId, nodeId, nodeType);
    }

    @Override
    public void onNodeSuccess(String runId, String nodeId, String nodeType, Duration duration, Object result) {
        log.info("[MONITOR] 运行:[{}] 节点:[{}] 成功。 耗时:[{}ms], 有输出:[{}]",
                runId, nodeId, duration.toMillis(), result != null);
    }

    @Override
    public void onNodeFailure(String runId, String nodeId, String nodeType, Duration duration, Throwable error) {
        log.error("[MONITOR] 运行:[{}] 节点:[{}] 失败。 耗时:[{}ms], 错误:[{}], 类型:[{}]",
                runId, nodeId, duration.toMillis(), error.getMessage(), nodeType, error);
    }
}
