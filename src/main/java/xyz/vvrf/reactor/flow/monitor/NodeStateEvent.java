package xyz.vvrf.reactor.flow.monitor;

import lombok.Builder;
import lombok.Data;
import xyz.vvrf.reactor.flow.core.NodeStatus;

import java.util.Map;

@Data
@Builder
public class NodeStateEvent {
    private String runId;
    private EventType eventType;

    // 节点事件
    private String nodeId;
    private String nodeType;
    private NodeStatus nodeStatus;
    private String resultSummary;
    private String errorSummary;
    private Long durationMillis;

    // 运行完成事件
    private Boolean runSuccess;
    private Map<String, NodeStatus> finalNodeStatuses;

    public enum EventType {
        RUN_START, NODE_UPDATE, RUN_COMPLETE
    }
}
