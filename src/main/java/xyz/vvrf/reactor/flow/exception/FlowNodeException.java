package xyz.vvrf.reactor.flow.exception;

import lombok.Getter;

/**
 * 节点执行期间抛出的异常基类。
 * 由基础生命周期捕获并转换为节点的 ERROR 状态，不会向外传播。
 */
@Getter
public class FlowNodeException extends RuntimeException {

    private final String nodeId;

    public FlowNodeException(String nodeId, String message) {
        super(message);
        this.nodeId = nodeId;
    }

    public FlowNodeException(String nodeId, String message, Throwable cause) {
        super(message, cause);
        this.nodeId = nodeId;
    }
}
