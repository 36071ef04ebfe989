package xyz.vvrf.reactor.flow.exception;

/**
 * 路径或选择器格式错误。
 */
public class NodeStructureException extends FlowNodeException {

    public NodeStructureException(String nodeId, String message) {
        super(nodeId, message);
    }

    public NodeStructureException(String nodeId, String message, Throwable cause) {
        super(nodeId, message, cause);
    }
}
