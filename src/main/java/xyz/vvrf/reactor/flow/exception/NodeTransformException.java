package xyz.vvrf.reactor.flow.exception;

/**
 * 外部调用失败：网络错误、非 2xx 响应、后端返回的结构化错误等。
 */
public class NodeTransformException extends FlowNodeException {

    public NodeTransformException(String nodeId, String message) {
        super(nodeId, message);
    }

    public NodeTransformException(String nodeId, String message, Throwable cause) {
        super(nodeId, message, cause);
    }
}
