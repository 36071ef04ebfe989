package xyz.vvrf.reactor.flow.exception;

/**
 * 必需配置缺失或配置无法解析（如缺少 URL、provider、model）。
 */
public class NodeConfigurationException extends FlowNodeException {

    public NodeConfigurationException(String nodeId, String message) {
        super(nodeId, message);
    }

    public NodeConfigurationException(String nodeId, String message, Throwable cause) {
        super(nodeId, message, cause);
    }
}
