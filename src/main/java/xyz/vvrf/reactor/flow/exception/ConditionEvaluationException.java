package xyz.vvrf.reactor.flow.exception;

/**
 * 分支谓词求值失败。条件节点会捕获该异常并按 false 处理。
 */
public class ConditionEvaluationException extends FlowNodeException {

    public ConditionEvaluationException(String nodeId, String message, Throwable cause) {
        super(nodeId, message, cause);
    }
}
