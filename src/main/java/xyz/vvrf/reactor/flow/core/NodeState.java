package xyz.vvrf.reactor.flow.core;

import lombok.Getter;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * 单个节点的状态快照（不可变数据类），供外部观察者只读。
 * 请使用静态工厂方法创建实例。
 */
@Getter
public final class NodeState {

    private static final NodeState IDLE = new NodeState(NodeStatus.IDLE, null, null, Instant.EPOCH);

    private final NodeStatus status;
    private final Object result;
    private final String error;
    private final Instant updatedAt;

    private NodeState(NodeStatus status, Object result, String error, Instant updatedAt) {
        this.status = Objects.requireNonNull(status, "节点状态不能为空");
        this.result = result;
        this.error = error;
        this.updatedAt = updatedAt;

        if (status == NodeStatus.ERROR && error == null) {
            throw new IllegalArgumentException("ERROR 状态必须包含错误信息。");
        }
    }

    public static NodeState idle() {
        return IDLE;
    }

    public static NodeState running() {
        return new NodeState(NodeStatus.RUNNING, null, null, Instant.now());
    }

    public static NodeState success(Object result) {
        return new NodeState(NodeStatus.SUCCESS, result, null, Instant.now());
    }

    public static NodeState error(String message) {
        return new NodeState(NodeStatus.ERROR, null, message, Instant.now());
    }

    public static NodeState skipped() {
        return new NodeState(NodeStatus.SKIPPED, null, null, Instant.now());
    }

    public Optional<Object> getResultOptional() {
        return Optional.ofNullable(result);
    }

    public Optional<String> getErrorOptional() {
        return Optional.ofNullable(error);
    }

    public boolean isSuccess() {
        return status == NodeStatus.SUCCESS;
    }

    public boolean isError() {
        return status == NodeStatus.ERROR;
    }

    @Override
    public String toString() {
        return String.format("NodeState[status=%s, result=%s, error=%s]", status, result, error);
    }
}
