package xyz.vvrf.reactor.flow.execution;

import reactor.core.publisher.Mono;

/**
 * 负责单个节点的基础生命周期：状态迁移、输出存储与子节点传播。
 */
public interface NodeExecutor {

    /**
     * 在给定范围内执行节点，并在其所有子节点完成后结束。
     * <p>
     * 节点自身的失败只会记录为该节点的 ERROR 状态，返回的 Mono 正常完成。
     * 唯一向外传播的错误是缺少执行上下文。
     *
     * @param nodeId 节点 ID（必须存在于 scope 的图中，否则忽略）
     * @param input  输入值，可能为 null
     * @param scope  执行范围
     * @return 在本节点及其所有后代完成时完成的 Mono
     */
    Mono<Void> process(String nodeId, Object input, ExecutionScope scope);
}
