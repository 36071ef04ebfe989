package xyz.vvrf.reactor.flow.execution;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.core.FlowGraph;

/**
 * 流程执行引擎接口。
 * 负责根据触发节点创建执行上下文并启动根节点。
 */
public interface FlowEngine {

    /**
     * 执行一次运行。
     *
     * @param graph         本次运行的图 (不能为空)
     * @param triggerNodeId 触发节点 ID；为 null 时执行所有顶层根节点
     * @param input         传递给根节点的输入，可为 null
     * @return 所有分支完成后发出本次运行的上下文（包含最终状态与输出）。
     *         图中存在循环或触发节点不存在时以 IllegalArgumentException 结束。
     */
    default Mono<ExecutionContext> execute(FlowGraph graph, String triggerNodeId, Object input) {
        return execute(graph, triggerNodeId, input, null);
    }

    /**
     * @param runId 运行 ID；为空时自动生成
     */
    Mono<ExecutionContext> execute(FlowGraph graph, String triggerNodeId, Object input, String runId);

    default Mono<ExecutionContext> executeAll(FlowGraph graph, Object input) {
        return execute(graph, null, input, null);
    }
}
