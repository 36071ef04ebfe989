package xyz.vvrf.reactor.flow.core;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.execution.ExecutionContext;
import xyz.vvrf.reactor.flow.execution.ExecutionScope;

import java.util.List;

/**
 * 图中节点的统一契约。
 * <p>
 * 具体节点类型只需实现 {@link #execute(Object, ExecutionScope)}：返回一个值、返回空（{@code Mono.empty()}，
 * 即"终止本分支"的保留信号），或者以错误结束。状态迁移、输出存储以及向子节点的传播由
 * {@link xyz.vvrf.reactor.flow.execution.NodeExecutor} 负责，节点不应直接修改上下文中的状态。
 * <p>
 * 控制流节点可以覆盖下面的钩子方法来改变遍历行为。
 */
public interface FlowNode {

    String getId();

    /**
     * @return 注册表中的类型标签
     */
    String getType();

    /**
     * 执行节点自身的转换逻辑。
     *
     * @param input 上游输出，可能为 null（例如无输入触发的根节点）
     * @param scope 当前执行范围（上下文、图、执行器）
     * @return 输出值；空 Mono 表示终止本分支
     */
    Mono<Object> execute(Object input, ExecutionScope scope);

    /**
     * 从全部出边中选择需要继续传播的边。默认全部保留。
     */
    default List<Edge> selectOutgoingEdges(Object output, List<Edge> outgoing) {
        return outgoing;
    }

    /**
     * 传递给子节点的值。默认即为输出本身。
     */
    default Object valueForChildren(Object output) {
        return output;
    }

    /**
     * 将输出写入上下文。默认追加到本节点的输出列表并标记成功。
     */
    default void recordOutput(ExecutionContext context, Object output) {
        context.storeOutput(getId(), output);
    }
}
