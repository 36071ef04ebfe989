package xyz.vvrf.reactor.flow.node;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.config.NodeConfigResolver;
import xyz.vvrf.reactor.flow.core.NodeDescriptor;
import xyz.vvrf.reactor.flow.execution.ExecutionContext;
import xyz.vvrf.reactor.flow.execution.ExecutionScope;
import xyz.vvrf.reactor.flow.node.config.MergerConfig;
import xyz.vvrf.reactor.flow.util.Values;

import java.util.*;

/**
 * 合并节点：在实例生命周期内维护一个持续增长的列表。
 * <p>
 * 每次到达都会追加输入（集合则追加其元素）并返回当前完整列表，因此每个上游分支都会触发一次下游传播，
 * 且每次携带更长的累积结果。object 策略下按配置的键字段、{@code id} 字段、{@code item_<index>} 依次取键。
 */
public class MergerNode extends AbstractFlowNode<MergerConfig> {

    public static final String TYPE = "merger";

    private final List<Object> items = new ArrayList<>();

    public MergerNode(NodeDescriptor descriptor, NodeConfigResolver configResolver) {
        super(descriptor, configResolver, MergerConfig.class);
    }

    @Override
    protected Mono<Object> doExecute(Object input, MergerConfig config, ExecutionScope scope) {
        final Object merged;
        final int size;
        // 输出必须按合并顺序写入，因此写入也在锁内
        synchronized (items) {
            if (input != null) {
                items.addAll(Values.toItems(input));
            }
            List<Object> snapshot = new ArrayList<>(items);
            size = snapshot.size();
            merged = MergerConfig.STRATEGY_OBJECT.equalsIgnoreCase(config.getStrategy())
                    ? toKeyedObject(snapshot, config.getKeys())
                    : snapshot;
            scope.getContext().storeOutput(getId(), merged);
        }
        trace(scope, String.format("merged input, now holding %d item(s)", size));
        return Mono.just(merged);
    }

    /**
     * 输出已在 execute 中随合并一起写入。
     */
    @Override
    public void recordOutput(ExecutionContext context, Object output) {
    }

    /**
     * 清空累积的元素。
     */
    public void reset() {
        synchronized (items) {
            items.clear();
        }
    }

    public List<Object> getItems() {
        synchronized (items) {
            return Collections.unmodifiableList(new ArrayList<>(items));
        }
    }

    static Map<String, Object> toKeyedObject(List<Object> values, List<String> keys) {
        Map<String, Object> merged = new LinkedHashMap<>();
        for (int i = 0; i < values.size(); i++) {
            Object item = values.get(i);
            merged.put(keyOf(item, i, keys), item);
        }
        return merged;
    }

    private static String keyOf(Object item, int index, List<String> keys) {
        if (item instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) item;
            if (keys != null) {
                for (String key : keys) {
                    Object value = map.get(key);
                    if (value != null) {
                        return Values.asString(value);
                    }
                }
            }
            Object id = map.get("id");
            if (id != null) {
                return Values.asString(id);
            }
        }
        return "item_" + index;
    }
}
