package xyz.vvrf.reactor.flow.node;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.config.NodeConfigResolver;
import xyz.vvrf.reactor.flow.core.NodeDescriptor;
import xyz.vvrf.reactor.flow.execution.ExecutionContext;
import xyz.vvrf.reactor.flow.execution.ExecutionScope;
import xyz.vvrf.reactor.flow.node.config.InputConfig;
import xyz.vvrf.reactor.flow.util.Values;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 输入节点，维护三组数据：chaining（收到过的全部原始输入）、common（各迭代共享）与 element（逐项）。
 * <p>
 * batch 模式返回 {@code [...common, ...element]}；foreach 模式对每一项创建迭代上下文，
 * 依次（串行）调用所有直接子节点，然后返回空，避免基础生命周期再次整体传播。
 */
@Slf4j
public class InputNode extends AbstractFlowNode<InputConfig> {

    public static final String TYPE = "input";

    private final List<Object> chainingItems = new ArrayList<>();
    private final List<Object> commonItems = new ArrayList<>();
    private final List<Object> elementItems = new ArrayList<>();
    private boolean seeded;

    public InputNode(NodeDescriptor descriptor, NodeConfigResolver configResolver) {
        super(descriptor, configResolver, InputConfig.class);
    }

    @Override
    protected Mono<Object> doExecute(Object input, InputConfig config, ExecutionScope scope) {
        final List<Object> items = accumulate(input, config, scope.getContext());

        if (!config.isForeach()) {
            trace(scope, String.format("batch mode, emitting %d item(s)", items.size()));
            return Mono.just(items);
        }
        return runForeach(items, scope).then(Mono.empty());
    }

    private synchronized List<Object> accumulate(Object input, InputConfig config, ExecutionContext context) {
        if (!seeded) {
            commonItems.addAll(config.getCommonItems() != null ? config.getCommonItems() : Collections.emptyList());
            elementItems.addAll(initialElements(config));
            seeded = true;
        }

        if (input != null) {
            chainingItems.add(input);
            if (shouldAccumulate(config.getAccumulationMode(), context)) {
                applyChainingUpdate(config.getChainingUpdateMode(), Values.toItems(input));
            } else {
                log.debug("[RunId: {}] Input node '{}' skipped accumulation (mode: {}).",
                        context.getRunId(), getId(), config.getAccumulationMode());
            }
        }

        List<Object> combined = new ArrayList<>(commonItems.size() + elementItems.size());
        combined.addAll(commonItems);
        combined.addAll(elementItems);
        return combined;
    }

    private boolean shouldAccumulate(String accumulationMode, ExecutionContext context) {
        String mode = accumulationMode != null ? accumulationMode : "always";
        switch (mode) {
            case "none":
                return false;
            case "oncePerContext":
                return context.tryMarkNodeExecuted("accumulate:" + getId());
            case "always":
            default:
                return true;
        }
    }

    private void applyChainingUpdate(String chainingUpdateMode, List<Object> values) {
        String mode = chainingUpdateMode != null ? chainingUpdateMode : "element";
        switch (mode) {
            case "common":
                commonItems.addAll(values);
                break;
            case "replaceCommon":
                commonItems.clear();
                commonItems.addAll(values);
                break;
            case "replaceElement":
                elementItems.clear();
                elementItems.addAll(values);
                break;
            case "none":
                break;
            case "element":
            default:
                elementItems.addAll(values);
                break;
        }
    }

    private static List<Object> initialElements(InputConfig config) {
        if (config.getItems() != null && !config.getItems().isEmpty()) {
            return config.getItems();
        }
        if (config.getTextBuffer() != null) {
            return Arrays.stream(config.getTextBuffer().split("\\r?\\n"))
                    .map(String::trim)
                    .filter(line -> !line.isEmpty())
                    .collect(Collectors.toList());
        }
        return Collections.emptyList();
    }

    private Mono<Void> runForeach(List<Object> items, ExecutionScope scope) {
        final ExecutionContext context = scope.getContext();
        final List<String> children = scope.getGraph().getChildIds(getId());
        final int total = items.size();
        trace(scope, String.format("foreach mode, %d item(s) x %d child(ren)", total, children.size()));
        if (children.isEmpty() || total == 0) {
            return Mono.empty();
        }

        return Flux.range(0, total)
                .concatMap(index -> {
                    Object item = items.get(index);
                    ExecutionContext iterationContext = context.createIterationContext(index, total, item);
                    iterationContext.log(String.format("%s(%s): processing item %d", getType(), getId(), index));
                    return scope.withContext(iterationContext).processAll(children, item);
                })
                .then();
    }

    public synchronized List<Object> getChainingItems() {
        return Collections.unmodifiableList(new ArrayList<>(chainingItems));
    }

    public synchronized List<Object> getCommonItems() {
        return Collections.unmodifiableList(new ArrayList<>(commonItems));
    }

    public synchronized List<Object> getElementItems() {
        return Collections.unmodifiableList(new ArrayList<>(elementItems));
    }
}
