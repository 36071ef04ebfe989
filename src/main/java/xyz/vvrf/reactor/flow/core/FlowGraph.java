package xyz.vvrf.reactor.flow.core;

import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 一次运行所使用的节点/边集合（不可变）。
 * <p>
 * 子节点、根节点、叶节点以及分组子图都在调用时根据边列表即时计算，不做缓存，
 * 因此两次运行之间可以自由编辑图。引用了不存在节点的边在构建时被丢弃。
 * <p>
 * 顶层图的作用域 ID 为 null；通过 {@link #subgraph(String)} 得到的分组子图以分组 ID 为作用域，
 * 仅包含 parentId 等于该分组 ID 的节点以及两端都在子图内的边。
 */
@Slf4j
public final class FlowGraph {

    private final Map<String, NodeDescriptor> nodes;
    private final List<Edge> edges;
    private final String scopeId;
    private final FlowGraph rootGraph;

    private FlowGraph(Map<String, NodeDescriptor> nodes, List<Edge> edges, String scopeId, FlowGraph rootGraph) {
        this.nodes = Collections.unmodifiableMap(nodes);
        this.edges = Collections.unmodifiableList(edges);
        this.scopeId = scopeId;
        this.rootGraph = (rootGraph != null) ? rootGraph : this;
    }

    /**
     * 创建顶层图。
     *
     * @param nodeDescriptors 节点列表 (ID 必须唯一)
     * @param edgeList        边列表 (悬空边会被丢弃)
     * @throws IllegalArgumentException 如果节点 ID 重复
     */
    public static FlowGraph of(Collection<NodeDescriptor> nodeDescriptors, Collection<Edge> edgeList) {
        Objects.requireNonNull(nodeDescriptors, "节点列表不能为空");
        Map<String, NodeDescriptor> nodeMap = new LinkedHashMap<>();
        for (NodeDescriptor descriptor : nodeDescriptors) {
            if (nodeMap.putIfAbsent(descriptor.getId(), descriptor) != null) {
                throw new IllegalArgumentException(String.format("节点 ID '%s' 在图中重复。", descriptor.getId()));
            }
        }

        List<Edge> validEdges = new ArrayList<>();
        if (edgeList != null) {
            for (Edge edge : edgeList) {
                if (nodeMap.containsKey(edge.getSource()) && nodeMap.containsKey(edge.getTarget())) {
                    validEdges.add(edge);
                } else {
                    log.warn("Dropping edge {} because it references a node that is not part of the graph.", edge);
                }
            }
        }
        return new FlowGraph(nodeMap, validEdges, null, null);
    }

    public static FlowGraph empty() {
        return of(Collections.emptyList(), Collections.emptyList());
    }

    public Optional<NodeDescriptor> getNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public boolean containsNode(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    public Collection<NodeDescriptor> getNodes() {
        return nodes.values();
    }

    public List<Edge> getEdges() {
        return edges;
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public Optional<String> getScopeId() {
        return Optional.ofNullable(scopeId);
    }

    /**
     * @return 完整的顶层图；对顶层图返回自身。
     */
    public FlowGraph getRootGraph() {
        return rootGraph;
    }

    public List<Edge> getOutgoingEdges(String nodeId) {
        return edges.stream()
                .filter(e -> e.getSource().equals(nodeId))
                .collect(Collectors.toList());
    }

    public List<Edge> getIncomingEdges(String nodeId) {
        return edges.stream()
                .filter(e -> e.getTarget().equals(nodeId))
                .collect(Collectors.toList());
    }

    /**
     * 按边的声明顺序返回直接子节点 ID（去重）。
     */
    public List<String> getChildIds(String nodeId) {
        return getOutgoingEdges(nodeId).stream()
                .map(Edge::getTarget)
                .distinct()
                .collect(Collectors.toList());
    }

    /**
     * 当前作用域内没有入边的节点。顶层图中不包括属于分组的节点。
     */
    public List<String> getRootNodeIds() {
        Set<String> targets = edges.stream().map(Edge::getTarget).collect(Collectors.toSet());
        return nodes.values().stream()
                .filter(this::inScope)
                .map(NodeDescriptor::getId)
                .filter(id -> !targets.contains(id))
                .collect(Collectors.toList());
    }

    /**
     * 当前作用域内没有出边的节点。
     */
    public List<String> getLeafNodeIds() {
        Set<String> sources = edges.stream().map(Edge::getSource).collect(Collectors.toSet());
        return nodes.values().stream()
                .filter(this::inScope)
                .map(NodeDescriptor::getId)
                .filter(id -> !sources.contains(id))
                .collect(Collectors.toList());
    }

    /**
     * 从完整图中划分出指定分组的子图。每次调用都会重新计算。
     *
     * @param groupId 分组节点 ID
     * @return 分组子图，可能为空
     */
    public FlowGraph subgraph(String groupId) {
        Objects.requireNonNull(groupId, "分组 ID 不能为空");
        Map<String, NodeDescriptor> members = new LinkedHashMap<>();
        for (NodeDescriptor descriptor : rootGraph.nodes.values()) {
            if (descriptor.getParentId().map(groupId::equals).orElse(false)) {
                members.put(descriptor.getId(), descriptor);
            }
        }
        List<Edge> internalEdges = rootGraph.edges.stream()
                .filter(e -> members.containsKey(e.getSource()) && members.containsKey(e.getTarget()))
                .collect(Collectors.toList());
        return new FlowGraph(members, internalEdges, groupId, rootGraph);
    }

    private boolean inScope(NodeDescriptor descriptor) {
        return Objects.equals(descriptor.getParentId().orElse(null), scopeId);
    }

    @Override
    public String toString() {
        return String.format("FlowGraph[scope=%s, nodes=%d, edges=%d]",
                scopeId == null ? "<root>" : scopeId, nodes.size(), edges.size());
    }
}
