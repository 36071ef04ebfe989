package xyz.vvrf.reactor.flow.util;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.core.Edge;
import xyz.vvrf.reactor.flow.core.FlowGraph;
import xyz.vvrf.reactor.flow.core.NodeDescriptor;

import java.util.*;

/**
 * 图结构检查的工具方法。
 */
@Slf4j
public final class GraphUtils {

    private GraphUtils() {}

    /**
     * 使用深度优先搜索 (DFS) 检测图中是否存在循环。
     * 节点会递归调用其子节点，因此循环会导致无限传播。
     *
     * @param graph 要检查的图
     * @throws IllegalArgumentException 如果检测到循环
     */
    public static void detectCycles(FlowGraph graph) {
        Set<String> visited = new HashSet<>(); // 完全访问过的节点
        Set<String> visiting = new HashSet<>(); // 当前递归路径上的节点
        Map<String, List<String>> adj = buildAdjacencyList(graph.getEdges());

        for (NodeDescriptor node : graph.getNodes()) {
            if (!visited.contains(node.getId())) {
                dfs(node.getId(), visited, visiting, adj);
            }
        }
        log.debug("{}: No cycles detected.", graph);
    }

    private static void dfs(String nodeId, Set<String> visited, Set<String> visiting, Map<String, List<String>> adj) {
        visited.add(nodeId);
        visiting.add(nodeId);

        for (String neighbor : adj.getOrDefault(nodeId, Collections.emptyList())) {
            if (visiting.contains(neighbor)) {
                throw new IllegalArgumentException(String.format(
                        "Cycle detected! Path involves edge from '%s' to '%s'.", nodeId, neighbor));
            }
            if (!visited.contains(neighbor)) {
                dfs(neighbor, visited, visiting, adj);
            }
        }

        visiting.remove(nodeId); // 回溯
    }

    // Source -> List<Target>
    private static Map<String, List<String>> buildAdjacencyList(List<Edge> edges) {
        Map<String, List<String>> adj = new HashMap<>();
        for (Edge edge : edges) {
            adj.computeIfAbsent(edge.getSource(), k -> new ArrayList<>()).add(edge.getTarget());
        }
        return adj;
    }
}
