package xyz.vvrf.reactor.flow.core;

import java.util.Objects;
import java.util.Optional;

/**
 * 两个节点之间的有向连接（不可变数据类）。
 * sourceHandle 仅由产生分支的节点（如条件节点的 "trueHandle"/"falseHandle"）用于筛选出边。
 */
public final class Edge {

    public static final String TRUE_HANDLE = "trueHandle";
    public static final String FALSE_HANDLE = "falseHandle";

    private final String source;
    private final String target;
    private final String sourceHandle;

    public Edge(String source, String target, String sourceHandle) {
        this.source = Objects.requireNonNull(source, "源节点 ID 不能为空");
        this.target = Objects.requireNonNull(target, "目标节点 ID 不能为空");
        this.sourceHandle = sourceHandle;
    }

    public static Edge of(String source, String target) {
        return new Edge(source, target, null);
    }

    public static Edge of(String source, String target, String sourceHandle) {
        return new Edge(source, target, sourceHandle);
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    public Optional<String> getSourceHandle() {
        return Optional.ofNullable(sourceHandle);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Edge edge = (Edge) o;
        return source.equals(edge.source) &&
                target.equals(edge.target) &&
                Objects.equals(sourceHandle, edge.sourceHandle);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target, sourceHandle);
    }

    @Override
    public String toString() {
        return sourceHandle == null
                ? String.format("Edge[%s -> %s]", source, target)
                : String.format("Edge[%s(%s) -> %s]", source, sourceHandle, target);
    }
}
