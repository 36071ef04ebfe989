package xyz.vvrf.reactor.flow.config;

import java.util.Map;
import java.util.Optional;

/**
 * 以节点 ID 为键的外部配置查找。
 * 节点在每次执行开始时读取当前配置，因此两次运行之间的修改无需重建图即可生效。
 */
public interface NodeConfigStore {

    /**
     * @param nodeId 节点 ID
     * @return 该节点的当前配置；没有覆盖时为空
     */
    Optional<Map<String, Object>> find(String nodeId);
}
