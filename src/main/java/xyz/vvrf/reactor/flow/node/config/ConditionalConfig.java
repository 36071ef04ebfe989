package xyz.vvrf.reactor.flow.node.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.Setter;

import java.util.Map;

/**
 * 条件节点配置。兼容多种历史写法：
 * conditionType/conditionValue、type/value 以及嵌套的 condition 对象。
 */
@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConditionalConfig {
    private String conditionType;
    private String type;
    private Object conditionValue;
    private Object value;
    private Map<String, Object> condition;
}
