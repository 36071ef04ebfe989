package xyz.vvrf.reactor.flow.node.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class MergerConfig {

    public static final String STRATEGY_ARRAY = "array";
    public static final String STRATEGY_OBJECT = "object";

    private String strategy = STRATEGY_ARRAY;
    /** object 策略下用于取键的字段，按顺序尝试。*/
    private List<String> keys = new ArrayList<>();
}
