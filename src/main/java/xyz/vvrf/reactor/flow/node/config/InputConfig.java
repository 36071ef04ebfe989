package xyz.vvrf.reactor.flow.node.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class InputConfig {

    public static final String MODE_BATCH = "batch";
    public static final String MODE_FOREACH = "foreach";

    /** 初始 element 项。*/
    private List<Object> items = new ArrayList<>();
    /** 初始 common 项。*/
    private List<Object> commonItems = new ArrayList<>();
    /** items 为空时按行拆分作为 element 项。*/
    private String textBuffer;

    private String executionMode = MODE_BATCH;
    /** 旧版开关，true 等同于 foreach。*/
    private Boolean iterateEachRow;

    /** common / replaceCommon / element / replaceElement / none */
    private String chainingUpdateMode = "element";
    /** always / oncePerContext / none */
    private String accumulationMode = "always";

    public boolean isForeach() {
        return MODE_FOREACH.equalsIgnoreCase(executionMode) || Boolean.TRUE.equals(iterateEachRow);
    }
}
