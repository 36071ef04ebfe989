package xyz.vvrf.reactor.flow.client.html;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 单条 HTML 提取规则。
 */
@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExtractionRule {

    public static final String TARGET_TEXT = "text";
    public static final String TARGET_ATTRIBUTE = "attribute";
    public static final String TARGET_HTML = "html";

    private String name;
    private String selector;
    /** text / attribute / html */
    private String target = TARGET_TEXT;
    @JsonAlias("attribute_name")
    private String attributeName;
    private boolean multiple;

    public ExtractionRule(String name, String selector, String target, String attributeName, boolean multiple) {
        this.name = name;
        this.selector = selector;
        this.target = target;
        this.attributeName = attributeName;
        this.multiple = multiple;
    }
}
