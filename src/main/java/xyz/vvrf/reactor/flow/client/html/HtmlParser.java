package xyz.vvrf.reactor.flow.client.html;

import java.util.List;
import java.util.Map;

/**
 * DOM/HTML 解析契约。
 */
public interface HtmlParser {

    /**
     * 按规则从 HTML 中提取内容。
     *
     * @return 规则名 -> 提取值（字符串、字符串列表或 null）
     * @throws IllegalArgumentException 选择器无效时
     */
    Map<String, Object> extract(String html, List<ExtractionRule> rules);
}
