package xyz.vvrf.reactor.flow.client.html;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;

import java.util.*;

/**
 * 基于 jsoup 的 HtmlParser。
 */
@Slf4j
public class JsoupHtmlParser implements HtmlParser {

    @Override
    public Map<String, Object> extract(String html, List<ExtractionRule> rules) {
        Document document = Jsoup.parse(html != null ? html : "");
        Map<String, Object> result = new LinkedHashMap<>();
        for (ExtractionRule rule : rules) {
            if (rule.getSelector() == null || rule.getSelector().trim().isEmpty()) {
                throw new IllegalArgumentException(String.format("Rule '%s' has no selector", rule.getName()));
            }
            Elements elements;
            try {
                elements = document.select(rule.getSelector());
            } catch (Selector.SelectorParseException | IllegalArgumentException e) {
                throw new IllegalArgumentException(
                        String.format("Invalid selector '%s' in rule '%s': %s", rule.getSelector(), rule.getName(), e.getMessage()), e);
            }

            String key = rule.getName() != null ? rule.getName() : rule.getSelector();
            if (rule.isMultiple()) {
                List<String> values = new ArrayList<>();
                for (Element element : elements) {
                    String value = valueOf(element, rule);
                    if (value != null) {
                        values.add(value);
                    }
                }
                result.put(key, values);
            } else {
                Element first = elements.first();
                result.put(key, first != null ? valueOf(first, rule) : null);
            }
            log.trace("Rule '{}' matched {} element(s).", key, elements.size());
        }
        return result;
    }

    private String valueOf(Element element, ExtractionRule rule) {
        String target = rule.getTarget() != null ? rule.getTarget().toLowerCase(Locale.ROOT) : ExtractionRule.TARGET_TEXT;
        switch (target) {
            case ExtractionRule.TARGET_ATTRIBUTE:
                if (rule.getAttributeName() == null || !element.hasAttr(rule.getAttributeName())) {
                    return null;
                }
                return element.attr(rule.getAttributeName());
            case ExtractionRule.TARGET_HTML:
                return element.html();
            case ExtractionRule.TARGET_TEXT:
            default:
                return element.text().trim();
        }
    }
}
