package xyz.vvrf.reactor.flow.client.html;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsoupHtmlParserTest {

    private static final String HTML = "<div class='item'><span> First </span><a href='/1'>one</a></div>"
            + "<div class='item'><span>Second</span><a>two</a></div>";

    private final JsoupHtmlParser parser = new JsoupHtmlParser();

    @Test
    void extractsTextAttributesAndInnerHtml() {
        Map<String, Object> result = parser.extract(HTML, Arrays.asList(
                new ExtractionRule("first", ".item span", "text", null, false),
                new ExtractionRule("names", ".item span", "text", null, true),
                new ExtractionRule("links", ".item a", "attribute", "href", true),
                new ExtractionRule("block", ".item", "html", null, false)));

        assertThat(result).containsEntry("first", "First");
        assertThat(result).containsEntry("names", Arrays.asList("First", "Second"));
        assertThat(result).containsEntry("links", Collections.singletonList("/1"));
        assertThat((String) result.get("block")).contains("<a href=\"/1\">one</a>");
    }

    @Test
    void noMatchGivesNullOrEmptyList() {
        Map<String, Object> result = parser.extract(HTML, Arrays.asList(
                new ExtractionRule("single", "table", "text", null, false),
                new ExtractionRule("many", "table", "text", null, true)));

        assertThat(result).containsEntry("single", null);
        assertThat(result).containsEntry("many", Collections.emptyList());
    }

    @Test
    void ruleWithoutSelectorIsRejected() {
        assertThatThrownBy(() -> parser.extract(HTML,
                Collections.singletonList(new ExtractionRule("empty", " ", "text", null, false))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Rule 'empty' has no selector");
    }

    @Test
    void invalidSelectorIsRejected() {
        assertThatThrownBy(() -> parser.extract(HTML,
                Collections.singletonList(new ExtractionRule("bad", "div[", "text", null, false))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid selector");
    }
}
