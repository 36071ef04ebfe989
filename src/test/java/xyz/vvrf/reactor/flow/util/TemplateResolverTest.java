package xyz.vvrf.reactor.flow.util;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateResolverTest {

    @Test
    void replacesInputPlaceholder() {
        assertThat(TemplateResolver.resolve("Hello {{ input }}!", "world")).isEqualTo("Hello world!");
        assertThat(TemplateResolver.resolve("n={{input}}", 2.0)).isEqualTo("n=2");
        assertThat(TemplateResolver.resolve("v={{input}}", null)).isEqualTo("v=");
    }

    @Test
    void structuredInputRendersAsCompactJson() {
        assertThat(TemplateResolver.resolve("{{input}}", Arrays.asList(1, 2))).isEqualTo("[1,2]");
    }

    @Test
    void resolvesPathsIntoInput() {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("user", Collections.singletonMap("id", 7));

        assertThat(TemplateResolver.resolve("/users/{{user.id}}", input)).isEqualTo("/users/7");
        assertThat(TemplateResolver.resolve("/users/{{input.user.id}}", input)).isEqualTo("/users/7");
        assertThat(TemplateResolver.resolve("/users/{{user.id}}", "{\"user\":{\"id\":8}}")).isEqualTo("/users/8");
    }

    @Test
    void unresolvablePlaceholdersAreKept() {
        assertThat(TemplateResolver.resolve("x={{missing}}", Collections.emptyMap())).isEqualTo("x={{missing}}");
        assertThat(TemplateResolver.resolve("x={{a.b}}", "plain")).isEqualTo("x={{a.b}}");
    }

    @Test
    void customInputRenderer() {
        assertThat(TemplateResolver.resolve("[{{input}}]", "x", v -> "<" + v + ">")).isEqualTo("[<x>]");
        assertThat(TemplateResolver.resolve(null, "x")).isEmpty();
        assertThat(TemplateResolver.resolve("no placeholders", "x")).isEqualTo("no placeholders");
    }
}
