package xyz.vvrf.reactor.flow.node;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;
import xyz.vvrf.reactor.flow.core.NodeDescriptor;
import xyz.vvrf.reactor.flow.exception.NodeStructureException;
import xyz.vvrf.reactor.flow.execution.ExecutionScope;
import xyz.vvrf.reactor.flow.test.util.TestFlows;

import static xyz.vvrf.reactor.flow.test.util.TestFlows.config;

class JsonExtractorNodeTest {

    private final TestFlows flows = new TestFlows();
    private final ExecutionScope scope = flows.newScope();

    private JsonExtractorNode extractor(Object... configKeyValues) {
        return new JsonExtractorNode(NodeDescriptor.of("j", JsonExtractorNode.TYPE, config(configKeyValues)),
                flows.getConfigResolver());
    }

    @Test
    void extractsFromJsonString() {
        StepVerifier.create(extractor("path", "$.data.items[1].name")
                        .execute("{\"data\":{\"items\":[{\"name\":\"a\"},{\"name\":\"b\"}]}}", scope))
                .expectNext("b")
                .verifyComplete();
    }

    @Test
    void emptyPathReturnsInput() {
        StepVerifier.create(extractor().execute("raw", scope))
                .expectNext("raw")
                .verifyComplete();
    }

    @Test
    void missingValueUsesDefault() {
        StepVerifier.create(extractor("path", "a.b", "defaultValue", "fallback").execute(config("a", 1), scope))
                .expectNext("fallback")
                .verifyComplete();
    }

    @Test
    void missingValueWithoutDefaultStops() {
        StepVerifier.create(extractor("path", "nope").execute(config("a", 1), scope))
                .verifyComplete();
    }

    @Test
    void nullInputStops() {
        StepVerifier.create(extractor("path", "a").execute(null, scope))
                .verifyComplete();
    }

    @Test
    void numericMapKeysAreNotIndices() {
        StepVerifier.create(extractor("path", "ids.12345678901").execute("{\"ids\":{\"12345678901\":\"long\"}}", scope))
                .expectNext("long")
                .verifyComplete();
        StepVerifier.create(extractor("path", "agents.007").execute(config("agents", config("007", "bond")), scope))
                .expectNext("bond")
                .verifyComplete();
    }

    @Test
    void malformedPathIsStructuralError() {
        StepVerifier.create(extractor("path", "a..b").execute(config("a", 1), scope))
                .expectError(NodeStructureException.class)
                .verify();
    }
}
