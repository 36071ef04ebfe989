package xyz.vvrf.reactor.flow.node.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.Setter;
import xyz.vvrf.reactor.flow.client.html.ExtractionRule;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class HtmlParserConfig {
    private List<ExtractionRule> extractionRules = new ArrayList<>();
}
