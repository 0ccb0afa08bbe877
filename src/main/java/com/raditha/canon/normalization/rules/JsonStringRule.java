package com.raditha.canon.normalization.rules;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.raditha.canon.cst.QuoteStyle;
import com.raditha.canon.format.ScalarSyntax;
import com.raditha.canon.normalization.NormalizationRule;
import com.raditha.canon.normalization.RenderContext;
import com.raditha.canon.normalization.RuleKind;
import com.raditha.canon.normalization.RuleTag;
import com.raditha.canon.normalization.ScalarInput;
import com.raditha.canon.normalization.ScalarReading;
import com.raditha.canon.semantic.NodeId;
import com.raditha.canon.semantic.SemanticKind;
import com.raditha.canon.semantic.SemanticNode;
import com.raditha.canon.semantic.SemanticValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * JSON held in quoted strings under configured keys, as Tekton does for parameter values:
 * {@code value: '["a"]'} reads as the list {@code [a]}. Quoted text that is not JSON stays a
 * string. A changed value is written back as compact JSON in the quoting of the original literal.
 */
public class JsonStringRule implements NormalizationRule {

    private static final Logger logger = LoggerFactory.getLogger(JsonStringRule.class);

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.USE_BIG_INTEGER_FOR_INTS)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    private static final NodeId PARSED = new NodeId("json", "value");

    private final Set<String> keys;

    public JsonStringRule(Set<String> keys) {
        this.keys = Set.copyOf(keys);
    }

    public Set<String> keys() {
        return keys;
    }

    @Override
    public RuleKind kind() {
        return RuleKind.EMBEDDED_JSON;
    }

    /**
     * Containers come back with a plain {@code List} or {@code Map} as their value, which is also
     * the canonical value of the tag.
     */
    @Override
    public Optional<ScalarReading> read(ScalarInput input) {
        if (input.key() == null || input.isPlain() || !keys.contains(input.key())) {
            return Optional.empty();
        }
        return parse(input.text()).map(node -> {
            Object canonical = node.isContainer() ? node.toPlain() : node.value();
            return new ScalarReading(node.kind(), canonical,
                    RuleTag.of(RuleKind.EMBEDDED_JSON, input.quote(), input.literal(), node.kind(), canonical));
        });
    }

    /**
     * The value a JSON text denotes, or empty when the text is not JSON.
     */
    public static Optional<SemanticNode> parse(String text) {
        if (text.isBlank()) {
            return Optional.empty();
        }
        try {
            Object value = MAPPER.readValue(text, Object.class);
            return Optional.of(SemanticValues.deterministic(PARSED, value));
        } catch (JsonProcessingException e) {
            logger.trace("Not JSON: {}", text);
            return Optional.empty();
        }
    }

    @Override
    public Optional<String> render(SemanticNode value, RuleTag tag, RenderContext context) {
        String json = toJson(value);
        QuoteStyle wanted = context.preferredQuote();
        if (wanted == null || wanted == QuoteStyle.PLAIN) {
            wanted = tag != null && tag.quote() != QuoteStyle.PLAIN ? tag.quote() : context.profile().fallbackQuote();
        }
        ScalarSyntax syntax = context.profile().syntax();
        QuoteStyle quote = wanted != QuoteStyle.PLAIN && syntax.supports(wanted, json) ? wanted : QuoteStyle.DOUBLE;
        String literal = syntax.encode(json, quote);

        ScalarReading back = context.reader().read(literal, quote, context.key(), context.path());
        if (back.tag().kind() != RuleKind.EMBEDDED_JSON
                || !SemanticValues.deterministic(PARSED, back.value()).equals(value)) {
            logger.warn("JSON text {} at {} does not read back as the value it was written for", literal,
                    context.path());
        }
        return Optional.of(literal);
    }

    /**
     * Compact JSON text of a value. Timestamps are written as ISO-8601 strings.
     */
    public static String toJson(SemanticNode value) {
        try {
            return MAPPER.writeValueAsString(plain(value));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot write " + value + " as JSON", e);
        }
    }

    private static Object plain(SemanticNode node) {
        return switch (node.kind()) {
            case SEQUENCE -> {
                List<Object> items = new ArrayList<>();
                node.items().forEach(item -> items.add(plain(item)));
                yield items;
            }
            case MAPPING -> {
                Map<String, Object> entries = new LinkedHashMap<>();
                node.entries().forEach((k, v) -> entries.put(k, plain(v)));
                yield entries;
            }
            case TIMESTAMP -> node.value().toString();
            default -> node.value();
        };
    }
}
