package com.raditha.canon.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.raditha.canon.cst.ConcreteSyntaxTree;
import com.raditha.canon.diff.Edit;
import com.raditha.canon.diff.Patch;
import com.raditha.canon.format.SourceParser;
import com.raditha.canon.format.yaml.YamlGrammar;
import com.raditha.canon.normalization.NormalizationResult;
import com.raditha.canon.normalization.Normalizer;
import com.raditha.canon.normalization.RuleSet;
import com.raditha.canon.normalization.rules.DefaultValueRule;
import com.raditha.canon.patch.PatchBackEngine;
import com.raditha.canon.patch.PatchResult;
import com.raditha.canon.reassembly.Reassembler;
import com.raditha.canon.semantic.SemanticKind;
import com.raditha.canon.semantic.SemanticNode;
import com.raditha.canon.semantic.SemanticPath;
import com.raditha.canon.semantic.SemanticTree;
import com.raditha.canon.semantic.SemanticValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Writes the canonical view of a semantic tree: keys sorted, values in their canonical spelling
 * and entries that hold their default value left out. Reading the view back with the same rules
 * gives a tree equal to the one written.
 * <p>
 * YAML is written by projecting the tree onto an empty document, so it follows the same layout
 * rules as inserted text. JSON is written by Jackson.
 */
public class CanonicalWriter {

    private static final Logger logger = LoggerFactory.getLogger(CanonicalWriter.class);

    private final RuleSet rules;
    private final ObjectMapper mapper;

    public CanonicalWriter(RuleSet rules) {
        this.rules = rules;
        this.mapper = new ObjectMapper()
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Canonical text of {@code tree} in the format named by {@code format} ({@code yaml} or {@code json}).
     */
    public String write(SemanticTree tree, String format) {
        SemanticNode canonical = canonical(tree.root(), SemanticPath.ROOT);
        String text = switch (format.toLowerCase()) {
            case "json" -> writeJson(canonical);
            case "yaml", "yml" -> writeYaml(canonical);
            default -> throw new IllegalArgumentException("Invalid format: " + format + ". Must be: yaml or json");
        };
        logger.debug("Wrote {} characters of canonical {}", text.length(), format);
        return text;
    }

    /**
     * Sorted copy of {@code node} without entries equal to their default.
     */
    SemanticNode canonical(SemanticNode node, SemanticPath path) {
        if (node.kind() == SemanticKind.MAPPING) {
            Map<String, SemanticNode> sorted = new LinkedHashMap<>();
            for (Map.Entry<String, SemanticNode> e : new TreeMap<>(node.entries()).entrySet()) {
                if (isDefault(path, e.getKey(), e.getValue())) {
                    continue;
                }
                sorted.put(e.getKey(), canonical(e.getValue(), path.child(e.getKey())));
            }
            return node.withEntries(sorted).asSynthetic(false);
        }
        if (node.kind() == SemanticKind.SEQUENCE) {
            List<SemanticNode> items = new ArrayList<>();
            for (int i = 0; i < node.items().size(); i++) {
                items.add(canonical(node.items().get(i), path.child(i)));
            }
            return node.withItems(items).asSynthetic(false);
        }
        return node.asSynthetic(false);
    }

    private boolean isDefault(SemanticPath path, String key, SemanticNode value) {
        Optional<DefaultValueRule> rule = rules.defaultFor(path, key);
        return rule.isPresent()
                && SemanticValues.deterministic(value.id(), rule.get().defaultValue()).equals(value);
    }

    private String writeYaml(SemanticNode canonical) {
        ConcreteSyntaxTree empty = new SourceParser().parse("", new YamlGrammar());
        NormalizationResult normalized = new Normalizer(rules).normalize(empty);
        Patch patch = Patch.of(Edit.replaceValue(normalized.tree().root().id(), canonical));
        PatchResult result = new PatchBackEngine(rules, null, true).applyPatch(empty, normalized.map(), patch);
        if (!result.isClean()) {
            throw new IllegalStateException("Cannot write canonical YAML: " + result.failures());
        }
        String text = new Reassembler().reassemble(result.tree());
        return text.isEmpty() || text.endsWith("\n") ? text : text + "\n";
    }

    private String writeJson(SemanticNode canonical) {
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withSeparators(Separators.createDefaultInstance()
                        .withObjectFieldValueSpacing(Separators.Spacing.AFTER));
        try {
            return mapper.writer(printer).writeValueAsString(plain(canonical)) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot write canonical JSON", e);
        }
    }

    /**
     * Values Jackson can write: timestamps and opaque text become strings.
     */
    private static Object plain(SemanticNode node) {
        return switch (node.kind()) {
            case MAPPING -> {
                Map<String, Object> map = new LinkedHashMap<>();
                node.entries().forEach((k, v) -> map.put(k, plain(v)));
                yield map;
            }
            case SEQUENCE -> {
                List<Object> list = new ArrayList<>();
                node.items().forEach(i -> list.add(plain(i)));
                yield list;
            }
            case TIMESTAMP -> ((Instant) node.value()).toString();
            case OPAQUE -> String.valueOf(node.value());
            default -> node.value();
        };
    }

    /**
     * Canonical view of a document in its own format.
     */
    public static String write(Document document) {
        return new CanonicalWriter(document.rules()).write(document.tree(), document.grammar().name());
    }
}
