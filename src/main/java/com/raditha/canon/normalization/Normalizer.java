package com.raditha.canon.normalization;

import com.raditha.canon.correspondence.CorrespondenceEntry;
import com.raditha.canon.correspondence.CorrespondenceMap;
import com.raditha.canon.cst.ConcreteSyntaxTree;
import com.raditha.canon.cst.CstKind;
import com.raditha.canon.cst.CstNode;
import com.raditha.canon.exceptions.ParseException;
import com.raditha.canon.exceptions.SourceLocation;
import com.raditha.canon.format.FormatGrammars;
import com.raditha.canon.format.FormatProfile;
import com.raditha.canon.normalization.rules.DefaultValueRule;
import com.raditha.canon.semantic.NodeId;
import com.raditha.canon.semantic.SemanticKind;
import com.raditha.canon.semantic.SemanticNode;
import com.raditha.canon.semantic.SemanticPath;
import com.raditha.canon.semantic.SemanticTree;
import com.raditha.canon.semantic.SemanticValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives the canonical semantic tree of a concrete syntax tree, together with the
 * correspondence map that links every semantic node back to its text.
 * <p>
 * Normalization is a pure function of the tree and the rule set. Semantic ids are derived from
 * syntax node ids, so unedited subtrees keep their ids when a patched tree is normalized again.
 */
public class Normalizer {

    private static final Logger logger = LoggerFactory.getLogger(Normalizer.class);

    private final RuleSet rules;

    public Normalizer() {
        this(RuleSet.defaults());
    }

    public Normalizer(RuleSet rules) {
        this.rules = rules;
    }

    public RuleSet rules() {
        return rules;
    }

    /**
     * Normalize with the conventions of the grammar the tree was parsed with.
     */
    public NormalizationResult normalize(ConcreteSyntaxTree cst) {
        return normalize(cst, FormatGrammars.forName(cst.grammar()).profile());
    }

    /**
     * @throws ParseException on content without a meaning, such as duplicate keys
     * @throws com.raditha.canon.exceptions.AmbiguousTimestampFormatException when a timestamp
     *         matches patterns that disagree
     */
    public NormalizationResult normalize(ConcreteSyntaxTree cst, FormatProfile profile) {
        Walk walk = new Walk(cst, profile);
        SemanticNode root = walk.visit(cst.rootId(), SemanticPath.ROOT, null, CstNode.NO_PARENT, 0);
        SemanticTree tree = new SemanticTree(cst.lineage(), root);
        CorrespondenceMap map = walk.entries.build();
        logger.debug("Normalized {} syntax nodes into {} semantic nodes ({} synthetic, {} opaque)",
                cst.size(), tree.size(), walk.synthetic, walk.opaque);
        return new NormalizationResult(tree, map);
    }

    /**
     * One normalization pass over a tree.
     */
    private final class Walk {

        private final ConcreteSyntaxTree cst;
        private final FormatProfile profile;
        private final CorrespondenceMap.Builder entries;
        private int synthetic;
        private int opaque;

        Walk(ConcreteSyntaxTree cst, FormatProfile profile) {
            this.cst = cst;
            this.profile = profile;
            this.entries = CorrespondenceMap.builder(cst.lineage());
        }

        SemanticNode visit(int cstId, SemanticPath path, String key, int parentCstId, int ordinal) {
            CstNode node = cst.node(cstId);
            NodeId id = NodeId.backed(cst.lineage(), cstId);
            return switch (node.kind()) {
                case OPAQUE -> {
                    opaque++;
                    logger.debug("Passing through unsupported construct at {}", path);
                    record(id, node, parentCstId, key, path, RuleTag.opaque(node.literal()), ordinal);
                    yield SemanticNode.scalar(id, SemanticKind.OPAQUE, node.literal());
                }
                case SCALAR -> {
                    ScalarReading reading = rules.read(node.literal(), node.style().quote(), key, path, profile,
                            locate(cstId, path));
                    record(id, node, parentCstId, key, path, reading.tag(), ordinal);
                    if (reading.kind().isContainer()) {
                        SemanticNode embedded = SemanticValues.deterministic(id, reading.value());
                        CorrespondenceEntry.embeddedBelow(embedded, cstId, path).forEach(entries::put);
                        yield embedded;
                    }
                    yield SemanticNode.scalar(id, reading.kind(), reading.value());
                }
                case SEQUENCE -> {
                    record(id, node, parentCstId, key, path, RuleTag.container(SemanticKind.SEQUENCE), ordinal);
                    List<SemanticNode> items = new ArrayList<>();
                    List<Integer> children = node.children();
                    for (int i = 0; i < children.size(); i++) {
                        items.add(visit(children.get(i), path.child(i), null, cstId, i));
                    }
                    yield SemanticNode.sequence(id, items);
                }
                case MAPPING -> {
                    record(id, node, parentCstId, key, path, RuleTag.container(SemanticKind.MAPPING), ordinal);
                    yield SemanticNode.mapping(id, mappingEntries(node, id, path));
                }
            };
        }

        private Map<String, SemanticNode> mappingEntries(CstNode node, NodeId id, SemanticPath path) {
            Map<String, SemanticNode> result = new LinkedHashMap<>();
            Set<String> seen = new HashSet<>();
            List<Integer> children = node.children();
            for (int slot = 0; slot < node.slotCount(); slot++) {
                int keyId = children.get(2 * slot);
                int valueId = children.get(2 * slot + 1);
                String keyText = keyText(keyId, path);
                if (!seen.add(keyText)) {
                    throw new ParseException("Duplicate mapping key '" + keyText + "'",
                            locate(keyId, path.child(keyText)), profile.name());
                }
                SemanticPath childPath = path.child(keyText);
                if (rules.isIgnored(childPath)) {
                    logger.debug("Ignoring volatile entry {}", childPath);
                    continue;
                }
                result.put(keyText, visit(valueId, childPath, keyText, node.id(), slot));
            }
            int ordinal = node.slotCount();
            for (DefaultValueRule rule : rules.defaultsFor(path)) {
                if (seen.contains(rule.key())) {
                    continue;
                }
                seen.add(rule.key());
                SemanticNode value = SemanticValues.deterministic(id.child(rule.key()), rule.defaultValue())
                        .asSynthetic(true);
                recordSynthetic(value, node.id(), rule.key(), path.child(rule.key()), ordinal++);
                result.put(rule.key(), value);
            }
            return result;
        }

        private String keyText(int keyId, SemanticPath path) {
            CstNode key = cst.node(keyId);
            if (key.kind() != CstKind.SCALAR) {
                return key.literal();
            }
            try {
                return profile.syntax().decode(key.literal(), key.style().quote());
            } catch (IllegalArgumentException e) {
                throw new ParseException(e.getMessage(), locate(keyId, path), profile.name(), e);
            }
        }

        private void record(NodeId id, CstNode node, int parentCstId, String key, SemanticPath path, RuleTag tag,
                            int ordinal) {
            entries.put(CorrespondenceEntry.backed(id, node.id(), parentCstId, key, path, tag, ordinal, node.span()));
        }

        private void recordSynthetic(SemanticNode value, int hostCstId, String key, SemanticPath path, int ordinal) {
            synthetic++;
            entries.put(CorrespondenceEntry.synthetic(value.id(), hostCstId, key, path,
                    RuleTag.syntheticDefault(value.kind(), value.isContainer() ? null : value.value()), ordinal));
            if (value.kind() == SemanticKind.SEQUENCE) {
                for (int i = 0; i < value.items().size(); i++) {
                    recordSynthetic(value.items().get(i), hostCstId, null, path.child(i), i);
                }
            } else if (value.kind() == SemanticKind.MAPPING) {
                int i = 0;
                for (Map.Entry<String, SemanticNode> e : value.entries().entrySet()) {
                    recordSynthetic(e.getValue(), hostCstId, e.getKey(), path.child(e.getKey()), i++);
                }
            }
        }

        private SourceLocation locate(int cstId, SemanticPath path) {
            return cst.locate(cstId, path.toString());
        }
    }
}
