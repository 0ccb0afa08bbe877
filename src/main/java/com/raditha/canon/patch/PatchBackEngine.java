package com.raditha.canon.patch;

import com.raditha.canon.correspondence.CorrespondenceEntry;
import com.raditha.canon.correspondence.CorrespondenceMap;
import com.raditha.canon.cst.ConcreteSyntaxTree;
import com.raditha.canon.cst.CstKind;
import com.raditha.canon.cst.CstNode;
import com.raditha.canon.cst.CstWorkingCopy;
import com.raditha.canon.cst.Layout;
import com.raditha.canon.cst.QuoteStyle;
import com.raditha.canon.diff.Edit;
import com.raditha.canon.diff.EditOp;
import com.raditha.canon.diff.FormatHint;
import com.raditha.canon.diff.Patch;
import com.raditha.canon.exceptions.AmbiguousInsertPositionException;
import com.raditha.canon.exceptions.CanonException;
import com.raditha.canon.exceptions.InvalidEditException;
import com.raditha.canon.exceptions.SourceLocation;
import com.raditha.canon.exceptions.StaleReferenceException;
import com.raditha.canon.format.FormatGrammars;
import com.raditha.canon.format.FormatProfile;
import com.raditha.canon.format.OrphanCommentPolicy;
import com.raditha.canon.normalization.RuleKind;
import com.raditha.canon.normalization.RuleSet;
import com.raditha.canon.normalization.RuleTag;
import com.raditha.canon.normalization.ScalarReader;
import com.raditha.canon.normalization.ScalarRenderer;
import com.raditha.canon.normalization.rules.DefaultValueRule;
import com.raditha.canon.semantic.NodeId;
import com.raditha.canon.semantic.SemanticKind;
import com.raditha.canon.semantic.SemanticNode;
import com.raditha.canon.semantic.SemanticPath;
import com.raditha.canon.semantic.SemanticValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Applies a patch to the syntax tree a document was normalized from, changing only the text of
 * the nodes the edits touch.
 * <p>
 * Replaced scalars are written back through the rule that read them, so quoting, number spelling
 * and timestamp patterns survive unless the edit asks for another style. Inserted entries copy
 * the layout of their nearest sibling. Deleted entries pass their comments on to a neighbour.
 * Edits inside a structure held as JSON text in one literal rewrite that literal.
 * <p>
 * Edits run against a working copy. Under {@link TransactionMode#ALL_OR_NOTHING} the first
 * failing edit rejects the patch and the input tree is returned unchanged; under
 * {@link TransactionMode#BEST_EFFORT} a failing edit is rolled back and reported while the others
 * are kept.
 */
public class PatchBackEngine {

    private static final Logger logger = LoggerFactory.getLogger(PatchBackEngine.class);

    private final RuleSet rules;
    private final ScalarRenderer renderer;
    private final OrphanCommentPolicy commentPolicy;
    private final boolean profileInsertHints;

    public PatchBackEngine() {
        this(RuleSet.defaults());
    }

    public PatchBackEngine(RuleSet rules) {
        this(rules, null, false);
    }

    /**
     * @param rules              rules the document was normalized with
     * @param commentPolicy      where comments of deleted entries go, or null for the format's own
     * @param profileInsertHints whether inserts into empty collections may proceed without a hint,
     *                           using the format's preferred layout
     */
    public PatchBackEngine(RuleSet rules, OrphanCommentPolicy commentPolicy, boolean profileInsertHints) {
        this.rules = rules;
        this.renderer = new ScalarRenderer(rules);
        this.commentPolicy = commentPolicy;
        this.profileInsertHints = profileInsertHints;
    }

    public PatchResult applyPatch(ConcreteSyntaxTree cst, CorrespondenceMap map, Patch patch) {
        return applyPatch(cst, map, patch, TransactionMode.ALL_OR_NOTHING);
    }

    public PatchResult applyPatch(ConcreteSyntaxTree cst, CorrespondenceMap map, Patch patch, TransactionMode mode) {
        if (!cst.lineage().equals(map.lineage())) {
            throw new IllegalArgumentException("Correspondence map of " + map.lineage()
                    + " does not belong to tree " + cst.lineage());
        }
        FormatProfile profile = FormatGrammars.forName(cst.grammar()).profile();
        if (commentPolicy != null) {
            profile = profile.withOrphanCommentPolicy(commentPolicy);
        }
        CstWorkingCopy workingCopy = cst.edit();
        CorrespondenceMap.Builder entries = map.toBuilder();
        Session session = new Session(workingCopy, entries, profile);
        List<EditFailure> failures = new ArrayList<>();

        List<Edit> edits = patch.edits();
        for (int i = 0; i < edits.size(); i++) {
            Edit edit = edits.get(i);
            int treeMark = workingCopy.checkpoint();
            int mapMark = entries.checkpoint();
            try {
                session.apply(edit);
            } catch (CanonException e) {
                workingCopy.rollback(treeMark);
                entries.rollback(mapMark);
                failures.add(new EditFailure(i, edit, e));
                if (mode == TransactionMode.ALL_OR_NOTHING) {
                    logger.warn("Rejecting patch at edit {} of {}: {}", i, edits.size(), e.getMessage());
                    return PatchResult.rejected(cst, map, failures);
                }
                logger.warn("Skipping edit {} of {}: {}", i, edits.size(), e.getMessage());
            }
        }

        ConcreteSyntaxTree patched = workingCopy.freeze();
        CorrespondenceMap patchedMap = entries.build().reindex(patched, workingCopy.changedIds());
        logger.debug("Applied {} of {} edits to {}", edits.size() - failures.size(), edits.size(), cst.lineage());
        return new PatchResult(patched, patchedMap, failures, true);
    }

    /**
     * State of one patch application.
     */
    private final class Session {

        private final CstWorkingCopy cst;
        private final CorrespondenceMap.Builder entries;
        private final FormatProfile profile;
        private final ScalarReader reader;
        private final CstSynthesizer synthesizer;
        private final SlotEditor slots;
        /** Current value of each JSON structure edited so far, by the syntax node holding it. */
        private final Map<Integer, SemanticNode> embedded = new HashMap<>();

        Session(CstWorkingCopy cst, CorrespondenceMap.Builder entries, FormatProfile profile) {
            this.cst = cst;
            this.entries = entries;
            this.profile = profile;
            this.reader = rules.readerFor(profile);
            this.synthesizer = new CstSynthesizer(cst, profile, renderer, reader);
            this.slots = new SlotEditor(cst, profile, synthesizer);
        }

        void apply(Edit edit) {
            logger.debug("Applying {}", edit);
            Optional<CorrespondenceEntry> literal = embeddingLiteral(edit.target());
            if (literal.isPresent()) {
                rewriteEmbedded(literal.get(), edit);
                return;
            }
            switch (edit.op()) {
                case REPLACE_VALUE -> replaceValue(edit);
                case INSERT_CHILD -> insertChild(edit);
                case DELETE_CHILD -> deleteChild(edit);
                case MOVE_CHILD -> moveChild(edit);
                case REORDER_SIBLINGS -> reorderSiblings(edit);
            }
        }

        /**
         * The literal holding the structure an edit lands in, when its target is a structure read
         * from JSON text or a node inside one.
         */
        private Optional<CorrespondenceEntry> embeddingLiteral(NodeId target) {
            Optional<CorrespondenceEntry> found = target == null ? Optional.empty()
                    : entries.get(target).filter(e -> !e.stale());
            if (found.isEmpty()) {
                return Optional.empty();
            }
            CorrespondenceEntry entry = found.get();
            if (entry.isEmbedded()) {
                return cst.contains(entry.parentCstId()) ? entries.backedBy(entry.parentCstId()) : Optional.empty();
            }
            boolean holdsStructure = !entry.isSynthetic() && entry.rule() != null
                    && entry.rule().kind() == RuleKind.EMBEDDED_JSON
                    && entry.rule().valueKind() != null && entry.rule().valueKind().isContainer();
            return holdsStructure && cst.contains(entry.cstNodeId()) ? found : Optional.empty();
        }

        /**
         * Applies an edit to a structure held as JSON text: the structure is changed as a value
         * and the literal is written again in its own quoting.
         */
        private void rewriteEmbedded(CorrespondenceEntry literal, Edit edit) {
            String op = operation(edit);
            CstNode node = cst.node(literal.cstNodeId());
            SemanticNode current = embedded.containsKey(node.id())
                    ? embedded.get(node.id())
                    : SemanticValues.deterministic(literal.semanticId(), literal.rule().canonical());
            Edit adopted = edit;
            if (edit.value() != null) {
                NodeId fallback = edit.op() == EditOp.REPLACE_VALUE ? edit.target() : NodeId.fresh(cst.lineage());
                SemanticNode value = sameLineage(edit.value().id())
                        ? edit.value() : SemanticValues.deterministic(fallback, edit.value());
                adopted = new Edit(edit.op(), edit.target(), edit.child(), edit.key(), edit.index(), value,
                        edit.order(), edit.hint());
            }
            SemanticNode updated = new EmbeddedValueEditor(locate(literal), op).apply(current, adopted)
                    .withId(literal.semanticId());

            slots.rewriteLiteral(node, updated, literal.rule(), literal.path(), literal.key(), quoteOf(edit.hint()));
            for (CorrespondenceEntry inside : entries.syntheticHostedBy(node.id())) {
                entries.remove(inside.semanticId());
            }
            entries.put(backedEntry(literal.semanticId(), cst.node(node.id()), literal.parentCstId(), literal.key(),
                    literal.path(), literal.ordinal()));
            if (updated.isContainer()) {
                CorrespondenceEntry.embeddedBelow(updated, node.id(), literal.path()).forEach(entries::put);
                embedded.put(node.id(), updated);
            } else {
                embedded.remove(node.id());
            }
            logger.debug("Rewrote JSON literal at {}", literal.path());
        }

        private void replaceValue(Edit edit) {
            String op = operation(edit);
            SemanticNode value = requireValue(edit, op);
            CorrespondenceEntry entry = resolve(edit.target(), op);
            if (entry.isSynthetic()) {
                materialize(entry, value, edit.hint(), op);
                return;
            }
            CstNode node = cst.node(entry.cstNodeId());
            entries.invalidate(cst, node.id());
            slots.replace(node, value, node.isContainer() ? null : entry.rule(), entry.path(), entry.key(),
                    layoutOf(edit.hint()), quoteOf(edit.hint()));
            if (!value.id().equals(entry.semanticId()) && sameLineage(value.id())) {
                entries.remove(entry.semanticId());
            }
            if (value.isContainer()) {
                register(value);
            } else {
                NodeId id = sameLineage(value.id()) ? value.id() : entry.semanticId();
                entries.put(backedEntry(id, cst.node(node.id()), entry.parentCstId(), entry.key(), entry.path(),
                        entry.ordinal()));
            }
        }

        /**
         * Write a value that so far only existed as a default: a no-op while it still equals the
         * default, otherwise a new entry at the end of the mapping hosting it.
         */
        private void materialize(CorrespondenceEntry entry, SemanticNode value, FormatHint hint, String op) {
            Optional<DefaultValueRule> rule = entry.key() == null || entry.path().isRoot()
                    ? Optional.empty()
                    : rules.defaultFor(entry.path().parent(), entry.key());
            if (rule.isEmpty() || !cst.contains(entry.parentCstId())) {
                throw new InvalidEditException("Only a whole defaulted entry can be written, not " + entry.path(),
                        locate(entry), op);
            }
            SemanticNode defaultValue = SemanticValues.deterministic(entry.semanticId(), rule.get().defaultValue());
            if (defaultValue.equals(value)) {
                logger.debug("{} still has its default value; nothing to write", entry.path());
                return;
            }
            CstNode host = cst.node(entry.parentCstId());
            insertIntoMapping(host, entry.key(), value, host.slotCount(), entry.path(), hint, op);
            retireSynthetic(host.id(), entry.path());
            register(value);
        }

        private void insertChild(Edit edit) {
            String op = operation(edit);
            SemanticNode value = requireValue(edit, op);
            CorrespondenceEntry entry = resolve(edit.target(), op);
            CstNode container = container(entry, op);
            if (container.kind() == CstKind.MAPPING) {
                String key = edit.key();
                if (key == null) {
                    throw new InvalidEditException("Inserting into a mapping needs a key", locate(entry), op);
                }
                SemanticPath path = entry.path().child(key);
                if (keys(container).contains(key)) {
                    throw new InvalidEditException("Key '" + key + "' already exists", locate(entry), op);
                }
                Optional<DefaultValueRule> rule = rules.defaultFor(entry.path(), key);
                if (rule.isPresent()
                        && SemanticValues.deterministic(value.id(), rule.get().defaultValue()).equals(value)) {
                    logger.debug("Inserted {} equals its default; nothing to write", path);
                    return;
                }
                int slot = edit.index() < 0 || edit.index() > container.slotCount()
                        ? container.slotCount() : edit.index();
                insertIntoMapping(container, key, value, slot, path, edit.hint(), op);
                retireSynthetic(container.id(), path);
            } else {
                int size = container.slotCount();
                int index = edit.index() < 0 ? size : edit.index();
                if (index > size) {
                    throw new InvalidEditException("Index " + index + " is past the end of a sequence of " + size,
                            locate(entry), op);
                }
                SemanticPath path = entry.path().child(index);
                if (size == 0) {
                    openUp(container, SemanticNode.sequence(NodeId.fresh(cst.lineage()), List.of(value)), entry,
                            edit.hint(), op);
                } else {
                    slots.insertItem(container, index, value, path, quoteOf(edit.hint()));
                }
            }
            register(value);
        }

        private void insertIntoMapping(CstNode mapping, String key, SemanticNode value, int slot, SemanticPath path,
                                       FormatHint hint, String op) {
            if (mapping.slotCount() == 0) {
                Map<String, SemanticNode> single = new LinkedHashMap<>();
                single.put(key, value);
                CorrespondenceEntry host = entries.get(NodeId.backed(cst.lineage(), mapping.id()))
                        .orElse(null);
                openUp(mapping, SemanticNode.mapping(NodeId.fresh(cst.lineage()), single), host, hint, op);
            } else {
                slots.insertEntry(mapping, key, value, slot, path, quoteOf(hint));
            }
        }

        /**
         * Gives an empty collection its first entry by writing it anew, in the layout the hint
         * names. Without a hint there is no sibling to copy, so the edit is refused unless the
         * format's preferred layout may be used.
         */
        private void openUp(CstNode container, SemanticNode filled, CorrespondenceEntry entry, FormatHint hint,
                            String op) {
            Layout layout = layoutOf(hint);
            if (layout == null) {
                if (!profileInsertHints) {
                    throw new AmbiguousInsertPositionException("Collection at " + cst.pathOf(container.id())
                            + " is empty; no sibling to copy the layout from and no format hint given",
                            entry != null ? locate(entry) : cst.locate(container.id()));
                }
                layout = profile.flowOnly() ? Layout.FLOW : Layout.BLOCK;
            }
            SemanticPath path = entry != null ? entry.path() : SemanticPath.ROOT;
            String key = entry != null ? entry.key() : null;
            slots.replace(container, filled, null, path, key, layout, quoteOf(hint));
            logger.debug("Opened up empty collection {} in {} layout", path, layout);
        }

        private void deleteChild(Edit edit) {
            String op = operation(edit);
            CorrespondenceEntry entry = resolve(edit.target(), op);
            CstNode container = container(entry, op);
            if (edit.child() == null) {
                throw new InvalidEditException("Delete needs the child to remove", locate(entry), op);
            }
            CorrespondenceEntry child = resolve(edit.child(), op);
            if (child.isSynthetic()) {
                logger.debug("{} is a default without text; nothing to delete", child.path());
                retireSynthetic(child.parentCstId(), child.path());
                return;
            }
            int slot = SlotEditor.slotOf(container, child.cstNodeId());
            if (slot < 0) {
                throw new InvalidEditException(child.path() + " is not a child of " + entry.path(), locate(child), op);
            }
            entries.invalidate(cst, child.cstNodeId());
            slots.deleteSlot(container, slot);
        }

        private void moveChild(Edit edit) {
            String op = operation(edit);
            CorrespondenceEntry entry = resolve(edit.target(), op);
            CstNode container = container(entry, op);
            int from = childSlot(container, entry, edit.child(), op);
            int count = container.slotCount();
            if (edit.index() < 0 || edit.index() >= count) {
                throw new InvalidEditException("Cannot move to index " + edit.index() + " of " + count + " entries",
                        locate(entry), op);
            }
            List<Integer> order = new ArrayList<>();
            for (int s = 0; s < count; s++) {
                order.add(s);
            }
            order.remove(Integer.valueOf(from));
            order.add(edit.index(), from);
            slots.reorder(container, order);
        }

        private void reorderSiblings(Edit edit) {
            String op = operation(edit);
            CorrespondenceEntry entry = resolve(edit.target(), op);
            CstNode container = container(entry, op);
            List<Integer> order = new ArrayList<>();
            Set<Integer> seen = new HashSet<>();
            for (NodeId id : edit.order()) {
                int slot = childSlot(container, entry, id, op);
                if (!seen.add(slot)) {
                    throw new InvalidEditException("Node " + id + " appears twice in the new order", locate(entry), op);
                }
                order.add(slot);
            }
            if (order.size() != container.slotCount()) {
                throw new InvalidEditException("New order names " + order.size() + " of "
                        + container.slotCount() + " entries", locate(entry), op);
            }
            slots.reorder(container, order);
        }

        private int childSlot(CstNode container, CorrespondenceEntry parent, NodeId childId, String op) {
            if (childId == null) {
                throw new InvalidEditException("Missing child id", locate(parent), op);
            }
            CorrespondenceEntry child = resolve(childId, op);
            if (child.isSynthetic()) {
                throw new InvalidEditException(child.path() + " is a default without text and has no position",
                        locate(parent), op);
            }
            int slot = SlotEditor.slotOf(container, child.cstNodeId());
            if (slot < 0) {
                throw new InvalidEditException(child.path() + " is not a child of " + parent.path(),
                        locate(child), op);
            }
            return slot;
        }

        // -----------------------------------------------------------------------------------

        private CorrespondenceEntry resolve(NodeId id, String op) {
            if (id == null) {
                throw new InvalidEditException("Edit has no target", SourceLocation.UNKNOWN, op);
            }
            CorrespondenceEntry entry = entries.get(id).orElseThrow(() -> new StaleReferenceException(
                    "No node " + id + " in document " + cst.lineage(), SourceLocation.UNKNOWN, op));
            if (entry.stale()) {
                throw new StaleReferenceException("Node " + id + " at " + entry.path()
                        + " was changed by an earlier edit", locate(entry), op);
            }
            if (!entry.isSynthetic() && !cst.contains(entry.cstNodeId())) {
                throw new StaleReferenceException("Text of node " + id + " at " + entry.path() + " no longer exists",
                        SourceLocation.of(entry.path().toString()), op);
            }
            return entry;
        }

        private CstNode container(CorrespondenceEntry entry, String op) {
            if (entry.isSynthetic()) {
                throw new InvalidEditException(entry.path() + " is a default without text; replace it as a whole",
                        locate(entry), op);
            }
            CstNode node = cst.node(entry.cstNodeId());
            if (!node.isContainer()) {
                throw new InvalidEditException(entry.path() + " is not a collection", locate(entry), op);
            }
            return node;
        }

        private Set<String> keys(CstNode mapping) {
            Set<String> result = new HashSet<>();
            for (int s = 0; s < mapping.slotCount(); s++) {
                CstNode key = cst.node(mapping.children().get(2 * s));
                try {
                    result.add(profile.syntax().decode(key.literal(), key.style().quote()));
                } catch (IllegalArgumentException e) {
                    result.add(key.literal());
                }
            }
            return result;
        }

        /**
         * Marks the synthetic entry at {@code path} and those below it stale once real text
         * exists for it. All of them are hosted by the mapping that holds the defaulted key.
         */
        private void retireSynthetic(int hostCstId, SemanticPath path) {
            String prefix = path.toString();
            for (CorrespondenceEntry e : entries.syntheticHostedBy(hostCstId)) {
                if (!e.stale() && isAtOrBelow(e.path().toString(), prefix)) {
                    entries.put(e.markStale());
                }
            }
        }

        private boolean isAtOrBelow(String path, String prefix) {
            return path.equals(prefix) || path.startsWith(prefix + ".") || path.startsWith(prefix + "[");
        }

        /**
         * Adds entries for the nodes of {@code value} that were just written.
         */
        private void register(SemanticNode value) {
            Set<NodeId> ids = new HashSet<>();
            collectIds(value, ids);
            for (CstSynthesizer.Created c : synthesizer.drainCreated()) {
                if (!ids.contains(c.semanticId()) || !sameLineage(c.semanticId())) {
                    continue;
                }
                Optional<CorrespondenceEntry> existing = entries.get(c.semanticId());
                if (existing.isPresent() && !existing.get().stale() && !existing.get().isSynthetic()
                        && existing.get().cstNodeId() != c.cstId()) {
                    continue;
                }
                entries.put(backedEntry(c.semanticId(), cst.node(c.cstId()), c.parentCstId(), c.key(), c.path(), 0));
            }
        }

        private void collectIds(SemanticNode node, Set<NodeId> out) {
            out.add(node.id());
            for (SemanticNode child : node.children()) {
                collectIds(child, out);
            }
        }

        private CorrespondenceEntry backedEntry(NodeId id, CstNode node, int parentCstId, String key,
                                                SemanticPath path, int ordinal) {
            RuleTag tag = switch (node.kind()) {
                case MAPPING -> RuleTag.container(SemanticKind.MAPPING);
                case SEQUENCE -> RuleTag.container(SemanticKind.SEQUENCE);
                case OPAQUE -> RuleTag.opaque(node.literal());
                case SCALAR -> rules.read(node.literal(), node.style().quote(), key, path, profile,
                        cst.locate(node.id(), path.toString())).tag();
            };
            return CorrespondenceEntry.backed(id, node.id(), parentCstId, key, path, tag, ordinal, node.span());
        }

        private boolean sameLineage(NodeId id) {
            return id.lineage().equals(cst.lineage());
        }

        private SourceLocation locate(CorrespondenceEntry entry) {
            String path = entry.path().toString();
            if (entry.isSynthetic()) {
                return cst.contains(entry.parentCstId()) ? cst.locate(entry.parentCstId(), path) : SourceLocation.of(path);
            }
            return cst.contains(entry.cstNodeId()) ? cst.locate(entry.cstNodeId(), path) : SourceLocation.of(path);
        }
    }

    private static SemanticNode requireValue(Edit edit, String op) {
        if (edit.value() == null) {
            throw new InvalidEditException(edit.op() + " needs a value", SourceLocation.UNKNOWN, op);
        }
        return edit.value();
    }

    private static String operation(Edit edit) {
        return edit.op().name().toLowerCase().replace('_', '-');
    }

    private static Layout layoutOf(FormatHint hint) {
        return hint == null ? null : hint.layout();
    }

    private static QuoteStyle quoteOf(FormatHint hint) {
        return hint == null ? null : hint.quote();
    }
}
