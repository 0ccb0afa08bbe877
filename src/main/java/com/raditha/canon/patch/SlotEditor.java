package com.raditha.canon.patch;

import com.raditha.canon.cst.CstKind;
import com.raditha.canon.cst.CstNode;
import com.raditha.canon.cst.CstWorkingCopy;
import com.raditha.canon.cst.Layout;
import com.raditha.canon.cst.NodeStyle;
import com.raditha.canon.cst.QuoteStyle;
import com.raditha.canon.cst.Trivia;
import com.raditha.canon.format.FormatProfile;
import com.raditha.canon.format.OrphanCommentPolicy;
import com.raditha.canon.normalization.RuleTag;
import com.raditha.canon.semantic.SemanticKind;
import com.raditha.canon.semantic.SemanticNode;
import com.raditha.canon.semantic.SemanticPath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.raditha.canon.patch.CstSynthesizer.spaces;

/**
 * Text surgery on the slots of a collection: replacing a value, inserting, deleting and reordering
 * entries. Trivia is moved so that the result reads like the surrounding text.
 * <p>
 * A slot is one entry of a collection: a key and its value in a mapping, or one item of a
 * sequence. In block layout a slot's first line starts in the leading trivia of its first node,
 * and its last line break sits in the trailing trivia of its terminal node, the deepest last
 * descendant. In flow layout the separators live in the same two places.
 */
final class SlotEditor {

    private static final Logger logger = LoggerFactory.getLogger(SlotEditor.class);

    private final CstWorkingCopy cst;
    private final FormatProfile profile;
    private final CstSynthesizer synthesizer;

    SlotEditor(CstWorkingCopy cst, FormatProfile profile, CstSynthesizer synthesizer) {
        this.cst = cst;
        this.profile = profile;
        this.synthesizer = synthesizer;
    }

    // ---------------------------------------------------------------------------------------
    // replace

    /**
     * Replace the node with new text for {@code value}, keeping its id.
     *
     * @param tag    rule tag the replaced literal was read with, used to keep its style
     * @param layout layout for a collection value, or null to follow the surroundings
     */
    void replace(CstNode old, SemanticNode value, RuleTag tag, SemanticPath path, String key, Layout layout,
                 QuoteStyle quote) {
        CstNode parent = old.parent() == CstNode.NO_PARENT ? null : cst.node(old.parent());
        boolean flowContext = profile.flowOnly() || (parent != null && parent.style().isFlow());
        Layout wanted = flowContext ? Layout.FLOW : layout;
        if (wanted == null) {
            wanted = old.isContainer() ? old.style().layout() : Layout.BLOCK;
        }
        boolean inlineValue = !value.isContainer() || value.children().isEmpty() || wanted == Layout.FLOW;
        boolean oldInline = !old.isContainer() || old.style().isFlow() || old.children().isEmpty();
        boolean endsWithLineBreak = cst.node(terminal(old.id())).trailing().endsWithLineBreak();
        Trivia oldFirstLeading = old.isContainer() && !old.children().isEmpty()
                ? cst.node(old.children().get(0)).leading() : Trivia.EMPTY;

        for (int child : old.children()) {
            cst.removeSubtree(child);
        }

        if (inlineValue) {
            String[] trivia = oldInline
                    ? new String[]{old.leading().text(), old.trailing().text()}
                    : inlineTrivia(old, parent, endsWithLineBreak);
            if (value.isContainer()) {
                synthesizer.flow(old.id(), old.parent(), value, trivia[0], trivia[1], path, key, quote);
            } else {
                writeScalar(old, value, old.isContainer() ? null : tag, trivia[0], trivia[1],
                        flowContext ? Layout.FLOW : Layout.BLOCK, path, key, quote);
            }
            return;
        }

        String leading;
        String containerTrailing;
        String firstLineComment = "";
        int indent;
        boolean compact;
        if (!oldInline) {
            leading = old.leading().text();
            containerTrailing = old.trailing().text();
            indent = old.style().indent();
            compact = !oldFirstLeading.hasLineBreak() && oldFirstLeading.text().length() < indent;
        } else if (parent == null) {
            leading = old.leading().text();
            String[] split = splitFirstLine(old.trailing().text());
            containerTrailing = split[1];
            indent = 0;
            compact = false;
            endsWithLineBreak = old.trailing().hasLineBreak();
        } else if (parent.kind() == CstKind.MAPPING) {
            String[] split = splitFirstLine(old.trailing().text());
            leading = old.leading().text().stripTrailing() + split[0] + cst.lineBreak();
            containerTrailing = split[1];
            indent = Math.max(0, parent.style().indent()) + profile.indentUnit();
            compact = false;
            endsWithLineBreak = old.trailing().hasLineBreak();
        } else {
            String[] split = splitFirstLine(old.trailing().text());
            leading = old.leading().text();
            firstLineComment = split[0];
            containerTrailing = split[1];
            String line = old.leading().lastLine();
            indent = Math.max(0, parent.style().indent()) + line.length() - Math.max(0, line.lastIndexOf('-'));
            compact = true;
            endsWithLineBreak = old.trailing().hasLineBreak();
        }

        synthesizer.blockContainer(old.id(), old.parent(), value, indent, leading, compact, path, key, quote);
        CstNode written = cst.node(old.id());
        cst.put(written.withTrailing(Trivia.of(containerTrailing)));
        if (!firstLineComment.isBlank()) {
            attachToFirstLine(written, firstLineComment);
        }
        if (!endsWithLineBreak) {
            stripFinalLineBreak(old.id());
        }
    }

    /**
     * Write a scalar literal again in place, keeping its trivia. Used for values that live inside
     * the literal, such as a structure held as JSON text.
     */
    void rewriteLiteral(CstNode old, SemanticNode value, RuleTag tag, SemanticPath path, String key,
                        QuoteStyle quote) {
        CstNode parent = old.parent() == CstNode.NO_PARENT ? null : cst.node(old.parent());
        boolean flowContext = profile.flowOnly() || (parent != null && parent.style().isFlow());
        writeScalar(old, value, tag, old.leading().text(), old.trailing().text(),
                flowContext ? Layout.FLOW : Layout.BLOCK, path, key, quote);
    }

    private void writeScalar(CstNode old, SemanticNode value, RuleTag tag, String leading, String trailing,
                             Layout layout, SemanticPath path, String key, QuoteStyle quote) {
        String literal = synthesizer.renderScalar(value, tag, layout, key, path, quote);
        if (old.kind() == CstKind.SCALAR && old.literal().isEmpty() && !literal.isEmpty()
                && (leading.endsWith(":") || leading.endsWith("-"))) {
            // an empty value sat right after its indicator
            leading = leading + " ";
        }
        CstNode node = value.kind() == SemanticKind.OPAQUE
                ? CstNode.opaque(old.id(), old.parent(), literal, old.style(), old.span())
                : CstNode.scalar(old.id(), old.parent(), literal,
                NodeStyle.scalar(QuoteStyle.fromLiteral(literal), layout, old.style().indent()), old.span());
        cst.put(node.withLeading(Trivia.of(leading)).withTrailing(Trivia.of(trailing)));
    }

    /**
     * Leading and trailing trivia for an inline value taking the place of a block collection.
     */
    private String[] inlineTrivia(CstNode old, CstNode parent, boolean endsWithLineBreak) {
        Trivia lead = old.leading();
        if (parent == null) {
            return new String[]{lead.text(), (endsWithLineBreak ? cst.lineBreak() : "") + old.trailing().text()};
        }
        if (!lead.hasLineBreak()) {
            return new String[]{lead.text(), (endsWithLineBreak ? cst.lineBreak() : "") + old.trailing().text()};
        }
        String text = lead.text();
        int nl = text.indexOf('\n');
        String firstLine = withoutCarriageReturn(text.substring(0, nl));
        String rest = text.substring(nl + 1);
        String head = firstLine;
        String comment = "";
        if (profile.hasComments()) {
            int at = firstLine.indexOf(profile.commentMarker());
            if (at >= 0) {
                head = firstLine.substring(0, at);
                comment = " " + firstLine.substring(at);
            }
        }
        String lineEnd = rest.isEmpty() && !endsWithLineBreak ? "" : cst.lineBreak();
        return new String[]{head.stripTrailing() + " ", comment + lineEnd + rest + old.trailing().text()};
    }

    /**
     * Splits trailing trivia into the part before its first line break and the part after it.
     */
    private static String[] splitFirstLine(String trailing) {
        int nl = trailing.indexOf('\n');
        if (nl < 0) {
            return new String[]{trailing, ""};
        }
        return new String[]{withoutCarriageReturn(trailing.substring(0, nl)), trailing.substring(nl + 1)};
    }

    private static String withoutCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    private void attachToFirstLine(CstNode container, String comment) {
        int first = container.kind() == CstKind.MAPPING ? container.children().get(1) : container.children().get(0);
        CstNode node = cst.node(first);
        if (!node.isContainer() || node.style().isFlow()) {
            cst.put(node.withTrailing(node.trailing().prepend(comment)));
        } else {
            logger.warn("Dropping comment '{}' of a value rewritten as a nested collection", comment.strip());
        }
    }

    // ---------------------------------------------------------------------------------------
    // insert

    /**
     * Insert a key and its value so that the entry becomes slot {@code slot}.
     */
    void insertEntry(CstNode mapping, String key, SemanticNode value, int slot, SemanticPath path, QuoteStyle quote) {
        List<Integer> children = new ArrayList<>(mapping.children());
        int keyId = cst.allocateId();
        int valueId = cst.allocateId();
        if (mapping.style().isFlow()) {
            FlowSlot place = flowSlot(mapping, slot);
            synthesizer.key(keyId, mapping.id(), key, place.leading, Layout.FLOW);
            synthesizer.flow(valueId, mapping.id(), value, valueSeparator(mapping), place.trailing, path, key, quote);
        } else {
            int indent = Math.max(0, mapping.style().indent());
            synthesizer.key(keyId, mapping.id(), key, spaces(indent), Layout.BLOCK);
            synthesizer.blockValue(valueId, mapping.id(), value, indent, path, key, quote);
            fitBlockSlot(mapping, slot, keyId, valueId, spaces(indent));
        }
        children.add(2 * slot, keyId);
        children.add(2 * slot + 1, valueId);
        cst.replaceChildren(mapping.id(), children);
    }

    void insertItem(CstNode sequence, int index, SemanticNode value, SemanticPath path, QuoteStyle quote) {
        List<Integer> children = new ArrayList<>(sequence.children());
        int itemId = cst.allocateId();
        if (sequence.style().isFlow()) {
            FlowSlot place = flowSlot(sequence, index);
            synthesizer.flow(itemId, sequence.id(), value, place.leading, place.trailing, path, null, quote);
        } else {
            String prefix = itemPrefix(sequence, index);
            synthesizer.blockItem(itemId, sequence.id(), value, prefix, prefix.length(), path, quote);
            fitBlockSlot(sequence, index, itemId, itemId, prefix);
        }
        children.add(index, itemId);
        cst.replaceChildren(sequence.id(), children);
    }

    /**
     * Line prefix of a new item: the dash and spacing of the neighbouring item, at the dash column.
     */
    private String itemPrefix(CstNode sequence, int index) {
        int indent = Math.max(0, sequence.style().indent());
        int sibling = sequence.children().get(Math.min(index, sequence.children().size() - 1));
        String prefix = cst.node(sibling).leading().lastLine();
        if (prefix.length() > indent && prefix.startsWith(spaces(indent)) && prefix.charAt(indent) == '-') {
            return prefix;
        }
        return spaces(indent) + "- ";
    }

    /**
     * Adjusts neighbours of a new block slot. The first slot keeps the line prefix it had, which
     * differs from the others in compact collections, and a slot appended after a last line without
     * a line break gets one.
     */
    private void fitBlockSlot(CstNode container, int slot, int firstId, int lastId, String prefix) {
        if (slot == 0) {
            CstNode oldFirst = cst.node(container.children().get(0));
            if (!oldFirst.leading().hasLineBreak()) {
                CstNode created = cst.node(firstId);
                cst.put(created.withLeading(oldFirst.leading()));
                cst.put(oldFirst.withLeading(Trivia.of(prefix)));
            }
            return;
        }
        CstNode previous = cst.node(terminal(lastOfSlot(container, slot - 1)));
        if (!previous.trailing().endsWithLineBreak()) {
            cst.put(previous.withTrailing(previous.trailing().append(cst.lineBreak())));
            stripFinalLineBreak(lastId);
        }
    }

    private record FlowSlot(String leading, String trailing) {
    }

    /**
     * Trivia of a new flow slot, copied from the neighbours. Collections spread over several lines
     * put the separator after each entry; single-line ones put it before.
     */
    private FlowSlot flowSlot(CstNode container, int slot) {
        int count = container.slotCount();
        if (trailingSeparators(container)) {
            String indentText = cst.node(firstOfSlot(container, Math.min(slot, count - 1))).leading().lastLine();
            String separator = "," + cst.lineBreak();
            for (int s = 0; s < count - 1; s++) {
                String t = cst.node(lastOfSlot(container, s)).trailing().text();
                if (t.startsWith(",")) {
                    separator = t;
                    break;
                }
            }
            if (slot == count) {
                CstNode last = cst.node(lastOfSlot(container, count - 1));
                String lastTrailing = last.trailing().text();
                cst.put(last.withTrailing(Trivia.of("," + lastTrailing)));
                return new FlowSlot(indentText, lastTrailing);
            }
            if (slot == 0) {
                CstNode first = cst.node(firstOfSlot(container, 0));
                String firstLeading = first.leading().text();
                cst.put(first.withLeading(Trivia.of(indentText)));
                return new FlowSlot(firstLeading, separator);
            }
            return new FlowSlot(indentText, separator);
        }

        String separator = profile.flowSeparator();
        for (int s = 1; s < count; s++) {
            String l = cst.node(firstOfSlot(container, s)).leading().text();
            if (l.startsWith(",")) {
                separator = l;
                break;
            }
        }
        if (slot == 0) {
            CstNode first = cst.node(firstOfSlot(container, 0));
            String firstLeading = first.leading().text();
            cst.put(first.withLeading(Trivia.of(separator)));
            return new FlowSlot(firstLeading, "");
        }
        return new FlowSlot(separator, "");
    }

    private boolean trailingSeparators(CstNode container) {
        int count = container.slotCount();
        for (int s = 0; s < count - 1; s++) {
            if (cst.node(lastOfSlot(container, s)).trailing().text().startsWith(",")) {
                return true;
            }
        }
        if (count == 1) {
            return cst.node(firstOfSlot(container, 0)).leading().hasLineBreak()
                    || cst.node(lastOfSlot(container, 0)).trailing().hasLineBreak();
        }
        return false;
    }

    private String valueSeparator(CstNode mapping) {
        if (mapping.slotCount() > 0) {
            return cst.node(lastOfSlot(mapping, 0)).leading().text();
        }
        return profile.keyValueSeparator();
    }

    // ---------------------------------------------------------------------------------------
    // delete

    void deleteSlot(CstNode container, int slot) {
        if (container.style().isFlow()) {
            deleteFlowSlot(container, slot);
        } else {
            deleteBlockSlot(container, slot);
        }
    }

    private void deleteFlowSlot(CstNode container, int slot) {
        int count = container.slotCount();
        CstNode first = cst.node(firstOfSlot(container, slot));
        CstNode last = cst.node(lastOfSlot(container, slot));
        boolean trailingStyle = trailingSeparators(container);
        if (count > 1) {
            if (slot == 0) {
                CstNode next = cst.node(firstOfSlot(container, 1));
                cst.put(next.withLeading(first.leading()));
            } else if (slot == count - 1 && trailingStyle) {
                CstNode previous = cst.node(lastOfSlot(container, slot - 1));
                cst.put(previous.withTrailing(last.trailing()));
            }
        }
        removeSlot(container, slot);
    }

    private void deleteBlockSlot(CstNode container, int slot) {
        int count = container.slotCount();
        CstNode first = cst.node(firstOfSlot(container, slot));
        Trivia lead = first.leading();
        Trivia tail = cst.node(terminal(lastOfSlot(container, slot))).trailing();
        String orphans = orphanComments(lead, tail, Math.max(0, container.style().indent()));
        if (!orphans.isEmpty()) {
            logger.warn("Re-homing comments of deleted entry {} of {}: {}", slot, cst.pathOf(container.id()),
                    orphans.strip());
        }

        if (count == 1) {
            removeSlot(container, slot);
            collapseToEmptyFlow(cst.node(container.id()), orphans, tail.endsWithLineBreak());
            return;
        }

        if (slot == 0) {
            CstNode next = cst.node(firstOfSlot(container, 1));
            if (!next.leading().hasLineBreak()) {
                cst.put(next.withLeading(Trivia.of(lead.lastLine())));
            }
            if (!orphans.isEmpty()) {
                Trivia containerLead = container.leading();
                cst.put(cst.node(container.id()).withLeading(
                        Trivia.of(containerLead.upToLastLine() + orphans + containerLead.lastLine())));
            }
        } else {
            boolean last = slot == count - 1;
            if (!orphans.isEmpty() && profile.orphanCommentPolicy() == OrphanCommentPolicy.ATTACH_TO_NEXT && !last) {
                CstNode next = cst.node(firstOfSlot(container, slot + 1));
                cst.put(next.withLeading(next.leading().prepend(orphans)));
            } else if (!orphans.isEmpty() || (last && !tail.endsWithLineBreak())) {
                CstNode previous = cst.node(terminal(lastOfSlot(container, slot - 1)));
                String text = previous.trailing().text() + orphans;
                if (last && !tail.endsWithLineBreak()) {
                    text = withoutFinalLineBreak(text);
                }
                cst.put(previous.withTrailing(Trivia.of(text)));
            }
        }
        removeSlot(container, slot);
    }

    /**
     * Comment lines found on the boundaries of a deleted slot: whole comment lines before it, and
     * the comment ending its last line turned into a line of its own.
     */
    private String orphanComments(Trivia lead, Trivia tail, int indent) {
        if (!profile.hasComments()) {
            return "";
        }
        String marker = profile.commentMarker();
        StringBuilder sb = new StringBuilder();
        for (String line : lead.upToLastLine().split("\n", -1)) {
            if (line.contains(marker)) {
                sb.append(withoutCarriageReturn(line)).append(cst.lineBreak());
            }
        }
        int nl = tail.text().indexOf('\n');
        String lastLine = nl < 0 ? tail.text() : tail.text().substring(0, nl);
        int at = lastLine.indexOf(marker);
        if (at >= 0) {
            sb.append(spaces(indent)).append(lastLine.substring(at).stripTrailing()).append(cst.lineBreak());
        }
        return sb.toString();
    }

    /**
     * A block collection that lost its last entry is written as {@code {}} or {@code []} on the
     * line that introduced it.
     */
    private void collapseToEmptyFlow(CstNode container, String orphans, boolean endsWithLineBreak) {
        boolean mapping = container.kind() == CstKind.MAPPING;
        Trivia lead = container.leading();
        String leading;
        String trailing;
        String lineEnd = endsWithLineBreak ? cst.lineBreak() : "";
        if (container.parent() == CstNode.NO_PARENT || !lead.hasLineBreak()) {
            leading = lead.text();
            trailing = lineEnd + orphans;
        } else {
            String text = lead.text();
            int nl = text.indexOf('\n');
            String firstLine = withoutCarriageReturn(text.substring(0, nl));
            String rest = text.substring(nl + 1);
            String head = firstLine;
            String comment = "";
            if (profile.hasComments() && firstLine.contains(profile.commentMarker())) {
                int at = firstLine.indexOf(profile.commentMarker());
                head = firstLine.substring(0, at);
                comment = " " + firstLine.substring(at);
            }
            leading = head.stripTrailing() + " ";
            String tail = rest + orphans;
            trailing = comment + (tail.isEmpty() ? lineEnd : cst.lineBreak() + tail);
        }
        cst.put(container.withLiteral(mapping ? "{" : "[")
                .withClosing(mapping ? "}" : "]")
                .withChildren(List.of())
                .withStyle(NodeStyle.flow(container.style().indent()))
                .withLeading(Trivia.of(leading))
                .withTrailing(container.trailing().prepend(trailing)));
    }

    private void removeSlot(CstNode container, int slot) {
        CstNode current = cst.node(container.id());
        List<Integer> children = new ArrayList<>(current.children());
        List<Integer> removed = slotNodes(current, slot);
        for (int id : removed) {
            cst.removeSubtree(id);
        }
        children.removeAll(removed);
        cst.replaceChildren(container.id(), children);
    }

    // ---------------------------------------------------------------------------------------
    // reorder

    /**
     * Put the slots in a new order. {@code order.get(i)} is the current slot that moves to
     * position {@code i}.
     */
    void reorder(CstNode container, List<Integer> order) {
        int count = container.slotCount();
        boolean identity = true;
        for (int i = 0; i < count; i++) {
            identity &= order.get(i) == i;
        }
        if (identity) {
            return;
        }
        if (container.style().isFlow()) {
            // separators belong to positions, not to entries
            List<Trivia> leadings = new ArrayList<>();
            List<Trivia> trailings = new ArrayList<>();
            for (int s = 0; s < count; s++) {
                leadings.add(cst.node(firstOfSlot(container, s)).leading());
                trailings.add(cst.node(lastOfSlot(container, s)).trailing());
            }
            for (int i = 0; i < count; i++) {
                int s = order.get(i);
                cst.put(cst.node(firstOfSlot(container, s)).withLeading(leadings.get(i)));
                cst.put(cst.node(lastOfSlot(container, s)).withTrailing(trailings.get(i)));
            }
        } else {
            int newFirst = order.get(0);
            if (newFirst != 0) {
                CstNode oldFirst = cst.node(firstOfSlot(container, 0));
                CstNode moved = cst.node(firstOfSlot(container, newFirst));
                if (!oldFirst.leading().hasLineBreak()) {
                    cst.put(moved.withLeading(oldFirst.leading()));
                    cst.put(oldFirst.withLeading(moved.leading()));
                }
            }
            int newLast = order.get(count - 1);
            CstNode oldLast = cst.node(terminal(lastOfSlot(container, count - 1)));
            if (newLast != count - 1 && !oldLast.trailing().endsWithLineBreak()) {
                cst.put(oldLast.withTrailing(oldLast.trailing().append(cst.lineBreak())));
                stripFinalLineBreak(lastOfSlot(container, newLast));
            }
        }
        List<Integer> children = new ArrayList<>();
        for (int s : order) {
            children.addAll(slotNodes(container, s));
        }
        cst.replaceChildren(container.id(), children);
    }

    // ---------------------------------------------------------------------------------------
    // slot helpers

    static List<Integer> slotNodes(CstNode container, int slot) {
        List<Integer> children = container.children();
        return container.kind() == CstKind.MAPPING
                ? List.of(children.get(2 * slot), children.get(2 * slot + 1))
                : List.of(children.get(slot));
    }

    static int firstOfSlot(CstNode container, int slot) {
        return container.children().get(container.kind() == CstKind.MAPPING ? 2 * slot : slot);
    }

    static int lastOfSlot(CstNode container, int slot) {
        return container.children().get(container.kind() == CstKind.MAPPING ? 2 * slot + 1 : slot);
    }

    /**
     * Slot of a child node: its index in a sequence, or the entry it belongs to in a mapping.
     */
    static int slotOf(CstNode container, int childId) {
        int index = container.children().indexOf(childId);
        if (index < 0) {
            return -1;
        }
        return container.kind() == CstKind.MAPPING ? index / 2 : index;
    }

    /**
     * The node whose trailing trivia ends the text of {@code id}: the deepest last descendant
     * through block collections.
     */
    int terminal(int id) {
        CstNode node = cst.node(id);
        while (node.isContainer() && !node.style().isFlow() && !node.children().isEmpty()) {
            node = cst.node(node.children().get(node.children().size() - 1));
        }
        return node.id();
    }

    private void stripFinalLineBreak(int id) {
        CstNode end = cst.node(terminal(id));
        String text = end.trailing().text();
        if (text.endsWith("\n")) {
            cst.put(end.withTrailing(Trivia.of(withoutFinalLineBreak(text))));
        }
    }

    private static String withoutFinalLineBreak(String text) {
        if (text.endsWith("\r\n")) {
            return text.substring(0, text.length() - 2);
        }
        return text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
    }
}
