package com.raditha.canon.diff;

import com.raditha.canon.semantic.NodeId;
import com.raditha.canon.semantic.SemanticKind;
import com.raditha.canon.semantic.SemanticNode;
import com.raditha.canon.semantic.SemanticTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes the structural edits that turn one semantic tree into another.
 * <p>
 * Mappings are compared by key. Sequences are aligned with a longest common subsequence over
 * items that share an id or are semantically equal; items that changed place become one move, or
 * one reorder when several did. A changed collection item that also changed place is followed by
 * its name, or by the children it kept. Unmatched items in the same gap are paired up and
 * compared, so a changed item costs a replace rather than a delete and an insert.
 * <p>
 * For each collection the edits come in the order deletes, moves, inserts, then the edits inside
 * its surviving children. Every edit addresses nodes of the old tree.
 */
public class DiffEngine {

    private static final Logger logger = LoggerFactory.getLogger(DiffEngine.class);

    /** LCS weight of two items with the same id. */
    private static final int SAME_ID = 2;
    /** LCS weight of two equal items with different ids. */
    private static final int SAME_VALUE = 1;
    /** Keys that name a mapping item, tried in order. */
    private static final List<String> NAME_KEYS = List.of("name", "id", "key");

    public Patch diff(SemanticTree oldTree, SemanticTree newTree) {
        List<Edit> edits = new ArrayList<>();
        compare(oldTree.root(), newTree.root(), edits);
        logger.debug("Diff of {} against {}: {} edits", oldTree.lineage(), newTree.lineage(), edits.size());
        return new Patch(edits);
    }

    private void compare(SemanticNode a, SemanticNode b, List<Edit> edits) {
        if (a.kind() != b.kind() || !a.isContainer()) {
            if (!a.equals(b)) {
                edits.add(Edit.replaceValue(a.id(), b));
            }
            return;
        }
        if (a.isSynthetic()) {
            // nothing to edit inside text that does not exist; the whole value gets written
            if (!a.equals(b)) {
                edits.add(Edit.replaceValue(a.id(), b));
            }
            return;
        }
        switch (a.kind()) {
            case MAPPING -> compareMappings(a, b, edits);
            case SEQUENCE -> compareSequences(a, b, edits);
            default -> throw new IllegalStateException("Not a container: " + a);
        }
    }

    private void compareMappings(SemanticNode a, SemanticNode b, List<Edit> edits) {
        Map<String, SemanticNode> oldEntries = a.entries();
        Map<String, SemanticNode> newEntries = b.entries();

        // keys as they sit in the text, which is where inserts are anchored
        List<String> slots = new ArrayList<>();
        for (Map.Entry<String, SemanticNode> e : oldEntries.entrySet()) {
            if (!e.getValue().isSynthetic()) {
                slots.add(e.getKey());
            }
        }

        for (Map.Entry<String, SemanticNode> e : oldEntries.entrySet()) {
            if (!newEntries.containsKey(e.getKey())) {
                edits.add(Edit.deleteChild(a.id(), e.getValue().id()));
                slots.remove(e.getKey());
            }
        }

        String previous = null;
        for (Map.Entry<String, SemanticNode> e : newEntries.entrySet()) {
            String key = e.getKey();
            if (!oldEntries.containsKey(key)) {
                int slot = previous == null ? 0 : slots.indexOf(previous) + 1;
                slots.add(slot, key);
                edits.add(Edit.insertChild(a.id(), key, slot, e.getValue()));
            }
            if (slots.contains(key)) {
                previous = key;
            }
        }

        for (Map.Entry<String, SemanticNode> e : oldEntries.entrySet()) {
            SemanticNode replacement = newEntries.get(e.getKey());
            if (replacement != null) {
                compare(e.getValue(), replacement, edits);
            }
        }
    }

    private void compareSequences(SemanticNode a, SemanticNode b, List<Edit> edits) {
        List<SemanticNode> oldItems = a.items();
        List<SemanticNode> newItems = b.items();
        int m = oldItems.size();
        int n = newItems.size();

        int[] matchOf = align(oldItems, newItems);
        int[] newMatch = new int[n];
        Arrays.fill(newMatch, -1);
        for (int i = 0; i < m; i++) {
            if (matchOf[i] >= 0) {
                newMatch[matchOf[i]] = i;
            }
        }
        Set<Integer> aligned = new HashSet<>();
        for (int i = 0; i < m; i++) {
            if (matchOf[i] >= 0) {
                aligned.add(i);
            }
        }

        // items that left the common subsequence but still exist elsewhere
        Set<Integer> moved = new HashSet<>();
        for (int pass = 0; pass < 2; pass++) {
            for (int i = 0; i < m; i++) {
                if (matchOf[i] >= 0) {
                    continue;
                }
                for (int j = 0; j < n; j++) {
                    if (newMatch[j] >= 0) {
                        continue;
                    }
                    boolean hit = pass == 0
                            ? oldItems.get(i).id().equals(newItems.get(j).id())
                            : oldItems.get(i).equals(newItems.get(j));
                    if (hit) {
                        matchOf[i] = j;
                        newMatch[j] = i;
                        moved.add(i);
                        break;
                    }
                }
            }
        }

        // changed items that also changed place
        int[] oldGap = gaps(aligned, m);
        Set<Integer> alignedNew = new HashSet<>();
        for (int i : aligned) {
            alignedNew.add(matchOf[i]);
        }
        int[] newGap = gaps(alignedNew, n);
        for (int i = 0; i < m; i++) {
            if (matchOf[i] >= 0 || !oldItems.get(i).isContainer()) {
                continue;
            }
            for (int j = 0; j < n; j++) {
                if (newMatch[j] < 0 && oldGap[i] != newGap[j] && similar(oldItems.get(i), newItems.get(j))) {
                    matchOf[i] = j;
                    newMatch[j] = i;
                    moved.add(i);
                    break;
                }
            }
        }

        pairWithinGaps(matchOf, newMatch, aligned, m, n);

        for (int i = 0; i < m; i++) {
            if (matchOf[i] < 0) {
                edits.add(Edit.deleteChild(a.id(), oldItems.get(i).id()));
            }
        }

        if (!moved.isEmpty()) {
            List<NodeId> order = new ArrayList<>();
            for (int j = 0; j < n; j++) {
                if (newMatch[j] >= 0) {
                    order.add(oldItems.get(newMatch[j]).id());
                }
            }
            if (moved.size() == 1) {
                int i = moved.iterator().next();
                NodeId id = oldItems.get(i).id();
                edits.add(Edit.moveChild(a.id(), id, order.indexOf(id)));
            } else {
                edits.add(Edit.reorderSiblings(a.id(), order));
            }
        }

        for (int j = 0; j < n; j++) {
            if (newMatch[j] < 0) {
                edits.add(Edit.insertChild(a.id(), j, newItems.get(j)));
            }
        }

        Map<Integer, Integer> pairs = new LinkedHashMap<>();
        for (int i = 0; i < m; i++) {
            if (matchOf[i] >= 0) {
                pairs.put(i, matchOf[i]);
            }
        }
        pairs.forEach((i, j) -> compare(oldItems.get(i), newItems.get(j), edits));
    }

    /**
     * Weighted longest common subsequence. Returns for every old index the new index it is
     * aligned with, or -1.
     */
    private int[] align(List<SemanticNode> oldItems, List<SemanticNode> newItems) {
        int m = oldItems.size();
        int n = newItems.size();
        int[][] dp = new int[m + 1][n + 1];
        for (int i = 1; i <= m; i++) {
            for (int j = 1; j <= n; j++) {
                int best = Math.max(dp[i - 1][j], dp[i][j - 1]);
                int w = weight(oldItems.get(i - 1), newItems.get(j - 1));
                if (w > 0) {
                    best = Math.max(best, dp[i - 1][j - 1] + w);
                }
                dp[i][j] = best;
            }
        }
        int[] matchOf = new int[m];
        Arrays.fill(matchOf, -1);
        int i = m;
        int j = n;
        while (i > 0 && j > 0) {
            int w = weight(oldItems.get(i - 1), newItems.get(j - 1));
            if (w > 0 && dp[i][j] == dp[i - 1][j - 1] + w) {
                matchOf[i - 1] = j - 1;
                i--;
                j--;
            } else if (dp[i - 1][j] >= dp[i][j - 1]) {
                i--;
            } else {
                j--;
            }
        }
        return matchOf;
    }

    private static int weight(SemanticNode x, SemanticNode y) {
        if (x.id().equals(y.id())) {
            return SAME_ID;
        }
        return x.equals(y) ? SAME_VALUE : 0;
    }

    /**
     * Whether two collections are one item with changed content: mappings that agree on a naming
     * key, otherwise collections of one kind that share at least half their children.
     */
    static boolean similar(SemanticNode x, SemanticNode y) {
        if (x.kind() != y.kind() || !x.isContainer()) {
            return false;
        }
        if (x.kind() == SemanticKind.MAPPING) {
            for (String key : NAME_KEYS) {
                SemanticNode p = x.entries().get(key);
                SemanticNode q = y.entries().get(key);
                if (p != null && q != null && !p.isContainer()) {
                    return p.equals(q);
                }
            }
            long shared = x.entries().entrySet().stream()
                    .filter(e -> e.getValue().equals(y.entries().get(e.getKey())))
                    .count();
            return shared > 0 && 2 * shared >= Math.max(x.entries().size(), y.entries().size());
        }
        long shared = x.items().stream().filter(y.items()::contains).count();
        return shared > 0 && 2 * shared >= Math.max(x.items().size(), y.items().size());
    }

    /**
     * For every index, the number of aligned indices before it.
     */
    private static int[] gaps(Set<Integer> anchors, int size) {
        int[] gap = new int[size];
        int count = 0;
        for (int k = 0; k < size; k++) {
            gap[k] = count;
            if (anchors.contains(k)) {
                count++;
            }
        }
        return gap;
    }

    /**
     * Pairs leftover old and new items that sit between the same two aligned items, in order.
     */
    private static void pairWithinGaps(int[] matchOf, int[] newMatch, Set<Integer> aligned, int m, int n) {
        int oldStart = 0;
        int newStart = 0;
        List<Integer> anchors = new ArrayList<>(aligned);
        anchors.sort(Integer::compareTo);
        anchors.add(m);
        for (int anchor : anchors) {
            int newEnd = anchor < m ? matchOf[anchor] : n;
            int j = newStart;
            for (int i = oldStart; i < anchor; i++) {
                if (matchOf[i] >= 0) {
                    continue;
                }
                while (j < newEnd && newMatch[j] >= 0) {
                    j++;
                }
                if (j >= newEnd) {
                    break;
                }
                matchOf[i] = j;
                newMatch[j] = i;
                j++;
            }
            oldStart = anchor + 1;
            newStart = newEnd + 1;
        }
    }
}
