package com.raditha.canon.reassembly;

import com.raditha.canon.cst.CstNode;
import com.raditha.canon.cst.NodeLookup;

/**
 * Writes a concrete syntax tree back to text: for every node its leading trivia, its literal (or
 * opening delimiter, children and closing text), then its trailing trivia. Reassembling an
 * unedited tree reproduces its source exactly.
 */
public class Reassembler {

    public String reassemble(NodeLookup tree) {
        StringBuilder sb = new StringBuilder();
        write(tree, tree.rootId(), sb);
        return sb.toString();
    }

    /**
     * Text of one node and its descendants, including its own trivia.
     */
    public String reassemble(NodeLookup tree, int nodeId) {
        StringBuilder sb = new StringBuilder();
        write(tree, nodeId, sb);
        return sb.toString();
    }

    private void write(NodeLookup tree, int id, StringBuilder sb) {
        CstNode node = tree.node(id);
        sb.append(node.leading().text());
        sb.append(node.literal());
        if (node.isContainer()) {
            for (int child : node.children()) {
                write(tree, child, sb);
            }
            sb.append(node.closing());
        }
        sb.append(node.trailing().text());
    }
}
