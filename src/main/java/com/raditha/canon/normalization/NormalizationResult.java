package com.raditha.canon.normalization;

import com.raditha.canon.correspondence.CorrespondenceMap;
import com.raditha.canon.semantic.SemanticTree;

/**
 * The canonical view of a document and its link back to the syntax tree.
 */
public record NormalizationResult(SemanticTree tree, CorrespondenceMap map) {
}
