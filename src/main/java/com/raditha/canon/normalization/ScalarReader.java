package com.raditha.canon.normalization;

import com.raditha.canon.cst.QuoteStyle;
import com.raditha.canon.semantic.SemanticPath;

/**
 * Reads a literal the way the normalizer would, in a given position. Renderers use it to check
 * that the text they write reads back as the value they meant.
 */
@FunctionalInterface
public interface ScalarReader {

    ScalarReading read(String literal, QuoteStyle quote, String key, SemanticPath path);
}
