package com.raditha.canon.patch;

import com.raditha.canon.diff.Edit;
import com.raditha.canon.exceptions.CanonException;

/**
 * An edit that could not be applied.
 *
 * @param index position of the edit in its patch
 * @param edit  the edit
 * @param error why it failed, with the location of the node involved
 */
public record EditFailure(int index, Edit edit, CanonException error) {

    @Override
    public String toString() {
        return "edit " + index + " (" + edit.op() + "): " + error.getMessage();
    }
}
