package com.arbor.tree;

/**
 * Thrown when a shift is requested with neither a lower nor an upper bound. Public operations never
 * build such a request; seeing this means a range computation is broken.
 */
public final class MalformedShiftRequestException extends IllegalArgumentException {

    public MalformedShiftRequestException() {
        super("Both from and to bounds of a shift are null");
    }
}
