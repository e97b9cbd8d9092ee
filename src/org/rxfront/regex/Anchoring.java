/*
 * @LICENSE@
 */
package org.rxfront.regex;

/**
 * Whether a parsed expression is pinned to the beginning of the input, the
 * end, both, or neither. Computed once per parse from a leading <code>^</code>
 * and a trailing <code>$</code>; the lowering pass ignores it and it is handed
 * as is to whatever builds the automaton.
 */
public enum Anchoring {

    NONE, START, END, BOTH;

    static Anchoring of(boolean start, boolean end) {
        if (start) {
            return end ? BOTH : START;
        } else {
            return end ? END : NONE;
        }
    }

    public boolean atStart() {
        return this == START || this == BOTH;
    }

    public boolean atEnd() {
        return this == END || this == BOTH;
    }
}
