/*
 * @LICENSE@
 */
package org.rxfront.regex;

import java.util.List;

/**
 * Builds an alternation of many {@link IR} nodes as a balanced binary tree.
 * A character class can expand to as many as 256 single byte alternatives;
 * folding those from the left would give a tree as deep as the list is long,
 * where splitting at the midpoint keeps the depth at
 * <code>ceil(log2(n))</code> alternation levels.
 */
final class BalancedAlt {

    /**
     * @param alts
     *            the alternatives, in preference order
     * @return <code>null</code> for an empty list (the empty language), the
     *         sole element of a singleton list, otherwise the balanced
     *         alternation of the elements in order.
     */
    static IR build(List<? extends IR> alts) {
        return build(alts, 0, alts.size());
    }

    /*
     * [from, to)
     */
    private static IR build(List<? extends IR> alts, int from, int to) {
        int n = to - from;
        if (n == 0) {
            return null;
        } else if (n == 1) {
            return alts.get(from);
        }
        int mid = from + n / 2;
        return IR.alt(build(alts, from, mid), build(alts, mid, to));
    }

    private BalancedAlt() {}    // uninstantiable
}
