/*
 * @LICENSE@
 */

package org.rxfront.regex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.rxfront.regex.Misc.Esc.RXCC;

/**
 * An immutable value class representing character classes in the regex sense
 * of the term: a set of code points, stored as a sorted array of
 * {@link Interval}s which are pairwise disjoint and never adjacent. This is the
 * normal form every other part of the package relies on; the {@link Builder}
 * is the only way to create instances, and it maintains the invariant one
 * interval at a time.
 * <p>
 * Complementation is relative to the byte alphabet <code>[0, 255]</code>, the
 * alphabet of the canonical {@link IR}. Intervals above that alphabet may be
 * held (a positive class parsed from text can contain any <code>char</code>)
 * but they never survive a complement or a call to {@link #bytes()}.
 */
final class CharClass {

    /**
     * Largest member of the byte alphabet.
     */
    static final int MAX_BYTE = 0xFF;

    /**
     * A closed interval <code>[first, last]</code> of code points.
     * <p>
     * Intervals built from source text may be <em>invalid</em> (first greater
     * than last, as in <code>[z-a]</code>). Invalid intervals are legal values
     * of this class but are dropped by {@link CharClass#normalize(List)}; a
     * {@link CharClass} never contains one.
     */
    static final class Interval implements Comparable<Interval> {

        /**
         * inclusive
         */
        final int first;
        /**
         * inclusive
         */
        final int last;

        Interval(int first, int last) {
            assert first >= 0 && last >= 0 : "negative code point";
            this.first = first;
            this.last = last;
        }

        Interval(int c) {
            this(c, c);
        }

        boolean isValid() {
            return first <= last;
        }

        /**
         * Attempt to merge an {@link Interval} with the current instance,
         * returning a new instance.
         *
         * @param ci
         *            the {@link Interval} to attempt to merge; must not sort
         *            before <code>this</code>
         * @return a new {@link Interval} covering both if they overlap or
         *         touch, otherwise <code>null</code>.
         */
        private Interval maybeMerge(Interval ci) {
            assert this.compareTo(ci) <= 0 : "arg must be ordered";
            if (this.contains(ci)) {
                return this;
            } else if (ci.first - 1 <= last) {
                return new Interval(first, ci.last);
            } else {
                return null;
            }
        }

        @Override
        public int compareTo(Interval ci) {
            int ret = 0;
            if (first < ci.first) {
                ret = -1;
            } else if (first > ci.first) {
                ret = 1;
            } else if (last < ci.last) {
                ret = -1;
            } else if (last > ci.last) {
                ret = 1;
            }
            assert (ret == 0 ? this.equals(ci) : true);
            return ret;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Interval))
                return false;
            final Interval ci = (Interval) o;
            return first == ci.first && last == ci.last;
        }

        @Override
        public int hashCode() { // per Bloch
            int result = 17;
            result = 37 * result + first;
            result = 37 * result + last;
            return result;
        }

        /**
         * For debugging only.
         */
        @Override
        public String toString() {
            return "[" + RXCC.esc(first) + ',' + RXCC.esc(last) + ']';
        }

        private boolean contains(int c) {
            return first <= c && c <= last;
        }

        private boolean contains(Interval ci) {
            return contains(ci.first) && contains(ci.last);
        }

        private int size() {
            return last - first + 1;
        }
    }

    /**
     * Field name mnemonic: Char Interval Array
     */
    private final Interval[] cia;

    private CharClass(Interval[] cia) {
        this.cia = cia;
    }

    static final CharClass EMPTY = new CharClass(new Interval[0]);

    static final CharClass ALL_BYTES =
            new CharClass(new Interval[] {new Interval(0, MAX_BYTE)});

    /**
     * Builds {@link CharClass} instances one interval at a time, keeping its
     * list sorted, disjoint and non-adjacent after every call.
     */
    static final class Builder {

        private final ArrayList<Interval> cil = new ArrayList<Interval>();

        Builder() {
        }

        Builder(CharClass cc) {
            init(cc);
        }

        private Builder clear() {
            cil.clear();
            return this;
        }

        private boolean isValid() {
            Interval ci = null;
            for (Interval ciNext : cil) {
                if (!ciNext.isValid()) {
                    return false;
                }
                if (ci != null && !(ci.last + 1 < ciNext.first)) {
                    return false;
                }
                ci = ciNext;
            }
            return true;
        }

        /**
         * Clear this <code>Builder</code> and init it with the intervals of
         * <code>cc</code>.
         */
        Builder init(CharClass cc) {
            clear();
            cil.addAll(Arrays.asList(cc.cia));
            assert this.isValid() : this;
            return this;
        }

        /**
         * @return index - if non-negative, the interval at this index
         *         <i>equals</i> <code>ci</code>. If negative, then this is
         *         the insertion point (-(i+1)).
         */
        private int indexFor(Interval ci) {
            return Collections.binarySearch(cil, ci);
        }

        /**
         * Attempt to merge the interval at <code>ip</code> with the one that
         * follows it.
         *
         * @return <code>true</code> if the two were merged.
         */
        private boolean mergeAt(int ip) {
            if (0 <= ip && ip + 1 < cil.size()) {
                Interval ciMerge = cil.get(ip).maybeMerge(cil.get(ip + 1));
                if (ciMerge != null) {
                    cil.set(ip, ciMerge);
                    cil.remove(ip + 1);
                    return true;
                }
            }
            return false;
        }

        /**
         * Adds an interval, possibly merging it with its neighbours. Invalid
         * intervals are ignored.
         *
         * @return <code>this</code> instance (for invocation chaining).
         */
        Builder add(Interval ci) {
            if (!ci.isValid()) {
                return this;
            }
            int ip = insertionPoint(indexFor(ci));
            cil.add(ip, ci);
            if (mergeAt(ip - 1))
                --ip; // merge left
            while (mergeAt(ip))
                ; // merge right
            assert this.isValid() : this;
            return this;
        }

        Builder add(int c) {
            return add(new Interval(c));
        }

        /**
         * Add a range of code points. The range is inclusive.
         */
        Builder add(int first, int last) {
            return add(new Interval(first, last));
        }

        Builder add(CharClass cc) {
            for (Interval ci : cc.cia) {
                add(ci);
            }
            return this;
        }

        /**
         * Replaces the contents with their complement over the byte alphabet.
         * Anything above {@link CharClass#MAX_BYTE} is dropped.
         */
        Builder complement() {
            ArrayList<Interval> temp = new ArrayList<Interval>(cil);
            cil.clear();
            int begin = 0;
            for (Interval ci : temp) {
                if (begin > MAX_BYTE || ci.first > MAX_BYTE) {
                    break;
                }
                if (begin < ci.first) {
                    cil.add(new Interval(begin, ci.first - 1));
                }
                begin = ci.last + 1;
            }
            if (begin <= MAX_BYTE) {
                cil.add(new Interval(begin, MAX_BYTE));
            }
            assert this.isValid() : this;
            return this;
        }

        boolean isEmpty() {
            return cil.isEmpty();
        }

        CharClass build() {
            return cil.isEmpty()
                    ? EMPTY
                    : new CharClass(cil.toArray(new Interval[cil.size()]));
        }

        @Override
        public String toString() {
            return build().toString();
        }
    }

    /**
     * Drops invalid intervals, sorts the rest by their first code point and
     * merges any interval which overlaps, or is adjacent to, its predecessor.
     * The result is minimal; normalizing it again returns an equal instance.
     *
     * @param ranges
     *            intervals in any order, possibly overlapping or invalid
     * @return the normalized character class
     */
    static CharClass normalize(List<Interval> ranges) {
        Builder ccb = new Builder();
        for (Interval ci : ranges) {
            ccb.add(ci);
        }
        return ccb.build();
    }

    /**
     * Complement of an arbitrary list of intervals over the byte alphabet.
     * The input is normalized first, so callers need not do it.
     */
    static CharClass complement(List<Interval> ranges) {
        return normalize(ranges).complement();
    }

    CharClass complement() {
        return new Builder(this).complement().build();
    }

    CharClass union(CharClass cc) {
        return new Builder(this).add(cc).build();
    }

    /**
     * @return this class restricted to the byte alphabet.
     */
    CharClass bytes() {
        if (cia.length == 0 || cia[cia.length - 1].last <= MAX_BYTE) {
            return this;
        }
        Builder ccb = new Builder();
        for (Interval ci : cia) {
            if (ci.first > MAX_BYTE) {
                break;
            }
            ccb.add(ci.first, Math.min(ci.last, MAX_BYTE));
        }
        return ccb.build();
    }

    boolean contains(int c) {
        int lo = 0;
        int hi = cia.length - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            Interval ci = cia[mid];
            if (c < ci.first) {
                hi = mid - 1;
            } else if (c > ci.last) {
                lo = mid + 1;
            } else {
                return true;
            }
        }
        return false;
    }

    boolean isEmpty() {
        return cia.length == 0;
    }

    /**
     * @return the number of code points in this class.
     */
    int size() {
        int n = 0;
        for (Interval ci : cia) {
            n += ci.size();
        }
        return n;
    }

    List<Interval> intervals() {
        return Collections.unmodifiableList(Arrays.asList(cia));
    }

    static CharClass newSingleChar(int c) {
        return new Builder().add(c).build();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (Interval ci : cia) {
            sb.append(RXCC.esc(ci.first));
            if (ci.last > ci.first) {
                if (ci.last > ci.first + 1) {
                    sb.append('-');
                }
                sb.append(RXCC.esc(ci.last));
            }
        }
        return sb.append(']').toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CharClass))
            return false;
        return Arrays.equals(cia, ((CharClass) o).cia);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(cia);
    }

    private static int insertionPoint(int i) {
        return i < 0 ? -(i + 1) : i;
    }
}
