/*
 * @LICENSE@
 */
package org.rxfront.regex;

import static org.rxfront.regex.Misc.Esc.RXP;

/**
 * The canonical, byte level representation handed to automaton construction.
 * It has six node kinds: the empty match, a single byte, sequence,
 * alternation, Kleene closure, and a capture group carrying a positive id.
 * Character classes, named sets, wildcards and counted repetition have all
 * been rewritten away by {@link Lowering} by the time a tree of this type
 * exists.
 * <p>
 * Instances are immutable values; two trees are equal if they have the same
 * shape. The empty language has no node of its own - it is represented by
 * the absence of a tree (<code>null</code>).
 */
public abstract class IR {

    private IR() {
    }

    /**
     * @return the number of nodes on the longest root to leaf path.
     */
    public abstract int depth();

    abstract void appendTo(StringBuilder sb);

    @Override
    public final String toString() {
        StringBuilder sb = new StringBuilder();
        appendTo(sb);
        return sb.toString();
    }

    /**
     * Matches the empty string.
     */
    public static final class One extends IR {

        private static final One INSTANCE = new One();

        private One() {
        }

        @Override
        public int depth() {
            return 1;
        }

        @Override
        void appendTo(StringBuilder sb) {
            sb.append("()");
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof One;
        }

        @Override
        public int hashCode() {
            return 1;
        }
    }

    /**
     * Matches a single byte.
     */
    public static final class Lit extends IR {

        public final int value;

        private Lit(int value) {
            this.value = value;
        }

        @Override
        public int depth() {
            return 1;
        }

        @Override
        void appendTo(StringBuilder sb) {
            RXP.esc(sb, value);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Lit && ((Lit) o).value == value;
        }

        @Override
        public int hashCode() {
            return 31 + value;
        }
    }

    public static abstract class Unary extends IR {

        public final IR child;

        private Unary(IR child) {
            if (child == null) {
                throw new NullPointerException("child");
            }
            this.child = child;
        }

        @Override
        public final int depth() {
            return 1 + child.depth();
        }
    }

    /**
     * Kleene closure.
     */
    public static final class Star extends Unary {

        private Star(IR child) {
            super(child);
        }

        @Override
        void appendTo(StringBuilder sb) {
            boolean paren = !(child instanceof Lit || child instanceof Alt
                    || child instanceof CG);
            if (paren) sb.append('(');
            child.appendTo(sb);
            if (paren) sb.append(')');
            sb.append('*');
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Star && ((Star) o).child.equals(child);
        }

        @Override
        public int hashCode() {
            return 37 * 3 + child.hashCode();
        }
    }

    /**
     * Capture group. The id identifies the source level group, so unrolled
     * copies of one group all carry the same id.
     */
    public static final class CG extends Unary {

        public final int id;

        private CG(int id, IR child) {
            super(child);
            if (id < 1) {
                throw new IllegalArgumentException("group id must be positive: " + id);
            }
            this.id = id;
        }

        @Override
        void appendTo(StringBuilder sb) {
            sb.append("(:").append(id).append(' ');
            child.appendTo(sb);
            sb.append(')');
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof CG)) {
                return false;
            }
            CG cg = (CG) o;
            return cg.id == id && cg.child.equals(child);
        }

        @Override
        public int hashCode() {
            int result = 17;
            result = 37 * result + id;
            result = 37 * result + child.hashCode();
            return result;
        }
    }

    public static abstract class Binary extends IR {

        public final IR first, second;

        private Binary(IR first, IR second) {
            if (first == null || second == null) {
                throw new NullPointerException("operand");
            }
            this.first = first;
            this.second = second;
        }

        @Override
        public final int depth() {
            return 1 + Math.max(first.depth(), second.depth());
        }

        @Override
        public final boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || o.getClass() != getClass()) {
                return false;
            }
            Binary b = (Binary) o;
            return first.equals(b.first) && second.equals(b.second);
        }

        @Override
        public final int hashCode() {
            int result = getClass() == Cat.class ? 19 : 23;
            result = 37 * result + first.hashCode();
            result = 37 * result + second.hashCode();
            return result;
        }
    }

    /**
     * Sequence: <code>first</code> then <code>second</code>.
     */
    public static final class Cat extends Binary {

        private Cat(IR first, IR second) {
            super(first, second);
        }

        @Override
        void appendTo(StringBuilder sb) {
            first.appendTo(sb);
            second.appendTo(sb);
        }
    }

    /**
     * Alternation. Order matters to the consumer: <code>first</code> is the
     * preferred branch.
     */
    public static final class Alt extends Binary {

        private Alt(IR first, IR second) {
            super(first, second);
        }

        @Override
        void appendTo(StringBuilder sb) {
            sb.append('(');
            first.appendTo(sb);
            sb.append('|');
            second.appendTo(sb);
            sb.append(')');
        }
    }

    /*
     * static factories
     */

    public static One one() {
        return One.INSTANCE;
    }

    /**
     * @param b
     *            the byte value, 0 to 255
     * @throws IllegalArgumentException
     *             if <code>b</code> is outside the byte alphabet.
     */
    public static Lit oneByte(int b) {
        if (b < 0 || b > CharClass.MAX_BYTE) {
            throw new IllegalArgumentException(
                "not a byte: " + b + " (the IR alphabet is 0-255)");
        }
        return new Lit(b);
    }

    public static Cat seq(IR first, IR second) {
        return new Cat(first, second);
    }

    public static Alt alt(IR first, IR second) {
        return new Alt(first, second);
    }

    public static Star star(IR child) {
        return new Star(child);
    }

    public static CG group(int id, IR child) {
        return new CG(id, child);
    }
}
