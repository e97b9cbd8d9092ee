/* @LICENSE@
 */
package org.rxfront.regex;

import static org.rxfront.regex.Misc.LS;
import static org.rxfront.regex.Misc.Esc.RXCC;
import static org.rxfront.regex.Misc.Esc.RXP;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Stack;

import org.rxfront.regex.AST.Visitor.TraversalOrder;
import org.rxfront.regex.CharClass.Interval;

/**
 *
 * Uninstantiable class which serves as a source container for the static
 * classes and static methods used in the construction of the surface Abstract
 * Syntax Trees produced by {@link RegexParser}.
 * <p>
 * Nodes are immutable values: two trees are equal when they have the same
 * shape, whatever their identity.
 */
final class AST {

    static abstract class Node {

        final String toTreeString() {
            final StringBuilder sb = new StringBuilder();
            new AbstractTreePrinter() {
                private int nspace = 0;
                private void indent() {
                    for (int i=0; i<nspace; ++i) {
                        sb.append(' ');
                    }
                }
                @Override
                void push() {
                    nspace += 4;
                }
                @Override
                void pop() {
                    nspace -= 4;
                }
                @Override
                void appendNonTerminal(String label) {
                    indent();
                    sb.append(label).append(LS);
                }
                @Override
                void appendLeaf(String label) {
                    indent();
                    sb.append(label).append(LS);
                }
            }.print(Node.this);
            return sb.toString();
        }

        /**
         * @return the values, other than children, which distinguish two
         *         nodes of the same class.
         */
        Object[] attributes() {
            return NO_ATTRIBUTES;
        }

        Node[] children() {
            return NO_CHILDREN;
        }

        @Override
        public final boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || o.getClass() != getClass()) {
                return false;
            }
            Node node = (Node) o;
            return Arrays.equals(attributes(), node.attributes())
                    && Arrays.equals(children(), node.children());
        }

        @Override
        public final int hashCode() {
            int result = getClass().getSimpleName().hashCode();
            result = 37 * result + Arrays.hashCode(attributes());
            result = 37 * result + Arrays.hashCode(children());
            return result;
        }

        /**
         * @return the node in regex syntax, for logs and test messages.
         *         Char classes and code points the grammar cannot escape do
         *         not always parse back.
         */
        @Override
        public final String toString() {

            return new Visitor(TraversalOrder.SUBCLASS_DEFINED) {

                private final StringBuilder sb = new StringBuilder();

                @Override
                public String toString() {
                    visit(Node.this);
                    return sb.toString();
                }

                @Override
                protected void visit(Cat node) {
                    visitCatChild(node.first);
                    visitCatChild(node.second);
                }

                @Override
                protected void visit(Alt node) {
                    if (node.first instanceof Alt) {
                        nonCapturing(node.first);
                    } else {
                        visit(node.first);
                    }
                    sb.append('|');
                    visit(node.second);
                }

                @Override
                protected void visit(Quantifier node) {
                    visitUnaryChild(node.child);
                    sb.append(node.glyph()).append(node.mood.glyph);
                }

                @Override
                protected void visit(Group node) {
                    sb.append(node.capturing ? "(" : "(?:");
                    visit(node.child);
                    sb.append(')');
                }

                @Override
                protected void visit(Suppress node) {
                    sb.append("$(");
                    visit(node.child);
                    sb.append(")$");
                }

                @Override
                protected void visit(Dot node) {
                    sb.append('.');
                }

                @Override
                protected void visit(Chr node) {
                    RXP.esc(sb, node.c);
                }

                @Override
                protected void visit(Cls node) {
                    sb.append(node.positive ? "[" : "[^");
                    for (Interval ci : node.ranges) {
                        RXCC.esc(sb, ci.first);
                        if (ci.first != ci.last) {
                            sb.append('-');
                            RXCC.esc(sb, ci.last);
                        }
                    }
                    sb.append(']');
                }

                @Override
                protected void visit(NamedSet node) {
                    sb.append(node.positive ? "[:" : "[^:")
                        .append(node.set.spelling).append(":]");
                }

                private void nonCapturing(Node child) {
                    sb.append("(?:");
                    visit(child);
                    sb.append(')');
                }

                private void visitCatChild(Node child) {
                    if (child instanceof Alt) {
                        nonCapturing(child);
                    } else {
                        visit(child);
                    }
                }

                private void visitUnaryChild(Node child) {
                    boolean paren = !(                  // everything _except_ ...
                            child instanceof Chr        // unary operator binds OK
                            || child instanceof Dot
                            || child instanceof Cls
                            || child instanceof NamedSet
                            || child instanceof Group   // Group has parens
                            || child instanceof Suppress);
                    if (paren) {
                        nonCapturing(child);
                    } else {
                        visit(child);
                    }
                }
            }.toString();
        }
    }

    private static final Object[] NO_ATTRIBUTES = new Object[0];
    private static final Node[] NO_CHILDREN = new Node[0];

    static abstract class Leaf extends Node {
    }

    /**
     * Matches the empty string only.
     */
    static final class One extends Leaf {
        private One() {
        }
    }

    /**
     * The wildcard: matches any one symbol.
     */
    static final class Dot extends Leaf {
        private Dot() {
        }
    }

    static final class Chr extends Leaf {

        final char c;

        private Chr(char c) {
            this.c = c;
        }

        @Override
        Object[] attributes() {
            return new Object[] {c};
        }
    }

    /**
     * A bracketed character class, as written: the ranges keep their source
     * order and may overlap or be reversed. {@link Lowering} normalizes them.
     */
    static final class Cls extends Leaf {

        final boolean positive;
        final List<Interval> ranges;

        private Cls(boolean positive, List<Interval> ranges) {
            this.positive = positive;
            this.ranges = Collections.unmodifiableList(
                new ArrayList<Interval>(ranges));
        }

        @Override
        Object[] attributes() {
            return new Object[] {positive, ranges};
        }
    }

    static final class NamedSet extends Leaf {

        final boolean positive;
        final PosixSet set;

        private NamedSet(boolean positive, PosixSet set) {
            assert set != null;
            this.positive = positive;
            this.set = set;
        }

        @Override
        Object[] attributes() {
            return new Object[] {positive, set};
        }
    }

    static abstract class NonTerminal extends Node {
    }

    static abstract class Unary extends NonTerminal {

        final Node child;
        private Unary(Node child) {
            assert child != null;
            this.child = child;
        }

        @Override
        final Node[] children() {
            return new Node[] {child};
        }
    }

    /**
     * Parentheses. Only capturing groups are numbered; a non-capturing group
     * exists for precedence alone.
     */
    static final class Group extends Unary {

        final boolean capturing;

        private Group(boolean capturing, Node child) {
            super(child);
            this.capturing = capturing;
        }

        @Override
        Object[] attributes() {
            return new Object[] {capturing};
        }
    }

    /**
     * Marks the text matched by <code>child</code> as excluded from output.
     */
    static final class Suppress extends Unary {

        private Suppress(Node child) {
            super(child);
        }
    }

    static abstract class Quantifier extends Unary {

        enum Mood {

            GREEDY(""), LAZY("?");

            final String glyph;
            Mood(String glyph) {
                this.glyph = glyph;
            }
        }

        final Mood mood;
        private Quantifier(Node child, Mood mood) {
            super(child);
            assert mood != null;
            this.mood = mood;
        }

        abstract String glyph();

        @Override
        Object[] attributes() {
            return new Object[] {mood};
        }
    }

    static final class Star extends Quantifier {

        private Star(Node child, Mood mood) {
            super(child, mood);
        }

        @Override
        String glyph() {
            return "*";
        }
    }

    static final class Plus extends Quantifier {

        private Plus(Node child, Mood mood) {
            super(child, mood);
        }

        @Override
        String glyph() {
            return "+";
        }
    }

    static final class Question extends Quantifier {

        private Question(Node child, Mood mood) {
            super(child, mood);
        }

        @Override
        String glyph() {
            return "?";
        }
    }

    /**
     * Counted repetition <code>{lower,upper}</code>.
     */
    static final class Range extends Quantifier {

        /**
         * Value of {@link #upper} for <code>{lower,}</code>.
         */
        static final int UNBOUNDED = -1;

        final int lower;
        final int upper;

        private Range(Node child, int lower, int upper, Mood mood) {
            super(child, mood);
            assert lower >= 0 && upper >= UNBOUNDED;
            this.lower = lower;
            this.upper = upper;
        }

        boolean isBounded() {
            return upper != UNBOUNDED;
        }

        @Override
        String glyph() {
            if (!isBounded()) {
                return "{" + lower + ",}";
            } else if (upper == lower) {
                return "{" + lower + "}";
            } else {
                return "{" + lower + "," + upper + "}";
            }
        }

        @Override
        Object[] attributes() {
            return new Object[] {mood, lower, upper};
        }
    }

    static abstract class Binary extends NonTerminal {

        final Node first, second;

        private Binary(Node first, Node second) {
            assert first != null && second != null;
            this.first = first;
            this.second = second;
        }

        @Override
        final Node[] children() {
            return new Node[] {first, second};
        }
    }

    /**
     * Concatenation.
     */
    static final class Cat extends Binary {

        private Cat(Node first, Node second) {
            super(first, second);
        }
    }

    /**
     * Alternation; <code>first</code> is the preferred branch.
     */
    static final class Alt extends Binary {

        private Alt(Node first, Node second) {
            super(first, second);
        }
    }

    static abstract class Visitor {

        enum TraversalOrder {
            TOP_DOWN,
            BOTTOM_UP,
            SUBCLASS_DEFINED;
        }

        private final TraversalOrder order;

        protected Visitor(TraversalOrder order) {
            this.order = order;
        }


        /*
         * multi-dispatch:
         * - allows Visitor subclasses to deal with the exact granularity they want.
         * - "instanceof" dispatch is ugly but it's only in one place - here.
         */

        protected void visit(Node node) {
            if (node instanceof NonTerminal) {
                visit((NonTerminal) node);
            } else if (node instanceof Leaf) {
                visit((Leaf) node);
            } else {
                error(node);
            }
        }

        protected void visit(NonTerminal node) {
            if (order == TraversalOrder.BOTTOM_UP) {
                for (Node n : node.children()) {
                    visit(n);
                }
            }
            if (node instanceof Binary) {
                visit((Binary) node);
            } else if (node instanceof Unary){
                visit((Unary) node);
            } else {
                error(node);
            }
            if (order == TraversalOrder.TOP_DOWN) {
                for (Node n : node.children()) {
                    visit(n);
                }
            }
        }

        protected void visit(Binary node) {
            if (node instanceof Cat) {
                visit((Cat) node);
            } else if (node instanceof Alt) {
                visit((Alt) node);
            } else {
                error(node);
            }
        }

        protected void visit(Unary node) {

            if (node instanceof Group) {
                visit((Group) node);
            } else if (node instanceof Suppress) {
                visit((Suppress) node);
            } else if (node instanceof Quantifier) {
                visit((Quantifier) node);
            } else error(node);
        }

        protected void visit(Quantifier node) {
            if (node instanceof Star) {
                visit((Star) node);
            } else if (node instanceof Plus) {
                visit((Plus) node);
            } else if (node instanceof Question) {
                visit((Question) node);
            } else if (node instanceof Range) {
                visit((Range) node);
            } else error(node);
        }

        protected void visit(Leaf node) {
            if (node instanceof Chr) {
                visit((Chr) node);
            } else if (node instanceof Cls) {
                visit((Cls) node);
            } else if (node instanceof NamedSet) {
                visit((NamedSet) node);
            } else if (node instanceof Dot) {
                visit((Dot) node);
            } else if (node instanceof One) {
                visit((One) node);
            } else error(node);
        }

        protected void visit(Cat node) {}
        protected void visit(Alt node) {}

        protected void visit(Star node) {}
        protected void visit(Plus node) {}
        protected void visit(Question node) {}
        protected void visit(Range node) {}
        protected void visit(Group node) {}
        protected void visit(Suppress node) {}

        protected void visit(One node) {}
        protected void visit(Dot node) {}
        protected void visit(Chr node) {}
        protected void visit(Cls node) {}
        protected void visit(NamedSet node) {}

        private static void error(Node node) {
            throw new AssertionError("unknown node type " + node.getClass());
        }
    }

    static abstract class AbstractTreePrinter extends Visitor {

        abstract void appendNonTerminal(String label);
        abstract void appendLeaf(String label);
        abstract void push();
        abstract void pop();

        AbstractTreePrinter() {
            super(TraversalOrder.TOP_DOWN);
        }

        final void print(Node root) {
            visit(root);
        }

        @Override
        protected final void visit(NonTerminal node) {
            super.visit(node);
            pop();
        }

        @Override
        protected final void visit(Cat node) {
            appendNonTerminal("&");
            push();
        }

        @Override
        protected final void visit(Alt node) {
            appendNonTerminal("|");
            push();
        }

        @Override
        protected final void visit(Quantifier node) {
            appendNonTerminal(node.glyph() + node.mood.glyph);
            push();
        }

        @Override
        protected final void visit(Group node) {
            appendNonTerminal(node.capturing ? "cg" : "group");
            push();
        }

        @Override
        protected final void visit(Suppress node) {
            appendNonTerminal("suppress");
            push();
        }

        @Override
        protected final void visit(Leaf node) {
            appendLeaf(node instanceof One ? "()" : node.toString());
        }
    }


    /*
     * static factories of convenience for parser and testing
     */

    private static final One ONE = new One();
    private static final Dot DOT = new Dot();

    static One one() {
        return ONE;
    }

    static Dot dot() {
        return DOT;
    }

    static Chr literal(char c) {
        return new Chr(c);
    }

    /**
     * @return the concatenation of the chars of <code>s</code>, folded to
     *         the right like the parser folds juxtaposition.
     */
    static Node literal(String s) {
        Node[] nodes = new Node[s.length()];
        for (int i = 0; i < nodes.length; ++i) {
            nodes[i] = literal(s.charAt(i));
        }
        return cat(nodes);
    }

    static Cls charClass(boolean positive, List<Interval> ranges) {
        return new Cls(positive, ranges);
    }

    static Cls charClass(boolean positive, Interval... ranges) {
        return new Cls(positive, Arrays.asList(ranges));
    }

    static NamedSet namedSet(boolean positive, PosixSet set) {
        return new NamedSet(positive, set);
    }

    /**
     * Right fold: <code>cat(a, b, c)</code> is <code>a(bc)</code>.
     */
    static Node cat(Node... nodes) {
        return fold(nodes, false);
    }

    /**
     * Right fold: <code>alt(a, b, c)</code> is <code>a|(b|c)</code>.
     */
    static Node alt(Node... nodes) {
        return fold(nodes, true);
    }

    static Node cat(List<Node> nodes) {
        return cat(nodes.toArray(new Node[nodes.size()]));
    }

    static Node alt(List<Node> nodes) {
        return alt(nodes.toArray(new Node[nodes.size()]));
    }

    private static Node fold(Node[] nodes, boolean alt) {
        assert nodes.length > 0;
        Node root = nodes[nodes.length - 1];
        for (int i = nodes.length - 2; i >= 0; --i) {
            root = alt ? new Alt(nodes[i], root) : new Cat(nodes[i], root);
        }
        return root;
    }

    static Star star(Node child) {
        return new Star(child, Quantifier.Mood.GREEDY);
    }

    static Plus plus(Node child) {
        return new Plus(child, Quantifier.Mood.GREEDY);
    }

    static Question question(Node child) {
        return new Question(child, Quantifier.Mood.GREEDY);
    }

    static Range range(Node child, int lower, int upper) {
        return new Range(child, lower, upper, Quantifier.Mood.GREEDY);
    }

    static Star star(Node child, Quantifier.Mood mood) {
        return new Star(child, mood);
    }

    static Plus plus(Node child, Quantifier.Mood mood) {
        return new Plus(child, mood);
    }

    static Question question(Node child, Quantifier.Mood mood) {
        return new Question(child, mood);
    }

    static Range range(Node child, int lower, int upper, Quantifier.Mood mood) {
        return new Range(child, lower, upper, mood);
    }

    static Group captureGroup(Node child) {
        return new Group(true, child);
    }

    static Group group(boolean capturing, Node child) {
        return new Group(capturing, child);
    }

    static Suppress suppress(Node child) {
        return new Suppress(child);
    }

    /**
     * Rebuilds a tree bottom up. Subclasses override individual visit methods
     * to rewrite the nodes they care about.
     */
    static class CopyVisitor extends Visitor {

        protected final Stack<Node> kids = new Stack<Node>();

        CopyVisitor() {
            super(TraversalOrder.BOTTOM_UP);
        }

        protected final void push(Node node) {
            kids.push(node);
        }

        Node copy(Node node) {
            assert node != null;
            visit(node);
            assert kids.size() == 1;
            return kids.pop();
        }

        @Override
        protected void visit(Leaf node) {
            push(node);     // immutable, share
        }
        @Override
        protected void visit(Cat node) {
            Node second = kids.pop();
            Node first = kids.pop();
            push(new Cat(first, second));
        }
        @Override
        protected void visit(Alt node) {
            Node second = kids.pop();
            Node first = kids.pop();
            push(new Alt(first, second));
        }
        @Override
        protected void visit(Star node) {
            push(new Star(kids.pop(), node.mood));
        }
        @Override
        protected void visit(Plus node) {
            push(new Plus(kids.pop(), node.mood));
        }
        @Override
        protected void visit(Question node) {
            push(new Question(kids.pop(), node.mood));
        }
        @Override
        protected void visit(Range node) {
            push(new Range(kids.pop(), node.lower, node.upper, node.mood));
        }
        @Override
        protected void visit(Group node) {
            push(new Group(node.capturing, kids.pop()));
        }
        @Override
        protected void visit(Suppress node) {
            push(new Suppress(kids.pop()));
        }
    }

    /**
     * Turns every capturing group into a non-capturing one.
     */
    static Node stripCaptureGroups(Node root) {
        return new CopyVisitor() {
            @Override
            protected void visit(Group node) {
                push(new Group(false, kids.pop()));
            }
        }.copy(root);
    }

    private AST() {}    // uninstantiable
}
