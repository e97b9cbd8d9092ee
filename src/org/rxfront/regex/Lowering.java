/*
 * @LICENSE@
 */
package org.rxfront.regex;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.rxfront.regex.AST.Alt;
import org.rxfront.regex.AST.Binary;
import org.rxfront.regex.AST.Cat;
import org.rxfront.regex.AST.Chr;
import org.rxfront.regex.AST.Cls;
import org.rxfront.regex.AST.Dot;
import org.rxfront.regex.AST.Group;
import org.rxfront.regex.AST.NamedSet;
import org.rxfront.regex.AST.Node;
import org.rxfront.regex.AST.One;
import org.rxfront.regex.AST.Plus;
import org.rxfront.regex.AST.Quantifier;
import org.rxfront.regex.AST.Question;
import org.rxfront.regex.AST.Range;
import org.rxfront.regex.AST.Star;
import org.rxfront.regex.AST.Suppress;
import org.rxfront.regex.AST.Visitor;
import org.rxfront.regex.CharClass.Interval;

/**
 * Rewrites a surface {@link AST} into the byte level {@link IR}.
 * <p>
 * A <code>null</code> {@link IR} stands for the empty language throughout:
 * it is absorbing under sequence and the identity under alternation.
 * <p>
 * Capture groups are numbered from 1 in pre-order. A repeated group keeps
 * its number in every copy the unrolling makes, so <code>(a){2}</code> lowers
 * to <code>(:1 a)(:1 a)</code>.
 */
final class Lowering extends Visitor {

    private static final Logger logger = Logger.getLogger("org.rxfront.regex");
    private static final Level level = Level.FINEST;

    /**
     * Order of the two branches a greedy <code>?</code> lowers to.
     */
    enum QuestionOrientation {
        /** <code>(()|e)</code> */
        EMPTY_FIRST,
        /** <code>(e|())</code> */
        EMPTY_LAST;
    }

    enum DotBehavior {
        /** Any byte: the balanced alternation of all 256 of them. */
        BALANCED_TREE,
        /** The literal byte <code>'.'</code>. */
        DUMMY_DOT;
    }

    /**
     * What <code>e{n,}</code> lowers to.
     */
    enum OpenRange {
        /** <code>n-1</code> copies then <code>e+</code>; <code>e*</code> for n=0. */
        UNBOUNDED,
        /**
         * Exactly <code>n</code> copies; the empty language for n=0. Kept for
         * consumers which compare output with older tools.
         */
        TRUNCATE;
    }

    /**
     * Thrown for constructs which parse but have no byte level rewriting:
     * lazy quantifiers and suppression.
     */
    static final class UnsupportedConstructException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        UnsupportedConstructException(String msg) {
            super(msg);
        }
    }

    private final QuestionOrientation orientation;
    private final DotBehavior dotBehavior;
    private final OpenRange openRange;

    private int nextId = 1;     // next capture group id
    private IR result;          // of the most recent visit

    private Lowering(QuestionOrientation orientation, DotBehavior dotBehavior,
            OpenRange openRange) {
        super(TraversalOrder.SUBCLASS_DEFINED);
        if (orientation == null || dotBehavior == null || openRange == null) {
            throw new NullPointerException("option");
        }
        this.orientation = orientation;
        this.dotBehavior = dotBehavior;
        this.openRange = openRange;
    }

    /**
     * Lowers with open ranges meaning "or more".
     *
     * @return the lowered tree, or <code>null</code> if <code>root</code>
     *         denotes the empty language.
     * @throws UnsupportedConstructException
     *             if <code>root</code> holds a lazy quantifier or a
     *             suppression.
     * @throws IllegalArgumentException
     *             if a literal is outside the byte alphabet.
     */
    static IR lower(Node root, QuestionOrientation orientation,
            DotBehavior dotBehavior) {
        return lower(root, orientation, dotBehavior, OpenRange.UNBOUNDED);
    }

    static IR lower(Node root, QuestionOrientation orientation,
            DotBehavior dotBehavior, OpenRange openRange) {
        if (root == null) {
            throw new NullPointerException("root");
        }
        Lowering lowering = new Lowering(orientation, dotBehavior, openRange);
        IR ir = lowering.lower(root);
        if (logger.isLoggable(level)) {
            logger.log(level, "lowered " + root + " to "
                    + (ir == null ? "<empty language>" : ir.toString())
                    + ", " + (lowering.nextId - 1) + " capture group(s)");
        }
        return ir;
    }

    private IR lower(Node node) {
        visit(node);
        IR ir = result;
        result = null;
        return ir;
    }

    /*
     * null aware IR combinators
     */

    private static IR seq(IR first, IR second) {
        return first == null || second == null ? null : IR.seq(first, second);
    }

    private static IR alt(IR first, IR second) {
        if (first == null) {
            return second;
        } else if (second == null) {
            return first;
        }
        return IR.alt(first, second);
    }

    private IR optional(IR ir) {
        return orientation == QuestionOrientation.EMPTY_FIRST
                ? alt(IR.one(), ir)
                : alt(ir, IR.one());
    }

    private static IR star(IR ir) {
        return ir == null ? null : IR.star(ir);
    }

    private static IR plus(IR ir) {
        return ir == null ? null : IR.seq(ir, IR.star(ir));
    }

    /*
     * sequence of copies, folded to the left
     */
    private static IR repeat(IR acc, IR ir, int times) {
        for (int i = 0; i < times; ++i) {
            acc = acc == null ? ir : seq(acc, ir);
            if (acc == null) {
                break;
            }
        }
        return acc;
    }

    private static IR expand(CharClass cc) {
        CharClass bytes = cc.bytes();
        List<IR> alts = new ArrayList<IR>(bytes.size());
        for (Interval ci : bytes.intervals()) {
            for (int b = ci.first; b <= ci.last; ++b) {
                alts.add(IR.oneByte(b));
            }
        }
        return BalancedAlt.build(alts);
    }

    private static void checkGreedy(Quantifier node) {
        if (node.mood == Quantifier.Mood.LAZY) {
            throw new UnsupportedConstructException(
                "lazy quantifier cannot be lowered: " + node);
        }
    }

    /*
     * leaves
     */

    @Override
    protected void visit(One node) {
        result = IR.one();
    }

    @Override
    protected void visit(Dot node) {
        switch (dotBehavior) {
        case BALANCED_TREE:
            result = expand(CharClass.ALL_BYTES);
            break;
        case DUMMY_DOT:
            result = IR.oneByte('.');
            break;
        default:
            throw new AssertionError(dotBehavior);
        }
    }

    @Override
    protected void visit(Chr node) {
        result = IR.oneByte(node.c);
    }

    @Override
    protected void visit(Cls node) {
        CharClass cc = node.positive
                ? CharClass.normalize(node.ranges)
                : CharClass.complement(node.ranges);
        result = expand(cc);
    }

    @Override
    protected void visit(NamedSet node) {
        CharClass cc = node.set.charClass();
        result = expand(node.positive ? cc : cc.complement());
    }

    /*
     * non terminals
     */

    /*
     * Right leaning Cat and Alt spines are walked in a loop. Operands are
     * lowered left to right, so group ids stay in pre-order, then folded back
     * to the right.
     */
    @Override
    protected void visit(Cat node) {
        List<IR> operands = spine(node, Cat.class);
        IR acc = operands.get(operands.size() - 1);
        for (int i = operands.size() - 2; i >= 0; --i) {
            acc = seq(operands.get(i), acc);
        }
        result = acc;
    }

    @Override
    protected void visit(Alt node) {
        List<IR> operands = spine(node, Alt.class);
        IR acc = operands.get(operands.size() - 1);
        for (int i = operands.size() - 2; i >= 0; --i) {
            acc = alt(operands.get(i), acc);
        }
        result = acc;
    }

    private List<IR> spine(Binary node, Class<? extends Binary> kind) {
        List<IR> operands = new ArrayList<IR>();
        Node n = node;
        while (kind.isInstance(n)) {
            Binary b = (Binary) n;
            operands.add(lower(b.first));
            n = b.second;
        }
        operands.add(lower(n));
        return operands;
    }

    @Override
    protected void visit(Group node) {
        if (node.capturing) {
            int id = nextId++;
            IR body = lower(node.child);
            result = body == null ? null : IR.group(id, body);
        } else {
            result = lower(node.child);
        }
    }

    @Override
    protected void visit(Suppress node) {
        throw new UnsupportedConstructException(
            "suppression cannot be lowered: " + node);
    }

    @Override
    protected void visit(Star node) {
        checkGreedy(node);
        result = star(lower(node.child));
    }

    @Override
    protected void visit(Plus node) {
        checkGreedy(node);
        result = plus(lower(node.child));
    }

    @Override
    protected void visit(Question node) {
        checkGreedy(node);
        result = optional(lower(node.child));
    }

    /*
     * The body is lowered once; every copy is that same immutable tree, which
     * is what lowering each copy from the same counter state would give.
     */
    @Override
    protected void visit(Range node) {
        checkGreedy(node);
        int lower = node.lower;
        if (!node.isBounded()) {
            if (openRange == OpenRange.TRUNCATE) {
                result = lower == 0 ? null : repeat(null, lower(node.child), lower);
            } else if (lower == 0) {
                result = star(lower(node.child));
            } else {
                IR body = lower(node.child);
                result = lower == 1
                        ? plus(body)
                        : seq(repeat(null, body, lower - 1), plus(body));
            }
            return;
        }
        int upper = node.upper;
        if (upper < lower || upper == 0) {
            // unsatisfiable or zero width: nothing consumed, no ids spent
            result = null;
            return;
        }
        IR body = lower(node.child);
        IR acc = repeat(null, body, lower);
        if (lower > 0 && acc == null) {
            result = null;
            return;
        }
        result = repeat(acc, optional(body), upper - lower);
    }
}
