/*
 * @LICENSE@
 */

package org.rxfront.regex;

import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.PatternSyntaxException;

import org.rxfront.regex.AST.Node;
import org.rxfront.regex.Lowering.DotBehavior;
import org.rxfront.regex.Lowering.OpenRange;
import org.rxfront.regex.Lowering.QuestionOrientation;
import org.rxfront.regex.Lowering.UnsupportedConstructException;
import org.rxfront.regex.Misc.FlagMgr;

import static org.rxfront.regex.Misc.isSet;

/**
 * A parsed regular expression, and the entry point for lowering it to the
 * byte level {@link IR}. Instances are immutable and thread safe.
 * <p>
 * <strong>Syntax.</strong> Outside a character class the characters
 * <code>. \ ( ) [ * ? + $</code> are reserved; escape them with a backslash
 * to match them literally. <code>\|</code>, <code>\{</code>, <code>\}</code>,
 * <code>\]</code>, <code>\^</code> and <code>\-</code> are also accepted, as
 * are <code>\n</code>, <code>\t</code> and <code>\r</code>. Any other
 * character stands for itself.
 * <ul>
 * <li>A leading <code>^</code> and a trailing <code>$</code> anchor the
 * whole expression; they are reported by {@link #anchoring()}, not lowered.
 * A <code>$</code> anywhere else is a literal.</li>
 * <li><code>(X)</code> is a capturing group, numbered from 1 in order of its
 * opening parenthesis; <code>(?:X)</code> groups without capturing.</li>
 * <li><code>$(X)$</code> suppresses the output of <code>X</code>. It parses,
 * but does not lower.</li>
 * <li><code>[abc]</code>, <code>[a-z]</code> and <code>[^a-z]</code> are
 * character classes. Inside the brackets no character is special except a
 * leading <code>^</code>, a <code>-</code> between two characters and a
 * closing <code>]</code> which is not the first element. Reversed ranges such
 * as <code>[z-a]</code> are empty.</li>
 * <li><code>[:name:]</code> is one of the POSIX sets listed by
 * {@link PosixSet}.</li>
 * <li><code>*</code>, <code>+</code>, <code>?</code>, <code>{n}</code>,
 * <code>{n,}</code> and <code>{n,m}</code> are greedy quantifiers; each has a
 * lazy form with a trailing <code>?</code>, which parses but does not lower.
 * Bounds above 1000 are a syntax error.</li>
 * </ul>
 * <p>
 * <strong>Lowering.</strong> Code points are taken as bytes: a literal above
 * 255 cannot be lowered, and class members above 255 are ignored. The empty
 * language (e.g. <code>a{3,1}</code>) lowers to <code>null</code>.
 */
public final class Pattern {

    private static final Logger logger = Logger.getLogger("org.rxfront.regex");
    private static final Level level = Level.FINEST;

    private static final FlagMgr flagMgr = new FlagMgr();

    /**
     * Lowers <code>X?</code> to <code>(()|X)</code> instead of the default
     * <code>(X|())</code>.
     */
    public static final int EMPTY_FIRST = flagMgr.next("EMPTY_FIRST");

    /**
     * Lowers <code>.</code> to the literal byte <code>'.'</code> instead of the
     * alternation of all bytes. Useful when the consumer prints the result
     * for a tool with a wildcard of its own.
     */
    public static final int DUMMY_DOT = flagMgr.next("DUMMY_DOT");

    /**
     * Lowers <code>X{n,}</code> to exactly <code>n</code> copies of
     * <code>X</code>, and <code>X{0,}</code> to the empty language, as older
     * front ends did. This is a nonstandard flag: without it
     * <code>X{n,}</code> means <code>n</code> or more.
     */
    public static final int X_TRUNCATE_OPEN_RANGES = flagMgr.next("X_TRUNCATE_OPEN_RANGES");

    /**
     * Treats every group as non-capturing. {@link #groupCount()} is then zero
     * and the lowered tree has no capture groups.
     */
    public static final int X_STRIP_CG = flagMgr.next("X_STRIP_CG");

    static final int FLAG_COUNT =
            flagMgr.setImplemented(
                EMPTY_FIRST | DUMMY_DOT | X_TRUNCATE_OPEN_RANGES | X_STRIP_CG).freezeAndCount();

    final String regex;
    final int flags;
    final int ncg;
    private final Anchoring anchoring;
    private final Node root;

    private Pattern(String regex, int flags, RegexParser.Result r) {
        flagMgr.check(flags);
        this.regex = regex;
        logger.log(level, "regex: " + regex);
        this.flags = flags;
        logger.log(level, "flags: " + flagMgr.stringFrom(flags));
        this.anchoring = r.anchoring;
        if (isSet(flags, X_STRIP_CG)) {
            this.root = AST.stripCaptureGroups(r.root);
            this.ncg = 0;
        } else {
            this.root = r.root;
            this.ncg = r.ncg;
        }
        logger.log(level, "ncg: " + ncg);
        if (logger.isLoggable(level)) {
            logger.log(level, "ast:" + Misc.LS + root.toTreeString());
        }
    }

    /**
     * @throws PatternSyntaxException
     *             if <code>regex</code> is malformed; the index is the point
     *             of failure.
     */
    public static Pattern compile(String regex) {
        return compile(regex, 0);
    }

    /**
     * @param flags
     *            a bitwise or of the flags declared here.
     * @throws IllegalArgumentException
     *             for an unknown flag.
     * @throws PatternSyntaxException
     *             if <code>regex</code> is malformed.
     */
    public static Pattern compile(String regex, int flags) {
        RegexParser.Result result = new RegexParser().parse(regex);
        return new Pattern(regex, flags, result);
    }

    /**
     * For testability: a Pattern around an already built tree.
     */
    static Pattern fromNode(Node root, Anchoring anchoring, int flags) {
        return new Pattern(root.toString(), flags, new RegexParser.Result(anchoring,
            root, 0));
    }

    /**
     * Lowers this pattern with the options its flags select. Each call builds
     * a fresh tree.
     *
     * @return the lowered tree, or <code>null</code> if this pattern denotes
     *         the empty language.
     * @throws UnsupportedOperationException
     *             if the pattern holds a lazy quantifier or a suppression.
     * @throws IllegalArgumentException
     *             if the pattern holds a literal above 255.
     */
    public IR lower() {
        try {
            return Lowering.lower(root,
                isSet(flags, EMPTY_FIRST)
                        ? QuestionOrientation.EMPTY_FIRST
                        : QuestionOrientation.EMPTY_LAST,
                isSet(flags, DUMMY_DOT)
                        ? DotBehavior.DUMMY_DOT
                        : DotBehavior.BALANCED_TREE,
                isSet(flags, X_TRUNCATE_OPEN_RANGES)
                        ? OpenRange.TRUNCATE
                        : OpenRange.UNBOUNDED);
        } catch (UnsupportedConstructException e) {
            throw new UnsupportedOperationException(
                "cannot lower /" + regex + "/: " + e.getMessage(), e);
        }
    }

    public Anchoring anchoring() {
        return anchoring;
    }

    /**
     * @return the number of capturing groups; lowered group ids run from 1 to
     *         this value.
     */
    public int groupCount() {
        return ncg;
    }

    public int flags() {
        return flags;
    }

    Node root() {
        return root;
    }

    public String pattern() {
        return regex;
    }

    @Override
    public String toString() {
        return regex;
    }
}
