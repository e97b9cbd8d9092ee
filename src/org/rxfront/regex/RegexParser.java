/* @LICENSE@
 */

package org.rxfront.regex;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.PatternSyntaxException;

import org.rxfront.regex.AST.Node;
import org.rxfront.regex.AST.Quantifier;
import org.rxfront.regex.AST.Range;
import org.rxfront.regex.CharClass.Interval;

import static org.rxfront.regex.AST.*;

/**
 * Hand written recursive descent parser from regex text to the surface
 * {@link AST}. From tightest to loosest: one postfix quantifier per atom,
 * juxtaposition, then <code>|</code>. Both binary operators associate to the
 * right.
 * <p>
 * Instances are not thread safe, but they are cheap: use one per parse.
 */
final class RegexParser {

    static final class Result {
        Result(Anchoring anchoring, Node root, int ncg) {
            this.anchoring = anchoring;
            this.root = root;
            this.ncg = ncg;
        }
        final Anchoring anchoring;
        final Node root;
        final int ncg;
    }

    private static final int EOX = -1;  // end of expression
    private static final int BACKSLASH = 0x80000000;

    /*
     * chars which must be escaped to be literal outside a char class, and the
     * extra chars which may be
     */
    private static final String RESERVED = ".\\()[*?+$";
    private static final String ESCAPABLE = RESERVED + "|{}]^-";

    /*
     * largest repetition bound; lowering unrolls every copy
     */
    static final int MAX_BOUND = 1000;

    private String regex;

    /*
     * aux fields for parsing
     */
    private int ncg;        // capturing group count
    private int lowerQuant; // lower bound for quantification
    private int upperQuant; // etc.

    /*
     * state for nextToken() and pushbackToken()
     */
    private int token;      // bit 31 is set if escaped
    private int scannedInt;  // for bounds

    private void init() {
        ncg = 0;
        iNext = 0;
        iCurrent = -1;
        token = EOX;
    }

    /**
     * @throws PatternSyntaxException
     *             at the first point where <code>regex</code> cannot be
     *             parsed.
     */
    Result parse(String regex) {
        if (regex == null) {
            throw new NullPointerException("regex");
        }
        this.regex = regex;
        init();

        boolean start = false;
        boolean end = false;
        nextToken();
        if (token == '^') {
            start = true;
        } else {
            pushbackToken();
        }
        Node root = exp();
        if (token == '$') {
            assert !hasNextChar();
            end = true;
            nextToken();
        }
        switch(token) {
        case EOX:
            break;
        case ')':
            syntaxError("unmatched closing parenthesis");
            break;
        default:
            throw new AssertionError("unexpected char at end of regex: " + (char) token);
        }
        return new Result(Anchoring.of(start, end), root, ncg);
    }

    /*
     * alternatives, folded to the right
     */
    private Node exp() {
        List<Node> alts = new ArrayList<Node>(2);
        alts.add(term());
        while (token == '|') {
            alts.add(term());
        }
        return alt(alts);
    }

    /*
     * juxtaposed factors, folded to the right. Returns with the terminating
     * token (end, '|', ')' or the end anchor) current.
     */
    private Node term() {
        List<Node> factors = new ArrayList<Node>();
        loop:
        while (true) {
            nextToken();
            Node node;
            switch(token) {
            case EOX:
            case ')':
            case '|':
                break loop;
            case '(':
                node = parseGroup();
                break;
            case '$':
                if (!hasNextChar()) {
                    break loop;             // end anchor
                }
                node = peekRaw() == '(' ? parseSuppress() : literal('$');
                break;
            case '[':
                node = parseBracket();
                break;
            case '.':
                node = dot();
                break;
            case '*':
            case '+':
            case '?':
                syntaxError("dangling quantifier '" + (char) token + "'");
                return null;
            default:
                node = literal(scanLiteral());
                break;
            }
            factors.add(maybeQuantify(node));
        }
        return factors.isEmpty() ? one() : cat(factors);
    }

    private Node parseGroup() {
        int open = iCurrent;
        boolean capturing = true;
        nextToken();
        if (token == '?') {
            nextToken();
            if (token != ':') {
                syntaxError("expected ':' after \"(?\"");
            }
            capturing = false;
        } else {
            pushbackToken();
        }
        if (capturing) {
            ++ncg;      // pre-order, before the body
        }
        Node body = exp();
        if (token != ')') {
            syntaxError("unclosed group", open);
        }
        return group(capturing, body);
    }

    private Node parseSuppress() {
        int open = iCurrent;
        nextRawChar();
        assert token == '(';
        Node body = exp();
        if (token != ')') {
            syntaxError("unclosed suppression", open);
        }
        if (peekRaw() != '$') {
            syntaxError("expected '$' closing suppression", iNext);
        }
        nextRawChar();
        return suppress(body);
    }

    /*
     * '[' has been consumed: either a POSIX named set or a char class.
     */
    private Node parseBracket() {
        int open = iCurrent;
        if (peekRaw() == ':') {
            int i = iNext + 1;
            while (i < regex.length() && isAsciiLetter(regex.charAt(i))) {
                ++i;
            }
            if (i > iNext + 1 && regex.startsWith(":]", i)) {
                String name = regex.substring(iNext + 1, i);
                PosixSet set = PosixSet.forName(name);
                if (set == null) {
                    syntaxError("unknown POSIX class [:" + name + ":]", open);
                }
                iNext = i + 2;
                return namedSet(true, set);
            }
        }
        return parseCharClass(open);
    }

    /*
     * No escapes in here: every char stands for itself. The first element may
     * be ']'.
     */
    private Node parseCharClass(int open) {
        List<Interval> ranges = new ArrayList<Interval>(4);
        boolean positive = true;
        if (!nextRawChar()) {
            syntaxError("unclosed character class", open);
        }
        if (token == '^') {
            positive = false;
            if (!nextRawChar()) {
                syntaxError("unclosed character class", open);
            }
        }
        boolean first = true;
        while (first || token != ']') {
            first = false;
            int c = token;
            if (peekRaw() == '-' && iNext + 1 < regex.length()
                    && regex.charAt(iNext + 1) != ']') {
                nextRawChar();
                nextRawChar();
                ranges.add(new Interval(c, token));     // may be reversed
            } else {
                ranges.add(new Interval(c));
            }
            if (!nextRawChar()) {
                syntaxError("unclosed character class", open);
            }
        }
        return charClass(positive, ranges);
    }

    private Node maybeQuantify(Node node) {
        nextToken();
        switch(token) {
        case '*':
            node = star(node, maybeLazy());
            break;
        case '+':
            node = plus(node, maybeLazy());
            break;
        case '?':
            node = question(node, maybeLazy());
            break;
        case '{':
            parseQuant();
            node = range(node, lowerQuant, upperQuant, maybeLazy());
            break;
        default:
            pushbackToken();
        }
        return node;
    }

    /*
     * a '?' directly after a quantifier always makes it lazy, so "*?" is
     * never read as '*' followed by a dangling '?'
     */
    private Quantifier.Mood maybeLazy() {
        nextToken();
        if (token == '?') {
            return Quantifier.Mood.LAZY;
        }
        pushbackToken();
        return Quantifier.Mood.GREEDY;
    }

    /*
     * {n}, {n,} or {n,m}; the '{' has been consumed
     */
    private void parseQuant() {
        int open = iCurrent;
        lowerQuant = upperQuant = scanBound();
        if (!nextRawChar()) {
            syntaxError("unclosed repetition bound", open);
        }
        if (token == '}') {
            return;
        }
        if (token != ',') {
            iCurrent = iNext - 1;
            syntaxError("expected ',' or '}' in repetition bound");
        }
        if (peekRaw() == '}') {
            nextRawChar();
            upperQuant = Range.UNBOUNDED;
            return;
        }
        upperQuant = scanBound();
        if (!nextRawChar()) {
            syntaxError("unclosed repetition bound", open);
        }
        if (token != '}') {
            iCurrent = iNext - 1;
            syntaxError("expected '}' in repetition bound");
        }
    }

    private int scanBound() {
        int begin = iNext;
        scanDecimal();
        if (scannedInt == -1) {
            syntaxError("expected digit in repetition bound", begin);
        } else if (scannedInt == -2 || scannedInt > MAX_BOUND) {
            syntaxError("repetition bound too large", begin);
        }
        return scannedInt;
    }

    /*
     * char scanner stuff
     */

    private int iNext;

    private boolean hasNextChar() {
        return iNext < regex.length();
    }

    private int peekRaw() {
        return hasNextChar() ? regex.charAt(iNext) : EOX;
    }

    private boolean nextRawChar() {
        if (hasNextChar()) {
            token = regex.charAt(iNext++);
            return true;
        } else {
            return false;
        }
    }

    private void pushbackRaw() {
        --iNext;
    }

    private int iCurrent;

    private void nextToken() {
        iCurrent = iNext;
        if (nextRawChar()) {
            if (token == '\\') {
                if (nextRawChar()) {
                    token |= BACKSLASH;
                } else {
                    token = BACKSLASH;  // nothing left to escape
                }
            }
        } else {
            token = EOX;
        }
    }

    private void pushbackToken() {
        iNext = iCurrent;
    }

    private static boolean isAsciiLetter(char c) {
        return ('a' <= c && c <= 'z') || ('A' <= c && c <= 'Z');
    }

    private boolean scanDigit() {
        if (!nextRawChar()) {
            return false;
        }
        if ('0' <= token && token <= '9') {
            int d = token - '0';
            if (scannedInt >= 0) {
                if (scannedInt > (Integer.MAX_VALUE - d) / 10) {
                    scannedInt = -2;                // overflow, keep scanning
                } else {
                    scannedInt = scannedInt * 10 + d;
                }
            }
            return true;
        } else {
            pushbackRaw();
            return false;
        }
    }

    /*
     * leaves -1 in scannedInt if there are no digits, -2 on overflow
     */
    private void scanDecimal() {
        scannedInt = 0;
        int digits = 0;
        while(scanDigit()) ++digits;
        if (digits == 0) {
            scannedInt = -1;
        }
    }

    /*
     * the current token as a literal char, resolving escapes
     */
    private char scanLiteral() {
        if ((BACKSLASH & token) == 0) {
            assert RESERVED.indexOf(token) == -1 : (char) token;
            return (char) token;
        }
        switch(token) {
        case BACKSLASH:
            syntaxError("trailing backslash");
            return 0;
        case BACKSLASH | 'n':
            return '\n';
        case BACKSLASH | 't':
            return '\t';
        case BACKSLASH | 'r':
            return '\r';
        default:
            char c = (char) token;
            if (ESCAPABLE.indexOf(c) == -1) {
                syntaxError("illegal escape sequence \\" + c);
            }
            return c;
        }
    }

    private void syntaxError(String msg) {
        syntaxError(msg, iCurrent);
    }

    private void syntaxError(String msg, int index) {
        throw new PatternSyntaxException(msg, regex, index);
    }
}
