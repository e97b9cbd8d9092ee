/* @LICENSE@
 */

package org.rxfront.regex;

import java.util.regex.PatternSyntaxException;

import org.rxfront.regex.AST.Node;
import org.rxfront.regex.AST.Quantifier.Mood;
import org.rxfront.regex.AST.Range;
import org.rxfront.regex.CharClass.Interval;

import static org.rxfront.regex.AST.*;
import static org.rxfront.regex.RegexAssert.*;

public class RegexParserTestCase extends AbstractRxTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(RegexParserTestCase.class);
    }

    public RegexParserTestCase(String name) {
        super(name);
    }

    private static void assertParse(Node expected, String regex) {
        assertEquals(expected, parse(regex).root);
    }

    private static void assertAnchoring(Anchoring expected, String regex) {
        assertEquals(regex, expected, parse(regex).anchoring);
    }

    private static Interval iv(char c) {
        return new Interval(c);
    }

    private static Interval iv(char first, char last) {
        return new Interval(first, last);
    }

    public void testAnchoring() {
        RegexParser.Result r = parse("^ab|c$");
        assertEquals(Anchoring.BOTH, r.anchoring);
        assertEquals(alt(literal("ab"), literal('c')), r.root);

        assertAnchoring(Anchoring.NONE, "abc");
        assertAnchoring(Anchoring.START, "^abc");
        assertAnchoring(Anchoring.END, "abc$");
        assertAnchoring(Anchoring.NONE, "");
        assertAnchoring(Anchoring.START, "^");
        assertAnchoring(Anchoring.END, "$");
        assertAnchoring(Anchoring.BOTH, "^$");
        assertAnchoring(Anchoring.NONE, "abc\\$");
        assertAnchoring(Anchoring.END, "(a|b)$");

        assertParse(one(), "^$");
        assertParse(literal("abc"), "^abc$");
    }

    public void testAnchorCharsElsewhereAreLiteral() {
        assertParse(literal("a^b"), "a^b");
        assertParse(literal("a$b"), "a$b");
        assertParse(cat(literal('^'), literal('a')), "^^a");
        assertParse(star(literal('$')), "$*");
        assertAnchoring(Anchoring.NONE, "a$b");
    }

    public void testPrecedence() {
        assertParse(cat(literal('a'), literal('b'), literal('c')), "abc");
        assertParse(alt(literal("ab"), literal("cd"), literal('e')), "ab|cd|e");
        assertParse(cat(literal('a'), star(literal('b'))), "ab*");
        assertParse(alt(literal('a'), literal('b')), "a|b");
        assertParse(star(captureGroup(literal("ab"))), "(ab)*");
    }

    public void testRightAssociative() {
        Node root = parse("a|b|c").root;
        assertTrue(root instanceof Alt);
        assertEquals(literal('a'), ((Alt) root).first);
        assertEquals(alt(literal('b'), literal('c')), ((Alt) root).second);

        root = parse("abc").root;
        assertTrue(root instanceof Cat);
        assertEquals(literal('a'), ((Cat) root).first);
        assertEquals(literal("bc"), ((Cat) root).second);
    }

    public void testEmptyAlternatives() {
        assertParse(alt(literal('a'), one()), "a|");
        assertParse(alt(one(), literal('a')), "|a");
        assertParse(alt(one(), one()), "|");
        assertParse(captureGroup(one()), "()");
        assertParse(captureGroup(alt(literal('a'), one())), "(a|)");
    }

    public void testQuantifiers() {
        Node a = literal('a');
        assertParse(star(a), "a*");
        assertParse(plus(a), "a+");
        assertParse(question(a), "a?");
        assertParse(range(a, 2, 2), "a{2}");
        assertParse(range(a, 2, Range.UNBOUNDED), "a{2,}");
        assertParse(range(a, 2, 5), "a{2,5}");
        assertParse(range(a, 0, 0), "a{0}");
        assertParse(range(a, 3, 1), "a{3,1}");
        assertParse(range(a, 12, 345), "a{12,345}");
        assertParse(range(a, 0, RegexParser.MAX_BOUND), "a{0,1000}");
        assertParse(range(a, RegexParser.MAX_BOUND, Range.UNBOUNDED), "a{1000,}");
    }

    public void testLazyQuantifiers() {
        Node a = literal('a');
        assertParse(star(a, Mood.LAZY), "a*?");
        assertParse(plus(a, Mood.LAZY), "a+?");
        assertParse(question(a, Mood.LAZY), "a??");
        assertParse(range(a, 2, 5, Mood.LAZY), "a{2,5}?");
        assertParse(range(a, 2, Range.UNBOUNDED, Mood.LAZY), "a{2,}?");
        assertParse(cat(star(a, Mood.LAZY), literal('b')), "a*?b");

        assertFalse(star(a).equals(star(a, Mood.LAZY)));
    }

    public void testOneQuantifierPerAtom() {
        assertSyntaxError("a**", 2);
        assertSyntaxError("a*??", 3);
        assertSyntaxError("a{2}*", 4);
        assertSyntaxError("*a", 0);
        assertSyntaxError("a|+", 2);
        assertSyntaxError("(?:*)", 3);
        assertParse(star(captureGroup(star(literal('a')))), "(a*)*");
    }

    public void testRepetitionBoundErrors() {
        assertSyntaxError("a{", 2);
        assertSyntaxError("a{}", 2);
        assertSyntaxError("a{x}", 2);
        assertSyntaxError("a{2", 1);
        assertSyntaxError("a{2,", 4);
        assertSyntaxError("a{2,5", 1);
        assertSyntaxError("a{2x}", 3);
        assertSyntaxError("a{2,x}", 4);
        assertSyntaxError("a{2,5x}", 5);
        assertSyntaxError("a{,5}", 2);
        assertSyntaxError("a{9876543210}", 2);
        assertSyntaxError("a{1,2147483648}", 4);
        assertSyntaxError("a{0,1001}", 4);
        assertSyntaxError("a{1001}", 2);
        assertSyntaxError("a{0,2147483647}", 4);
    }

    public void testBracesWithoutAtomAreLiteral() {
        assertParse(literal("{a}"), "{a}");
        assertParse(literal("a}"), "a}");
    }

    public void testGroups() {
        assertParse(star(group(false, alt(literal('a'), literal('b')))), "(?:a|b)*");
        assertParse(captureGroup(cat(captureGroup(literal('a')), literal('b'))), "((a)b)");
        assertParse(cat(captureGroup(literal('a')), captureGroup(literal('b'))), "(a)(b)");

        assertEquals(2, parse("((a)b)").ncg);
        assertEquals(2, parse("(a)(b)").ncg);
        assertEquals(0, parse("(?:a)").ncg);
        assertEquals(1, parse("(?:(a))").ncg);
        assertEquals(0, parse("\\(a\\)").ncg);
        assertEquals(3, parse("(a(b)(c))").ncg);
    }

    public void testUnbalancedParens() {
        assertSyntaxError("(a", 0);
        assertSyntaxError("a(b|c", 1);
        assertSyntaxError("((a)", 0);
        assertSyntaxError("a)", 1);
        assertSyntaxError("(a))", 3);
        assertSyntaxError("(a)*)b", 4);
        assertSyntaxError(")", 0);
        assertSyntaxError("(?x)", 2);
        assertSyntaxError("(?", 2);
        assertSyntaxError("(a$", 0);
    }

    public void testUnclosedGroupMessage() {
        PatternSyntaxException e = assertSyntaxError("(a");
        assertTrue(e.getDescription(), e.getDescription().contains("unclosed group"));
        assertEquals(0, e.getIndex());
        assertEquals("(a", e.getPattern());
    }

    public void testCharClasses() {
        assertParse(charClass(true, iv('a'), iv('b'), iv('c')), "[abc]");
        assertParse(charClass(false, iv('a', 'z')), "[^a-z]");
        assertParse(charClass(true, iv('a', 'z'), iv('0', '9'), iv('_')), "[a-z0-9_]");
        assertParse(charClass(true, iv(']'), iv('a')), "[]a]");
        assertParse(charClass(false, iv(']')), "[^]]");
        assertParse(charClass(true, iv('a'), iv('-')), "[a-]");
        assertParse(charClass(true, iv('-'), iv('a')), "[-a]");
        assertParse(charClass(true, iv('z', 'a')), "[z-a]");
        assertParse(charClass(false, iv('^')), "[^^]");
        assertParse(charClass(true, iv('.'), iv('*'), iv('('), iv('$')), "[.*($]");
        assertParse(charClass(true, iv('\\')), "[\\]");
        assertParse(charClass(true, iv('a'), iv('^')), "[a^]");
        assertParse(plus(charClass(true, iv('0', '9'))), "[0-9]+");
    }

    public void testCharClassKeepsSourceOrder() {
        Node root = parse("[za-cb]").root;
        assertEquals(3, ((Cls) root).ranges.size());
        assertEquals(iv('z'), ((Cls) root).ranges.get(0));
        assertEquals(iv('a', 'c'), ((Cls) root).ranges.get(1));
        assertEquals(iv('b'), ((Cls) root).ranges.get(2));
    }

    public void testCharClassErrors() {
        assertSyntaxError("[]", 0);
        assertSyntaxError("[^]", 0);
        assertSyntaxError("[", 0);
        assertSyntaxError("[^", 0);
        assertSyntaxError("[a", 0);
        assertSyntaxError("x[a-", 1);
        assertSyntaxError("x[a-z", 1);
    }

    public void testNamedSets() {
        assertParse(namedSet(true, PosixSet.DIGIT), "[:digit:]");
        assertParse(plus(namedSet(true, PosixSet.ALPHA)), "[:alpha:]+");
        assertParse(cat(literal('x'), namedSet(true, PosixSet.XDIGIT)), "x[:xdigit:]");
        for (PosixSet ps : PosixSet.values()) {
            assertParse(namedSet(true, ps), "[:" + ps.spelling + ":]");
        }
    }

    public void testNamedSetLookalikes() {
        // not letters followed by ":]", so an ordinary class
        assertParse(charClass(true, iv(':'), iv('a')), "[:a]");
        assertParse(charClass(true, iv(':')), "[:]");
        assertParse(cat(charClass(true, iv(':')), literal(":]")), "[:]:]");
    }

    public void testUnknownNamedSet() {
        assertSyntaxError("[:foo:]", 0);
        assertSyntaxError("a[:Digit:]", 1);
        PatternSyntaxException e = assertSyntaxError("[:nope:]");
        assertTrue(e.getDescription(), e.getDescription().contains("nope"));
    }

    public void testEscapes() {
        assertParse(literal(".\\()[*?+$"), "\\.\\\\\\(\\)\\[\\*\\?\\+\\$");
        assertParse(literal("\n\t\r"), "\\n\\t\\r");
        assertParse(literal("|{}]^-"), "\\|\\{\\}\\]\\^\\-");
        assertParse(star(literal('*')), "\\**");
    }

    public void testEscapeErrors() {
        assertSyntaxError("\\q", 0);
        assertSyntaxError("ab\\d", 2);
        assertSyntaxError("a\\", 1);
        assertSyntaxError("\\", 0);
    }

    public void testLiterals() {
        assertParse(dot(), ".");
        assertParse(cat(literal('a'), dot(), literal('b')), "a.b");
        assertParse(literal('\u00e9'), "\u00e9");
        assertParse(literal('\u20ac'), "\u20ac");
        assertParse(literal("-]}^"), "-]}^");
    }

    public void testSuppress() {
        assertParse(suppress(literal('a')), "$(a)$");
        assertParse(suppress(alt(literal('a'), literal('b'))), "$(a|b)$");
        assertParse(suppress(one()), "$()$");
        assertParse(cat(literal('a'), suppress(literal('b')), literal('c')), "a$(b)$c");
        assertParse(literal("$x"), "$x");
        assertAnchoring(Anchoring.NONE, "$(a)$");
        assertAnchoring(Anchoring.END, "$(a)$$");
        assertEquals(1, parse("$((a))$").ncg);
    }

    public void testSuppressErrors() {
        assertSyntaxError("$(a", 0);
        assertSyntaxError("$(a)", 4);
        assertSyntaxError("$(a)b", 4);
        assertSyntaxError("x$(a|b", 1);
    }

    public void testToString() {
        String[] regexes = {
            "a(b|c)*d", "(?:a|b)+?", "[:alpha:]{2,}", "a\\.b", "[^a-z]",
            "x{3}", "x{3,5}?", "a|b|c", "$(ab)$", "(a|b)(c|d)", "a??",
        };
        for (String regex : regexes) {
            Node root = parse(regex).root;
            assertEquals(regex, root.toString());
            assertEquals(regex, root, parse(root.toString()).root);
        }
    }

    public void testToTreeString() {
        String tree = parse("(a|b)*").root.toTreeString();
        logger.log(level, "tree:" + Misc.LS + tree);
        String[] lines = tree.split(Misc.LS);
        assertEquals(5, lines.length);
        assertEquals("*", lines[0]);
        assertEquals("    cg", lines[1]);
        assertEquals("        |", lines[2]);
        assertEquals("            a", lines[3]);
        assertEquals("            b", lines[4]);
    }

    public void testNull() {
        try {
            parse(null);
            fail("should throw");
        } catch (NullPointerException e) {
        }
    }

    public void testStripCaptureGroups() {
        Node root = parse("((a)|(?:b))*").root;
        Node stripped = AST.stripCaptureGroups(root);
        assertEquals(parse("(?:(?:a)|(?:b))*").root, stripped);
        assertEquals("((a)|(?:b))*", root.toString());
    }
}
