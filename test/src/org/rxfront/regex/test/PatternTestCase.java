/*@LICENSE@
 */
package org.rxfront.regex.test;

import java.util.regex.PatternSyntaxException;

import org.rxfront.regex.AbstractRxTestCase;
import org.rxfront.regex.Anchoring;
import org.rxfront.regex.IR;
import org.rxfront.regex.Pattern;

import static org.rxfront.regex.RegexAssert.*;

public class PatternTestCase extends AbstractRxTestCase {

    public PatternTestCase(String name) {
        super(name);
    }

    public void testAnchoredAlternation() {
        Pattern p = Pattern.compile("^ab|c$");
        assertEquals(Anchoring.BOTH, p.anchoring());
        assertEquals("(ab|c)", p.lower().toString());
        assertEquals("^ab|c$", p.pattern());
        assertEquals("^ab|c$", p.toString());
    }

    public void testDocumentedExample() {
        Pattern p = Pattern.compile("^(ab|c)+$");
        assertEquals(Anchoring.BOTH, p.anchoring());
        assertEquals(1, p.groupCount());
        assertEquals("(:1 (ab|c))(:1 (ab|c))*", p.lower().toString());
        assertTrue(treeOf(p), treeOf(p).startsWith("+"));
    }

    public void testCharClassScenario() {
        assertLowers("(a|(b|c))", "[a-c]");
    }

    public void testBoundedRangeScenario() {
        assertLowers("aa(a|())", "a{2,3}");
        IR ir = Pattern.compile("a{2,3}").lower();
        assertTrue(ir instanceof IR.Cat);
        IR.Cat cat = (IR.Cat) ir;
        assertEquals(IR.seq(IR.oneByte('a'), IR.oneByte('a')), cat.first);
        assertEquals(IR.alt(IR.oneByte('a'), IR.one()), cat.second);
    }

    public void testQuestionScenario() {
        assertLowers("(()|(:1 a))", "(a)?", Pattern.EMPTY_FIRST);
        assertLowers("((:1 a)|())", "(a)?");

        IR ir = Pattern.compile("(a)?", Pattern.EMPTY_FIRST).lower();
        IR.Alt alt = (IR.Alt) ir;
        assertEquals(IR.one(), alt.first);
        assertEquals(1, ((IR.CG) alt.second).id);
    }

    public void testUnterminatedGroupScenario() {
        assertSyntaxError("(a", 0);
        try {
            Pattern.compile("(a");
            fail("should throw");
        } catch (PatternSyntaxException e) {
            logger.log(level, e.getMessage());
            assertTrue(e.getMessage().contains("unclosed group"));
        }
    }

    public void testEmptyLanguage() {
        assertEmptyLanguage("a{3,1}");
        assertEmptyLanguage("a{0}");
        assertEmptyLanguage("a{0,0}");
        assertEmptyLanguage("b[z-a]");
        assertEmptyLanguage("a{0,}", Pattern.X_TRUNCATE_OPEN_RANGES);
        assertLowers("b", "a{3,1}|b");
    }

    public void testRepeatedGroupKeepsId() {
        assertLowers("(:1 a)(:1 a)", "(a){2}");
        assertLowers("(:1 a)(:1 a)(:2 b)", "(a){2}(b)");
    }

    public void testOpenRanges() {
        assertLowers("aaa*", "a{2,}");
        assertLowers("a*", "a{0,}");
        assertLowers("aa", "a{2,}", Pattern.X_TRUNCATE_OPEN_RANGES);
    }

    public void testDummyDot() {
        assertLowers("a\\.b", "a.b", Pattern.DUMMY_DOT);
        IR ir = Pattern.compile(".").lower();
        assertEquals(256, alternatives(ir).size());
    }

    public void testStripCaptureGroups() {
        Pattern p = Pattern.compile("((a)b)(c)");
        assertEquals(3, p.groupCount());

        p = Pattern.compile("((a)b)(c)", Pattern.X_STRIP_CG);
        assertEquals(0, p.groupCount());
        assertEquals("abc", p.lower().toString());
        assertEquals(Pattern.X_STRIP_CG, p.flags());
    }

    public void testCombinedFlags() {
        int flags = Pattern.EMPTY_FIRST | Pattern.X_STRIP_CG;
        assertLowers("(()|a)", "(a)?", flags);
        assertEquals(flags, Pattern.compile("x", flags).flags());
    }

    public void testUnknownFlags() {
        try {
            Pattern.compile("a", 1 << 20);
            fail("should throw");
        } catch (IllegalArgumentException e) {
        }
    }

    public void testUnsupportedConstructs() {
        assertUnsupported("a*?");
        assertUnsupported("a+?");
        assertUnsupported("a??");
        assertUnsupported("a{1,2}?");
        assertUnsupported("a$(b)$c");
        // parsing them is fine
        assertEquals(0, Pattern.compile("$(a*?)$").groupCount());
    }

    public void testLiteralAboveByte() {
        Pattern p = Pattern.compile("a\u20ac");
        try {
            p.lower();
            fail("should throw");
        } catch (IllegalArgumentException e) {
        }
    }

    public void testSyntaxErrorIndexes() {
        assertSyntaxError("a)", 1);
        assertSyntaxError("[abc", 0);
        assertSyntaxError("a{2,x}", 4);
        assertSyntaxError("x[:bogus:]", 1);
        assertSyntaxError("\\k", 0);
        assertSyntaxError("a|*", 2);
    }

    public void testNullRegex() {
        try {
            Pattern.compile(null);
            fail("should throw");
        } catch (NullPointerException e) {
        }
    }

    public void testLowerIsRepeatable() {
        Pattern p = Pattern.compile("(a|b)[0-9]?");
        IR first = p.lower();
        IR second = p.lower();
        assertNotSame(first, second);
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }
}
