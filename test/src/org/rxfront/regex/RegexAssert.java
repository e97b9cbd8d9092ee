/*@LICENSE@
 */

package org.rxfront.regex;

import static junit.framework.Assert.*;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.PatternSyntaxException;

/**
 * @author ndw
 *
 */
public final class RegexAssert {

    private RegexAssert() {}   // not instantiable.

    /*
     * syntax errors
     */
    public static PatternSyntaxException assertSyntaxError(String regex) {
        try {
            Pattern p = Pattern.compile(regex);
            fail("should throw: /" + regex + "/ parsed as " + p.root());
            return null;
        } catch (PatternSyntaxException e) {
            assertEquals(regex, e.getPattern());
            return e;
        }
    }

    public static void assertSyntaxError(String regex, int index) {
        PatternSyntaxException e = assertSyntaxError(regex);
        assertEquals("index for /" + regex + "/: " + e.getMessage(),
            index, e.getIndex());
    }

    /*
     * lowering
     */
    public static void assertLowers(String expected, String regex) {
        assertLowers(expected, regex, 0);
    }

    public static void assertLowers(String expected, String regex, int flags) {
        IR ir = Pattern.compile(regex, flags).lower();
        assertNotNull("/" + regex + "/ lowered to the empty language", ir);
        assertEquals(expected, ir.toString());
    }

    public static void assertEmptyLanguage(String regex) {
        assertEmptyLanguage(regex, 0);
    }

    public static void assertEmptyLanguage(String regex, int flags) {
        IR ir = Pattern.compile(regex, flags).lower();
        assertNull("/" + regex + "/ lowered to " + ir, ir);
    }

    public static void assertUnsupported(String regex) {
        Pattern p = Pattern.compile(regex);
        try {
            p.lower();
            fail("should not lower: /" + regex + "/");
        } catch (UnsupportedOperationException e) {
            assertTrue(e.getMessage(), e.getMessage().contains(regex));
        }
    }

    /*
     * IR inspection
     */

    /**
     * The leaves of a tree of {@link IR.Alt} nodes, in order.
     */
    public static List<IR> alternatives(IR ir) {
        List<IR> ret = new ArrayList<IR>();
        collectAlternatives(ir, ret);
        return ret;
    }

    private static void collectAlternatives(IR ir, List<IR> acc) {
        if (ir instanceof IR.Alt) {
            collectAlternatives(((IR.Alt) ir).first, acc);
            collectAlternatives(((IR.Alt) ir).second, acc);
        } else {
            acc.add(ir);
        }
    }

    /**
     * Checks <code>ir</code> is a balanced alternation of exactly the bytes
     * of <code>members</code>, in ascending order.
     */
    public static void assertByteAlternation(String members, IR ir) {
        List<IR> alts = alternatives(ir);
        assertEquals(ir.toString(), members.length(), alts.size());
        for (int i = 0; i < members.length(); ++i) {
            assertEquals(IR.oneByte(members.charAt(i)), alts.get(i));
        }
        assertBalanced(ir, members.length());
    }

    /**
     * Depth of an alternation of <code>n</code> leaves is at most
     * ceil(log2(n)) alternation levels plus the leaf.
     */
    public static void assertBalanced(IR ir, int n) {
        int levels = 0;
        while ((1 << levels) < n) {
            ++levels;
        }
        assertTrue("depth " + ir.depth() + " for " + n + " leaves",
            ir.depth() <= levels + 1);
    }
}
