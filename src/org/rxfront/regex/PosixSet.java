/*
 * @LICENSE@
 */
package org.rxfront.regex;

import java.util.HashMap;
import java.util.Map;

/**
 * The POSIX named character classes, written <code>[:name:]</code> in a regex.
 * Membership is a fixed table over ASCII; nothing here depends on the locale.
 */
public enum PosixSet {

    ALNUM("alnum"),
    ALPHA("alpha"),
    ASCII("ascii"),
    BLANK("blank"),
    CNTRL("cntrl"),
    DIGIT("digit"),
    GRAPH("graph"),
    LOWER("lower"),
    PRINT("print"),
    PUNCT("punct"),
    SPACE("space"),
    UPPER("upper"),
    WORD("word"),
    XDIGIT("xdigit");

    /**
     * The spelling between <code>[:</code> and <code>:]</code>.
     */
    public final String spelling;

    private CharClass cc;

    PosixSet(String spelling) {
        this.spelling = spelling;
    }

    private static final Map<String, PosixSet> bySpelling =
            new HashMap<String, PosixSet>();

    static {
        for (PosixSet ps : values()) {
            bySpelling.put(ps.spelling, ps);
        }

        CharClass.Builder ccb = new CharClass.Builder();
        LOWER.cc = ccb.add('a', 'z').build();
        UPPER.cc = new CharClass.Builder().add('A', 'Z').build();
        DIGIT.cc = new CharClass.Builder().add('0', '9').build();
        ALPHA.cc = new CharClass.Builder(LOWER.cc).add(UPPER.cc).build();
        ALNUM.cc = new CharClass.Builder(ALPHA.cc).add(DIGIT.cc).build();
        WORD.cc = new CharClass.Builder(ALNUM.cc).add('_').build();
        XDIGIT.cc = new CharClass.Builder(DIGIT.cc)
            .add('a', 'f').add('A', 'F')
            .build();
        ASCII.cc = new CharClass.Builder().add(0x00, 0x7F).build();
        BLANK.cc = new CharClass.Builder().add(' ').add('\t').build();
        CNTRL.cc = new CharClass.Builder().add(0x00, 0x1F).add(0x7F).build();
        SPACE.cc = new CharClass.Builder()
            .add(' ').add('\t').add('\n').add(0x0B).add('\f').add('\r')
            .build();
        ccb = new CharClass.Builder();
        for (char c : "!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~".toCharArray()) {
            ccb.add(c);
        }
        PUNCT.cc = ccb.build();
        GRAPH.cc = new CharClass.Builder(ALNUM.cc).add(PUNCT.cc).build();
        PRINT.cc = new CharClass.Builder(GRAPH.cc).add(' ').build();
    }

    /**
     * @return the members of this set, in normal form.
     */
    CharClass charClass() {
        return cc;
    }

    /**
     * @param spelling
     *            the name as written in the regex, e.g. <code>"xdigit"</code>
     * @return the matching set, or <code>null</code> if there is none.
     */
    public static PosixSet forName(String spelling) {
        return bySpelling.get(spelling);
    }
}
