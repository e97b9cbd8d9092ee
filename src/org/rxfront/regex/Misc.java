/*
 * @LICENSE@
 */

package org.rxfront.regex;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Small static helpers shared by the parser, the printers and the
 * {@link Pattern} flags.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    static final String LS = System.getProperty("line.separator");

    static boolean isSet(int flags, int flag) {
        return (flags & flag) != 0;
    }

    /**
     * Hands out single bit flags in definition order and remembers their
     * labels. Once frozen, no more flags can be defined; a subset of the
     * defined flags may be marked as implemented, and {@link #check(int)}
     * rejects anything else.
     */
    static final class FlagMgr {

        private final List<String> labels = new ArrayList<String>(4);
        private int defined = 0;
        private int implemented = 0;
        private boolean frozen = false;

        private static boolean contains(int f, int g) {
            return (g | f) == f;
        }

        int next(String label) {
            if (frozen) {
                throw new IllegalStateException("frozen FlagMgr");
            }
            labels.add(label);
            int flag = 1 << (labels.size() - 1);
            defined |= flag;
            return flag;
        }

        int freezeAndCount() {
            frozen = true;
            return labels.size();
        }

        FlagMgr setImplemented(int implemented) {
            if (!contains(defined, implemented)) {
                throw new IllegalArgumentException(
                    "unknown flags: " + (implemented & ~defined));
            }
            this.implemented = implemented;
            return this;
        }

        void check(int flags) {
            if (!contains(defined, flags)) {
                throw new IllegalArgumentException(
                    "unknown flags: " + (flags & ~defined));
            } else if (!contains(implemented, flags)) {
                throw new IllegalArgumentException(
                    "unimplemented flags: " + stringFrom(flags & ~implemented));
            }
        }

        String stringFrom(int flags) {
            assert contains(defined, flags) : flags;
            StringBuilder sb = new StringBuilder();
            for (int n = 0; n < labels.size(); ++n) {
                if (isSet(flags, 1 << n)) {
                    sb.append(sb.length() == 0 ? "" : ", ").append(labels.get(n));
                }
            }
            return sb.toString();
        }
    }

    private static abstract class Escaper {
        abstract boolean esc(StringBuilder sb, int c);
    }

    private static final class MapEscaper extends Escaper {
        private final Map<Character, String> map =
                new HashMap<Character, String>();

        @Override
        boolean esc(StringBuilder sb, int c) {
            boolean ret = (c == (char) c) ? map.containsKey((char) c) : false;
            if (ret) {
                sb.append(map.get((char) c));
            }
            return ret;
        }

        MapEscaper map(Character c, String s) {
            map.put(c, s);
            return this;
        }
    }

    private static final MapEscaper ctlEscaper =
            new MapEscaper().map('\r', "\\r").map('\n', "\\n").map('\t', "\\t");
    private static final MapEscaper rxpEscaper =
            new MapEscaper().map('.', "\\.").map('\\', "\\\\").map('(', "\\(")
                .map(')', "\\)").map('[', "\\[").map('*', "\\*").map('?', "\\?")
                .map('+', "\\+").map('$', "\\$").map('|', "\\|").map('{', "\\{")
                .map('^', "\\^");

    /*
     * Code points the grammar has no escape for are printed as \xNN or
     * \\uNNNN. They cannot be parsed back, but they only show up in logs.
     */
    private static final Escaper hexEscaper = new Escaper() {
        @Override
        boolean esc(StringBuilder sb, int c) {
            if (32 <= c && c < 127) {
                return false;
            }
            String hex = Integer.toHexString(c);
            if (c < 0x100) {
                sb.append("\\x").append(hex.length() < 2 ? "0" : "").append(hex);
            } else {
                sb.append("\\u");
                for (int i = hex.length(); i < 4; ++i) {
                    sb.append('0');
                }
                sb.append(hex);
            }
            return true;
        }
    };

    /**
     * Singleton escapers used to print code points back in regex syntax.
     */
    enum Esc {

        /**
         * Literal outside a character class: control characters and the
         * reserved metacharacters are escaped.
         */
        RXP(ctlEscaper, rxpEscaper, hexEscaper),
        /**
         * Literal inside a character class, where no escapes exist. Only
         * used for printing.
         */
        RXCC(hexEscaper);

        private final Escaper[] path;

        Esc(final Escaper... path) {
            this.path = path;
        }

        void esc(StringBuilder sb, int c) {
            for (Escaper e : path) {
                if (e.esc(sb, c)) {
                    return;
                }
            }
            sb.append((char) c);
        }

        String esc(int c) {
            StringBuilder sb = new StringBuilder();
            esc(sb, c);
            return sb.toString();
        }
    }
}
