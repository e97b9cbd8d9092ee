/*
 * @LICENSE@
 */

/**
 * <h3><b>rxfront</b> - the front end of an automaton based regex compiler.</h3>
 * <p>
 * <h4>Pipeline.</h4>
 * <p>
 * Regex text is parsed into a surface syntax tree which keeps everything the
 * programmer wrote: char classes with their ranges as given, POSIX named
 * sets, counted repetition, lazy quantifiers, non-capturing groups and
 * suppressed sub-expressions. A leading <code>^</code> and a trailing
 * <code>$</code> are split off as the {@link org.rxfront.regex.Anchoring} of
 * the whole expression.
 * <p>
 * The surface tree is then lowered to the {@link org.rxfront.regex.IR}: six
 * node kinds over the byte alphabet 0-255, which is all an automaton
 * construction needs. Classes and the wildcard become balanced alternations
 * of single bytes, counted repetition is unrolled, and capture groups get
 * numbers. Copies of a group made by unrolling keep the group's number, so
 * the numbers always refer to the groups of the source text.
 * <p>
 * An expression which can match nothing at all, such as <code>a{3,1}</code>,
 * lowers to <code>null</code>. That is a result, not an error.
 * <p>
 * <h4>Usage.</h4>
 *
 * <pre>
 * Pattern p = Pattern.compile(&quot;^(ab|c)+$&quot;);
 * Anchoring anchoring = p.anchoring();     // BOTH
 * IR ir = p.lower();                       // (:1 (ab|c))(:1 (ab|c))*
 * </pre>
 * <p>
 * Everything logs to the <code>"org.rxfront.regex"</code> logger at
 * {@link java.util.logging.Level#FINEST}.
 */
package org.rxfront.regex;
