// New code and changes are © 2024 TarCV
// © 2016 and later: Unicode, Inc. and others.
// License & terms of use: http://www.unicode.org/copyright.html
package com.github.tarcv.u4jgrep;

import com.ibm.icu.text.UnicodeSet;

import java.util.ArrayList;

/**
 * Class `RegexPattern` represents a compiled regular expression.  It includes
 * a factory method for creating a RegexPattern object from the source (string) form
 * of a regular expression, methods for creating RegexMatchers that allow the pattern
 * to be applied to input text, and a few convenience methods for simple common
 * uses of regular expressions.
 * <p>
 * A RegexPattern is immutable once compiled and may be shared between threads;
 * the RegexMatchers created from it may not.
 * <p>
 * Matching backtracks without memoization. Patterns combining nested unbounded repetition
 * with ambiguous alternatives, such as {@code (a|a)*b} or {@code (a*)*b}, can take time
 * exponential in the input length on inputs that do not match; see
 * {@link RegexMatcher#setTimeLimit(int)} to bound the work of a single search.
 */
public final class RegexPattern {

    //
    //  Implementation Data
    //

    /**
     * The original pattern string.
     */
    final String fPattern;

    /**
     * The parsed pattern.
     */
    RegexNode fRoot;

    /**
     * Number of capture groups in the pattern.
     */
    int fGroupCount;

    /**
     * The compiled pattern program.
     */
    int[] fCompiledPat;

    /**
     * Character classes referenced from the program, complemented already when negated.
     */
    ArrayList<UnicodeSet> fSets;

    /**
     * Size of a state stack frame in the
     * execution engine.
     */
    int fFrameSize;

    /**
     * Info on how a match must start.
     */
    StartOfMatch fStartType;
    int fInitialChar;

    private RegexPattern(final String regex) {
        fPattern = regex;
        fStartType = StartOfMatch.START_NO_INFO;
        fInitialChar = 0;
    }

    /**
     * Compiles the regular expression in string form into a RegexPattern
     * object.
     *
     * @param regex The regular expression to be compiled.
     * @return      A RegexPattern object for the compiled pattern.
     * @throws RegexParseException if the pattern is malformed;
     *                             {@link InvalidBackreferenceException} for a back-reference to no group
     */
    public static RegexPattern compile(final String regex) {
        if (regex == null) {
            throw new IllegalArgumentException("regex is null");
        }
        RegexPattern This = new RegexPattern(regex);
        RegexCompile.compile(This, regex);
        return This;
    }

    /**
     * Returns a pattern matching {@code literal} and nothing else.
     */
    public static String quote(final String literal) {
        StringBuilder sb = new StringBuilder(literal.length() * 2);
        literal.codePoints().forEach(c -> {
            if (RegexStaticSets.INSTANCE.fRuleChars.contains(c) || c == ']') {
                sb.append('\\');
            }
            sb.appendCodePoint(c);
        });
        return sb.toString();
    }

    /**
     * Creates a RegexMatcher that will match the given input against this pattern.
     * The matcher retains a reference to the supplied input, no copy is made.
     *
     * @param input    The input text to which the regular expression will be applied.
     * @return         A RegexMatcher object for this pattern and input.
     */
    public RegexMatcher matcher(final CharSequence input) {
        return new RegexMatcher(this, input);
    }

    /**
     * Finds the leftmost match of this pattern in {@code input}.
     *
     * @return the match, or null if there is none
     * @throws RegexException if the engine ran out of backtrack stack
     */
    public MatchResult search(final CharSequence input) {
        RegexMatcher m = matcher(input);
        return m.find() ? m.toMatchResult() : null;
    }

    /**
     * Test whether a string matches a regular expression.  This convenience function
     * both compiles the regular expression and applies it in a single operation.
     *
     * @param regex The regular expression
     * @param input The string data to be matched
     * @return True if the regular expression exactly matches the full input string.
     */
    public static boolean matches(final String regex, final CharSequence input) {
        return compile(regex).matcher(input).matches();
    }

    /**
     * Returns the regular expression from which this pattern was compiled.
     */
    public String pattern() {
        return fPattern;
    }

    /**
     * The parsed form of the pattern.
     */
    public RegexNode root() {
        return fRoot;
    }

    public int groupCount() {
        return fGroupCount;
    }

    /**
     * Two RegexPattern objects are considered equal if they
     * were constructed from identical source patterns.
     */
    @Override
    public boolean equals(final Object that) {
        if (!(that instanceof RegexPattern)) {
            return false;
        }
        return fPattern.equals(((RegexPattern) that).fPattern);
    }

    @Override
    public int hashCode() {
        return fPattern.hashCode();
    }

    @Override
    public String toString() {
        return fPattern;
    }
}
