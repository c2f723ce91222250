package com.github.tarcv.u4jgrep;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.text.UnicodeSet;

import java.util.ArrayList;
import java.util.List;

import static com.github.tarcv.u4jgrep.RegexErrorCode.*;

/**
 * Recursive descent parser turning pattern text into a {@link RegexNode} tree.
 * <p>
 * Precedence, loosest first: alternation, concatenation, postfix repetition. Capture groups
 * are numbered from 1 in the order their opening parentheses are read.
 */
final class RegexParser {
    /**
     * Deepest group nesting accepted. Parsing and compiling both recurse once per level.
     */
    static final int MAX_NESTING_DEPTH = 500;

    /**
     * Largest number accepted in a {min,max} interval.
     */
    static final int MAX_INTERVAL_VALUE = 100_000;

    private final String pattern;
    private int pos;
    private int groupCount;
    private int depth;

    RegexParser(final String pattern) {
        this.pattern = pattern;
    }

    /**
     * @return the root of the parsed tree
     * @throws RegexParseException if the pattern is malformed
     */
    RegexNode parse() {
        pos = 0;
        groupCount = 0;
        depth = 0;
        RegexNode root = parseAlternation();
        if (pos < pattern.length()) {
            // Only an unbalanced ')' stops the top level alternation early.
            throw error(MISMATCHED_PAREN, pos, "Unmatched closing parenthesis");
        }
        return root;
    }

    /**
     * Number of capture groups seen by the last {@link #parse()}.
     */
    int groupCount() {
        return groupCount;
    }

    private RegexNode parseAlternation() {
        List<RegexNode> branches = new ArrayList<>();
        branches.add(parseConcatenation());
        while (peek() == '|') {
            pos++;
            branches.add(parseConcatenation());
        }
        return branches.size() == 1 ? branches.get(0) : new RegexNode.Alternation(branches);
    }

    private RegexNode parseConcatenation() {
        List<RegexNode> terms = new ArrayList<>();
        while (pos < pattern.length() && peek() != '|' && peek() != ')') {
            terms.add(parseRepetition());
        }
        return terms.size() == 1 ? terms.get(0) : new RegexNode.Concat(terms);
    }

    private RegexNode parseRepetition() {
        RegexNode atom = parseAtom();
        int quantifierPos = pos;
        RegexNode result = parseQuantifier(atom);
        if (result == atom) {
            return atom;
        }
        if (atom instanceof RegexNode.AnchorStart || atom instanceof RegexNode.AnchorEnd) {
            throw error(NOTHING_TO_REPEAT, quantifierPos, "Anchor cannot be repeated");
        }
        if (isQuantifierAhead()) {
            throw error(NOTHING_TO_REPEAT, pos, "Quantifier follows another quantifier");
        }
        return result;
    }

    /**
     * Wraps {@code atom} into a {@link RegexNode.Repeat} if a quantifier follows, otherwise returns it unchanged.
     */
    private RegexNode parseQuantifier(final RegexNode atom) {
        switch (peek()) {
            case '*':
                pos++;
                return new RegexNode.Repeat(atom, 0, RegexNode.UNBOUNDED);
            case '+':
                pos++;
                return new RegexNode.Repeat(atom, 1, RegexNode.UNBOUNDED);
            case '?':
                pos++;
                return new RegexNode.Repeat(atom, 0, 1);
            case '{': {
                int[] bounds = scanInterval(pos);
                if (bounds == null) {
                    // Not an interval, the brace is an ordinary literal.
                    return atom;
                }
                int intervalStart = pos;
                pos = bounds[2];
                if (bounds[1] != RegexNode.UNBOUNDED && bounds[1] < bounds[0]) {
                    throw error(MAX_LT_MIN, intervalStart, "Interval maximum is less than its minimum");
                }
                return new RegexNode.Repeat(atom, bounds[0], bounds[1]);
            }
            default:
                return atom;
        }
    }

    private boolean isQuantifierAhead() {
        int c = peek();
        return c == '*' || c == '+' || c == '?' || (c == '{' && scanInterval(pos) != null);
    }

    /**
     * Scans {@code {n}}, {@code {n,}} or {@code {n,m}} starting at the brace.
     *
     * @return {min, max, index after the closing brace}, or null if the text there is not an interval
     */
    private int[] scanInterval(final int bracePos) {
        int i = bracePos + 1;
        int digitsStart = i;
        long min = 0;
        while (i < pattern.length() && isAsciiDigit(pattern.charAt(i))) {
            min = Math.min(min * 10 + (pattern.charAt(i) - '0'), Integer.MAX_VALUE);
            i++;
        }
        if (i == digitsStart) {
            return null;
        }
        long max = min;
        if (i < pattern.length() && pattern.charAt(i) == ',') {
            i++;
            int maxStart = i;
            max = 0;
            while (i < pattern.length() && isAsciiDigit(pattern.charAt(i))) {
                max = Math.min(max * 10 + (pattern.charAt(i) - '0'), Integer.MAX_VALUE);
                i++;
            }
            if (i == maxStart) {
                max = RegexNode.UNBOUNDED;
            }
        }
        if (i >= pattern.length() || pattern.charAt(i) != '}') {
            return null;
        }
        if (min > MAX_INTERVAL_VALUE || max > MAX_INTERVAL_VALUE) {
            throw error(NUMBER_TOO_BIG, digitsStart, "Interval bound exceeds " + MAX_INTERVAL_VALUE);
        }
        return new int[]{(int) min, (int) max, i + 1};
    }

    private RegexNode parseAtom() {
        int atomStart = pos;
        int c = pattern.codePointAt(pos);
        switch (c) {
            case '(':
                return parseGroup();
            case '[':
                return parseCharClass();
            case '.':
                pos++;
                return new RegexNode.AnyChar();
            case '^':
                pos++;
                return new RegexNode.AnchorStart();
            case '$':
                pos++;
                return new RegexNode.AnchorEnd();
            case '\\':
                return parseEscape();
            case '*':
            case '+':
            case '?':
                throw error(NOTHING_TO_REPEAT, atomStart, "Nothing to repeat");
            case '{':
                if (scanInterval(pos) != null) {
                    throw error(NOTHING_TO_REPEAT, atomStart, "Nothing to repeat");
                }
                pos++;
                return new RegexNode.Literal(c);
            default:
                pos += Character.charCount(c);
                return new RegexNode.Literal(c);
        }
    }

    private RegexNode parseGroup() {
        int openPos = pos;
        if (depth >= MAX_NESTING_DEPTH) {
            throw error(PATTERN_TOO_BIG, openPos, "Groups nested deeper than " + MAX_NESTING_DEPTH + " levels");
        }
        pos++;
        int index;
        if (pattern.startsWith("?:", pos)) {
            pos += 2;
            index = RegexNode.Group.NON_CAPTURING;
        } else {
            index = ++groupCount;
        }
        depth++;
        RegexNode body = parseAlternation();
        depth--;
        if (peek() != ')') {
            throw error(MISMATCHED_PAREN, openPos, "Unclosed group");
        }
        pos++;
        return new RegexNode.Group(index, body);
    }

    private RegexNode parseEscape() {
        int escapePos = pos;
        pos++;
        if (pos >= pattern.length()) {
            throw error(BAD_ESCAPE_SEQUENCE, escapePos, "Trailing backslash");
        }
        int c = pattern.codePointAt(pos);
        if (RegexStaticSets.INSTANCE.fAsciiDigits.contains(c)) {
            return parseBackreference(escapePos);
        }
        UnicodeSet shorthand = RegexStaticSets.INSTANCE.shorthandSet(c);
        pos += Character.charCount(c);
        if (shorthand != null) {
            return new RegexNode.CharClass(shorthand, RegexStaticSets.isNegatedShorthand(c));
        }
        return new RegexNode.Literal(controlEscape(c));
    }

    /**
     * Reads the digits of {@code \N}. Digits are taken for as long as the number still names
     * a group opened so far; later digits are literal text.
     */
    private RegexNode parseBackreference(final int escapePos) {
        int index = UCharacter.digit(pattern.charAt(pos), 10);
        if (index == 0 || index > groupCount) {
            throw new InvalidBackreferenceException(pattern, escapePos, index);
        }
        pos++;
        while (pos < pattern.length() && isAsciiDigit(pattern.charAt(pos))) {
            int next = index * 10 + UCharacter.digit(pattern.charAt(pos), 10);
            if (next > groupCount) {
                break;
            }
            index = next;
            pos++;
        }
        return new RegexNode.Backreference(index);
    }

    private RegexNode parseCharClass() {
        int openPos = pos;
        pos++;
        boolean negated = false;
        if (peek() == '^') {
            negated = true;
            pos++;
        }
        UnicodeSet set = new UnicodeSet();
        boolean first = true;
        for (;;) {
            if (pos >= pattern.length()) {
                throw error(MISSING_CLOSE_BRACKET, openPos, "Unterminated character class");
            }
            if (peek() == ']' && !first) {
                pos++;
                break;
            }
            first = false;
            int itemPos = pos;
            ClassItem low = readClassItem(openPos);
            if (low.set != null) {
                set.addAll(low.set);
                continue;
            }
            // '-' right before the closing bracket is literal.
            if (peek() == '-' && pos + 1 < pattern.length() && pattern.charAt(pos + 1) != ']') {
                pos++;
                ClassItem high = readClassItem(openPos);
                if (high.set != null) {
                    throw error(INVALID_RANGE, itemPos, "Shorthand class cannot end a range");
                }
                if (high.codePoint < low.codePoint) {
                    throw error(INVALID_RANGE, itemPos, "Invalid range "
                            + pattern.substring(itemPos, pos));
                }
                set.add(low.codePoint, high.codePoint);
            } else {
                set.add(low.codePoint);
            }
        }
        return new RegexNode.CharClass(set.freeze(), negated);
    }

    private static final class ClassItem {
        final int codePoint;
        final UnicodeSet set;

        ClassItem(final int codePoint, final UnicodeSet set) {
            this.codePoint = codePoint;
            this.set = set;
        }
    }

    private ClassItem readClassItem(final int openPos) {
        int c = pattern.codePointAt(pos);
        pos += Character.charCount(c);
        if (c != '\\') {
            return new ClassItem(c, null);
        }
        if (pos >= pattern.length()) {
            throw error(MISSING_CLOSE_BRACKET, openPos, "Unterminated character class");
        }
        int escaped = pattern.codePointAt(pos);
        pos += Character.charCount(escaped);
        UnicodeSet shorthand = RegexStaticSets.INSTANCE.shorthandSet(escaped);
        if (shorthand != null) {
            if (RegexStaticSets.isNegatedShorthand(escaped)) {
                shorthand = new UnicodeSet(shorthand).complement();
            }
            return new ClassItem(-1, shorthand);
        }
        return new ClassItem(controlEscape(escaped), null);
    }

    private static int controlEscape(final int c) {
        switch (c) {
            case 't':
                return '\t';
            case 'n':
                return '\n';
            case 'r':
                return '\r';
            case 'f':
                return '\f';
            default:
                return c;
        }
    }

    private int peek() {
        return pos < pattern.length() ? pattern.charAt(pos) : -1;
    }

    private static boolean isAsciiDigit(final char c) {
        return c >= '0' && c <= '9';
    }

    private RegexParseException error(final RegexErrorCode code, final int offset, final String description) {
        return new RegexParseException(code, pattern, offset, description);
    }
}
