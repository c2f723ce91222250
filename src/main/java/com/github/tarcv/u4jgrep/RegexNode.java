package com.github.tarcv.u4jgrep;

import com.ibm.icu.text.UnicodeSet;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Node of a parsed pattern. The set of node kinds is closed: every consumer of the tree
 * implements {@link Visitor}, so adding a kind breaks every consumer that does not handle it.
 */
public abstract class RegexNode {
    /**
     * Repetition upper bound meaning "no limit".
     */
    public static final int UNBOUNDED = -1;

    private RegexNode() {
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {
        R visitLiteral(Literal node);
        R visitAnyChar(AnyChar node);
        R visitCharClass(CharClass node);
        R visitConcat(Concat node);
        R visitAlternation(Alternation node);
        R visitGroup(Group node);
        R visitRepeat(Repeat node);
        R visitBackreference(Backreference node);
        R visitAnchorStart(AnchorStart node);
        R visitAnchorEnd(AnchorEnd node);
    }

    /**
     * Matches exactly one code point.
     */
    public static final class Literal extends RegexNode {
        private final int codePoint;

        public Literal(final int codePoint) {
            this.codePoint = codePoint;
        }

        public int codePoint() {
            return codePoint;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }

        @Override
        public String toString() {
            return "Literal('" + new String(Character.toChars(codePoint)) + "')";
        }
    }

    /**
     * {@code .}
     */
    public static final class AnyChar extends RegexNode {
        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitAnyChar(this);
        }

        @Override
        public String toString() {
            return "AnyChar";
        }
    }

    /**
     * Membership (or, when negated, non-membership) in a set of code point ranges.
     * The set is frozen and never contains strings.
     */
    public static final class CharClass extends RegexNode {
        private final UnicodeSet set;
        private final boolean negated;

        public CharClass(final UnicodeSet set, final boolean negated) {
            this.set = set.isFrozen() ? set : set.cloneAsThawed().freeze();
            this.negated = negated;
        }

        public UnicodeSet set() {
            return set;
        }

        public boolean isNegated() {
            return negated;
        }

        public boolean matches(final int codePoint) {
            return set.contains(codePoint) != negated;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitCharClass(this);
        }

        @Override
        public String toString() {
            return "CharClass(" + (negated ? "^" : "") + set.toPattern(true) + ")";
        }
    }

    public static final class Concat extends RegexNode {
        private final List<RegexNode> items;

        public Concat(final List<RegexNode> items) {
            this.items = Collections.unmodifiableList(items);
        }

        public List<RegexNode> items() {
            return items;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitConcat(this);
        }

        @Override
        public String toString() {
            return "Concat" + items;
        }
    }

    /**
     * Branches are tried left to right.
     */
    public static final class Alternation extends RegexNode {
        private final List<RegexNode> branches;

        public Alternation(final List<RegexNode> branches) {
            this.branches = Collections.unmodifiableList(branches);
        }

        public List<RegexNode> branches() {
            return branches;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitAlternation(this);
        }

        @Override
        public String toString() {
            return "Alternation" + branches;
        }
    }

    /**
     * Parenthesized sub pattern. Capturing groups carry the 1-based index assigned in the
     * order their opening parentheses appear; {@code (?:...)} groups carry {@link #NON_CAPTURING}.
     */
    public static final class Group extends RegexNode {
        public static final int NON_CAPTURING = 0;

        private final int index;
        private final RegexNode body;

        public Group(final int index, final RegexNode body) {
            this.index = index;
            this.body = Objects.requireNonNull(body);
        }

        public int index() {
            return index;
        }

        public boolean isCapturing() {
            return index != NON_CAPTURING;
        }

        public RegexNode body() {
            return body;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitGroup(this);
        }

        @Override
        public String toString() {
            return "Group(" + (isCapturing() ? String.valueOf(index) : "?:") + ", " + body + ")";
        }
    }

    /**
     * Greedy repetition of {@code body} between {@code min} and {@code max} times,
     * {@code max} being {@link #UNBOUNDED} for {@code *} and {@code +}.
     */
    public static final class Repeat extends RegexNode {
        private final RegexNode body;
        private final int min;
        private final int max;

        public Repeat(final RegexNode body, final int min, final int max) {
            if (min < 0 || (max != UNBOUNDED && max < min)) {
                throw new IllegalArgumentException("Bad repetition bounds {" + min + "," + max + "}");
            }
            this.body = Objects.requireNonNull(body);
            this.min = min;
            this.max = max;
        }

        public RegexNode body() {
            return body;
        }

        public int min() {
            return min;
        }

        public int max() {
            return max;
        }

        public boolean isGreedy() {
            return true;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitRepeat(this);
        }

        @Override
        public String toString() {
            return "Repeat(" + body + ", " + min + ", " + (max == UNBOUNDED ? "inf" : String.valueOf(max)) + ")";
        }
    }

    public static final class Backreference extends RegexNode {
        private final int index;

        public Backreference(final int index) {
            this.index = index;
        }

        public int index() {
            return index;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitBackreference(this);
        }

        @Override
        public String toString() {
            return "Backreference(" + index + ")";
        }
    }

    /**
     * {@code ^}, offset 0 of the searched text.
     */
    public static final class AnchorStart extends RegexNode {
        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitAnchorStart(this);
        }

        @Override
        public String toString() {
            return "AnchorStart";
        }
    }

    /**
     * {@code $}, end of the searched text.
     */
    public static final class AnchorEnd extends RegexNode {
        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitAnchorEnd(this);
        }

        @Override
        public String toString() {
            return "AnchorEnd";
        }
    }
}
