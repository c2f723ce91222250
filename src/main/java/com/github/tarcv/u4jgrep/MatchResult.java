package com.github.tarcv.u4jgrep;

import java.util.Arrays;

/**
 * Immutable result of a successful match: the overall span plus the span of every
 * capture group, {@code -1} for groups that did not take part in the match.
 * Group 0 is the whole match.
 */
public final class MatchResult {
    private final String input;
    /**
     * start, end pairs indexed by group number.
     */
    private final int[] spans;

    MatchResult(final CharSequence input, final int[] spans) {
        this.input = input.toString();
        this.spans = spans.clone();
    }

    public int start() {
        return start(0);
    }

    public int end() {
        return end(0);
    }

    public String group() {
        return group(0);
    }

    public int start(final int group) {
        checkGroup(group);
        return spans[2 * group];
    }

    public int end(final int group) {
        checkGroup(group);
        return spans[2 * group + 1];
    }

    /**
     * @return the text captured by {@code group}, or null if the group is unbound
     */
    public String group(final int group) {
        int s = start(group);
        if (s < 0) {
            return null;
        }
        return input.substring(s, end(group));
    }

    public boolean isBound(final int group) {
        return start(group) >= 0;
    }

    public int groupCount() {
        return spans.length / 2 - 1;
    }

    private void checkGroup(final int group) {
        if (group < 0 || group > groupCount()) {
            throw new IndexOutOfBoundsException("No group " + group + ", pattern has " + groupCount());
        }
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MatchResult)) {
            return false;
        }
        MatchResult that = (MatchResult) o;
        return input.equals(that.input) && Arrays.equals(spans, that.spans);
    }

    @Override
    public int hashCode() {
        return 31 * input.hashCode() + Arrays.hashCode(spans);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("MatchResult{");
        for (int g = 0; g <= groupCount(); g++) {
            if (g > 0) {
                sb.append(", ");
            }
            sb.append(g).append('=');
            if (isBound(g)) {
                sb.append('[').append(start(g)).append(',').append(end(g)).append(')');
            } else {
                sb.append("unbound");
            }
        }
        return sb.append('}').toString();
    }
}
