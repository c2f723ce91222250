package com.github.tarcv.u4jgrep;

/**
 * A pattern could not be compiled. Carries the zero-based offset into the pattern
 * where the problem was detected, plus up to {@link #CONTEXT_LENGTH} characters of
 * pattern text on either side of it.
 */
public class RegexParseException extends RegexException {
    static final int CONTEXT_LENGTH = 16;

    private final String description;
    private final String pattern;
    private final int offset;
    private final String preContext;
    private final String postContext;

    public RegexParseException(final RegexErrorCode errorCode, final String pattern, final int offset, final String description) {
        super(errorCode, formatMessage(description, pattern, offset));
        this.description = description;
        this.pattern = pattern;
        this.offset = offset;
        this.preContext = pattern.substring(Math.max(0, offset - CONTEXT_LENGTH), offset);
        this.postContext = pattern.substring(offset, Math.min(pattern.length(), offset + CONTEXT_LENGTH));
    }

    private static String formatMessage(final String description, final String pattern, final int offset) {
        return String.format("%s at position %d in pattern '%s'", description, offset, pattern);
    }

    public String getDescription() {
        return description;
    }

    public String getPattern() {
        return pattern;
    }

    public int getOffset() {
        return offset;
    }

    public String getPreContext() {
        return preContext;
    }

    public String getPostContext() {
        return postContext;
    }
}
