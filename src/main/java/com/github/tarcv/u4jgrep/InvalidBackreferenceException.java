package com.github.tarcv.u4jgrep;

/**
 * A back-reference names a capture group that has not been opened at that point of the pattern.
 */
public class InvalidBackreferenceException extends RegexParseException {
    private final int index;

    public InvalidBackreferenceException(final String pattern, final int offset, final int index) {
        super(RegexErrorCode.INVALID_BACK_REF, pattern, offset,
                "Back-reference \\" + index + " does not name a preceding capture group");
        this.index = index;
    }

    public int getIndex() {
        return index;
    }
}
