package com.github.tarcv.u4jgrep;

/**
 * Base class of every failure reported by the regular expression engine.
 * The error code identifies the kind of failure independently of the message text.
 */
public class RegexException extends RuntimeException {
    private final RegexErrorCode errorCode;

    public RegexException(final RegexErrorCode errorCode, final String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public RegexErrorCode getErrorCode() {
        return errorCode;
    }

    @Override
    public String toString() {
        return "RegexException{" +
                "errorCode=" + errorCode +
                ", message=" + getMessage() +
                '}';
    }
}
