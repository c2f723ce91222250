package com.github.tarcv.u4jgrep.cli;

/**
 * The command line could not be understood. No searching is attempted.
 */
public class UsageException extends Exception {
    public UsageException(final String message) {
        super(message);
    }

    public UsageException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
