package com.github.tarcv.u4jgrep.cli;

/**
 * Process exit codes of the command line tool.
 */
public enum ExitStatus {
    /** At least one line was selected. */
    MATCH(0),
    /** The search completed without selecting any line. */
    NO_MATCH(1),
    /** Bad usage, a malformed pattern, or no source could be read at all. */
    ERROR(2);

    private final int code;

    ExitStatus(final int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
