package com.github.tarcv.u4jgrep.cli;

import java.io.IOException;

/**
 * A single input source could not be opened or read. Searching continues with the other sources.
 */
public class SourceReadException extends IOException {
    private final String source;

    public SourceReadException(final String source, final String reason, final Throwable cause) {
        super(source + ": " + reason, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
