package com.github.tarcv.u4jgrep.cli;

import java.io.BufferedInputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Something lines can be read from: standard input or a file.
 */
final class InputSource {
    static final String STDIN_NAME = "(standard input)";

    private final String name;
    private final Path path;

    private InputSource(final String name, final Path path) {
        this.name = name;
        this.path = path;
    }

    static InputSource stdin() {
        return new InputSource(STDIN_NAME, null);
    }

    static InputSource file(final Path path) {
        return new InputSource(path.toString(), path);
    }

    /**
     * Name used in output prefixes and diagnostics.
     */
    String name() {
        return name;
    }

    boolean isStdin() {
        return path == null;
    }

    /**
     * Opens the source for reading. Closing the returned stream of the standard input
     * source leaves the standard input itself open.
     *
     * @throws SourceReadException if the file is missing, unreadable, or a directory
     */
    BufferedInputStream open(final InputStream stdin) throws SourceReadException {
        if (path == null) {
            return new BufferedInputStream(new FilterInputStream(stdin) {
                @Override
                public void close() {
                    // standard input belongs to the caller
                }
            });
        }
        if (Files.isDirectory(path)) {
            throw new SourceReadException(name, "Is a directory", null);
        }
        try {
            return new BufferedInputStream(Files.newInputStream(path));
        } catch (NoSuchFileException e) {
            throw new SourceReadException(name, "No such file or directory", e);
        } catch (AccessDeniedException e) {
            throw new SourceReadException(name, "Permission denied", e);
        } catch (IOException e) {
            throw new SourceReadException(name, String.valueOf(e.getMessage()), e);
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
