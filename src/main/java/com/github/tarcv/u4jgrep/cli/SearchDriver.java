package com.github.tarcv.u4jgrep.cli;

import com.github.tarcv.u4jgrep.RegexException;
import com.github.tarcv.u4jgrep.RegexMatcher;
import com.github.tarcv.u4jgrep.RegexPattern;

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemLoopException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a compiled pattern over every line of every input source and prints the selected lines.
 * <p>
 * Problems with a single source (missing file, permission denied, binary content) are reported
 * on the error stream and the search goes on with the next source. A line on which the
 * pattern exceeds its step limit is reported and skipped: it is not selected, with or
 * without {@code -v}.
 */
public final class SearchDriver {
    private static final Logger LOGGER = Logger.getLogger(SearchDriver.class.getName());

    static final String PROGRAM_NAME = "u4j-grep";

    /**
     * Number of leading bytes inspected for NUL to decide that a file is binary.
     */
    static final int BINARY_PROBE_SIZE = 8192;

    private final GrepOptions options;
    private final InputStream stdin;
    private final PrintStream out;
    private final PrintStream err;
    private final RegexMatcher matcher;

    private boolean anySelected;
    private int sourcesRead;
    private int sourcesFailed;

    public SearchDriver(final RegexPattern pattern, final GrepOptions options,
                        final InputStream stdin, final PrintStream out, final PrintStream err) {
        this.options = options;
        this.stdin = stdin;
        this.out = out;
        this.err = err;
        this.matcher = pattern.matcher("");
        this.matcher.setTimeLimit(options.maxSteps());
    }

    /**
     * Searches all sources named by the options.
     */
    public ExitStatus run() {
        List<InputSource> sources = collectSources();
        boolean showNames = options.withFilename() != null
                ? options.withFilename()
                : sources.size() > 1 || options.paths().size() > 1 || searchesDirectory();
        for (InputSource source : sources) {
            searchSource(source, showNames);
        }
        out.flush();

        if (anySelected) {
            return ExitStatus.MATCH;
        }
        if (sourcesRead == 0 && sourcesFailed > 0) {
            return ExitStatus.ERROR;
        }
        return ExitStatus.NO_MATCH;
    }

    private boolean searchesDirectory() {
        if (!options.isRecursive()) {
            return false;
        }
        for (String p : options.paths()) {
            if (Files.isDirectory(Paths.get(p))) {
                return true;
            }
        }
        return false;
    }

    private List<InputSource> collectSources() {
        List<InputSource> sources = new ArrayList<>();
        if (options.paths().isEmpty()) {
            sources.add(InputSource.stdin());
            return sources;
        }
        for (String p : options.paths()) {
            if ("-".equals(p)) {
                sources.add(InputSource.stdin());
                continue;
            }
            Path path = Paths.get(p);
            if (options.isRecursive() && Files.isDirectory(path)) {
                walk(path, sources);
            } else {
                sources.add(InputSource.file(path));
            }
        }
        return sources;
    }

    /**
     * Adds every regular file below {@code root}, in name order, to {@code sources}.
     * Symbolic links are followed; a link back to a directory being walked is reported.
     */
    private void walk(final Path root, final List<InputSource> sources) {
        List<Path> files = new ArrayList<>();
        try {
            Files.walkFileTree(root, EnumSet.of(FileVisitOption.FOLLOW_LINKS), Integer.MAX_VALUE,
                    new SimpleFileVisitor<Path>() {
                @Override
                public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()) {
                        files.add(file);
                    } else {
                        diagnostic(file + ": not a regular file, skipped");
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(final Path file, final IOException exc) {
                    diagnostic(file + ": " + describe(exc));
                    sourcesFailed++;
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            diagnostic(root + ": " + describe(e));
            sourcesFailed++;
        }
        Collections.sort(files);
        for (Path file : files) {
            sources.add(InputSource.file(file));
        }
    }

    private void searchSource(final InputSource source, final boolean showName) {
        LOGGER.fine(() -> "Searching " + source);
        try (BufferedInputStream in = source.open(stdin)) {
            if (!source.isStdin() && looksBinary(in)) {
                sourcesRead++;
                diagnostic(source.name() + ": binary file skipped");
                return;
            }
            BufferedReader reader = new BufferedReader(new InputStreamReader(in,
                    StandardCharsets.UTF_8.newDecoder()
                            .onMalformedInput(CodingErrorAction.REPLACE)
                            .onUnmappableCharacter(CodingErrorAction.REPLACE)));
            sourcesRead++;
            String prefix = showName ? source.name() + ":" : "";
            long selected = 0;
            int lineNumber = 0;
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (searchLine(source, prefix, lineNumber, line)) {
                    selected++;
                }
            }
            if (options.isCountOnly()) {
                emit(prefix + selected);
            }
        } catch (SourceReadException e) {
            LOGGER.log(Level.FINE, "Cannot read " + source, e);
            diagnostic(e.getMessage());
            sourcesFailed++;
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Read failed for " + source, e);
            diagnostic(source.name() + ": " + describe(e));
            sourcesFailed++;
        }
    }

    /**
     * @return whether the line was selected
     */
    private boolean searchLine(final InputSource source, final String prefix, final int lineNumber, final String line) {
        boolean found;
        try {
            found = matcher.reset(line).find();
        } catch (RegexException e) {
            LOGGER.log(Level.FINE, "Gave up on " + source + " line " + lineNumber, e);
            diagnostic(source.name() + ":" + lineNumber + ": " + e.getMessage());
            return false;
        }
        if (found == options.isInvert()) {
            return false;
        }
        anySelected = true;
        if (options.isCountOnly()) {
            return true;
        }

        String linePrefix = options.isLineNumbers() ? prefix + lineNumber + ":" : prefix;
        if (!options.isOnlyMatching()) {
            emit(linePrefix + line);
            return true;
        }
        if (options.isInvert()) {
            // Selected lines have no matched parts to print.
            return true;
        }
        try {
            do {
                if (matcher.end() > matcher.start()) {
                    emit(linePrefix + matcher.group());
                }
            } while (matcher.find());
        } catch (RegexException e) {
            LOGGER.log(Level.FINE, "Gave up on " + source + " line " + lineNumber, e);
            diagnostic(source.name() + ":" + lineNumber + ": " + e.getMessage());
        }
        return true;
    }

    private static boolean looksBinary(final BufferedInputStream in) throws IOException {
        in.mark(BINARY_PROBE_SIZE);
        try {
            byte[] probe = new byte[BINARY_PROBE_SIZE];
            int total = 0;
            int n;
            while (total < probe.length && (n = in.read(probe, total, probe.length - total)) > 0) {
                total += n;
            }
            for (int i = 0; i < total; i++) {
                if (probe[i] == 0) {
                    return true;
                }
            }
            return false;
        } finally {
            in.reset();
        }
    }

    private static String describe(final IOException e) {
        if (e instanceof FileSystemLoopException) {
            return "recursive directory loop";
        }
        if (e instanceof AccessDeniedException) {
            return "Permission denied";
        }
        if (e instanceof NoSuchFileException) {
            return "No such file or directory";
        }
        return String.valueOf(e.getMessage());
    }

    private void emit(final String text) {
        out.print(text);
        out.print('\n');
    }

    private void diagnostic(final String message) {
        err.println(PROGRAM_NAME + ": " + message);
    }
}
