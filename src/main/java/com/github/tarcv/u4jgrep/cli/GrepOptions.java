package com.github.tarcv.u4jgrep.cli;

import joptsimple.NonOptionArgumentSpec;
import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Settings of one command line invocation.
 */
public final class GrepOptions {
    static final String USAGE_LINE = "Usage: " + SearchDriver.PROGRAM_NAME + " [OPTION]... PATTERN [FILE]...";

    private final String pattern;
    private final List<String> paths;
    private final boolean recursive;
    private final boolean lineNumbers;
    private final boolean countOnly;
    private final boolean onlyMatching;
    private final boolean invert;
    private final boolean fixedStrings;
    private final Boolean withFilename;
    private final int maxSteps;
    private final boolean help;

    private GrepOptions(final Builder builder) {
        this.pattern = builder.pattern;
        this.paths = Collections.unmodifiableList(new ArrayList<>(builder.paths));
        this.recursive = builder.recursive;
        this.lineNumbers = builder.lineNumbers;
        this.countOnly = builder.countOnly;
        this.onlyMatching = builder.onlyMatching;
        this.invert = builder.invert;
        this.fixedStrings = builder.fixedStrings;
        this.withFilename = builder.withFilename;
        this.maxSteps = builder.maxSteps;
        this.help = builder.help;
    }

    private static final class Specs {
        final OptionParser parser = new OptionParser();
        final OptionSpec<Void> extended = parser.accepts("E", "Extended regular expression syntax (always on)");
        final OptionSpec<Void> fixed = parser.accepts("F", "Treat PATTERN as a literal string");
        final OptionSpec<Void> recursive = parser.accepts("r", "Search directories recursively");
        final OptionSpec<Void> lineNumbers = parser.accepts("n", "Prefix each output line with its line number");
        final OptionSpec<Void> count = parser.accepts("c", "Print only a count of selected lines per source");
        final OptionSpec<Void> onlyMatching = parser.accepts("o", "Print only the matched parts of lines");
        final OptionSpec<Void> invert = parser.accepts("v", "Select non-matching lines");
        final OptionSpec<Void> withFilename = parser.accepts("H", "Always prefix output with the source name");
        final OptionSpec<Void> noFilename = parser.accepts("h", "Never prefix output with the source name");
        final OptionSpec<Integer> maxSteps = parser.accepts("max-steps",
                        "Give up on a line after this many backtracking steps (0 = no limit)")
                .withRequiredArg().ofType(Integer.class).defaultsTo(0);
        final OptionSpec<Void> help = parser.accepts("help", "Display this help and exit").forHelp();
        final NonOptionArgumentSpec<String> arguments = parser.nonOptions("PATTERN, then files or directories");
    }

    /**
     * Parses command line arguments.
     *
     * @throws UsageException for unknown options, bad option values or a missing pattern
     */
    public static GrepOptions parse(final String... args) throws UsageException {
        Specs specs = new Specs();
        OptionSet options;
        try {
            options = specs.parser.parse(args);
        } catch (OptionException e) {
            throw new UsageException(e.getMessage(), e);
        }

        Builder builder = new Builder();
        if (options.has(specs.help)) {
            builder.help = true;
            return builder.build();
        }

        List<String> arguments = options.valuesOf(specs.arguments);
        if (arguments.isEmpty()) {
            throw new UsageException("missing PATTERN argument");
        }
        int maxSteps = options.valueOf(specs.maxSteps);
        if (maxSteps < 0) {
            throw new UsageException("--max-steps must not be negative: " + maxSteps);
        }
        builder.pattern = arguments.get(0);
        builder.paths.addAll(arguments.subList(1, arguments.size()));
        builder.recursive = options.has(specs.recursive);
        builder.lineNumbers = options.has(specs.lineNumbers);
        builder.countOnly = options.has(specs.count);
        builder.onlyMatching = options.has(specs.onlyMatching);
        builder.invert = options.has(specs.invert);
        builder.fixedStrings = options.has(specs.fixed);
        if (options.has(specs.withFilename)) {
            builder.withFilename = Boolean.TRUE;
        } else if (options.has(specs.noFilename)) {
            builder.withFilename = Boolean.FALSE;
        }
        builder.maxSteps = maxSteps;
        return builder.build();
    }

    public static void printHelpOn(final OutputStream out) throws IOException {
        out.write((USAGE_LINE + System.lineSeparator()
                + "Search for PATTERN in each FILE, or standard input if no FILE is given."
                + System.lineSeparator() + System.lineSeparator())
                .getBytes(StandardCharsets.UTF_8));
        new Specs().parser.printHelpOn(out);
    }

    public String pattern() {
        return pattern;
    }

    public List<String> paths() {
        return paths;
    }

    public boolean isRecursive() {
        return recursive;
    }

    public boolean isLineNumbers() {
        return lineNumbers;
    }

    public boolean isCountOnly() {
        return countOnly;
    }

    public boolean isOnlyMatching() {
        return onlyMatching;
    }

    public boolean isInvert() {
        return invert;
    }

    public boolean isFixedStrings() {
        return fixedStrings;
    }

    /**
     * TRUE or FALSE when forced by {@code -H} or {@code -h}, null to decide from the sources.
     */
    public Boolean withFilename() {
        return withFilename;
    }

    public int maxSteps() {
        return maxSteps;
    }

    public boolean isHelp() {
        return help;
    }

    static final class Builder {
        String pattern;
        final List<String> paths = new ArrayList<>();
        boolean recursive;
        boolean lineNumbers;
        boolean countOnly;
        boolean onlyMatching;
        boolean invert;
        boolean fixedStrings;
        Boolean withFilename;
        int maxSteps;
        boolean help;

        GrepOptions build() {
            return new GrepOptions(this);
        }
    }
}
