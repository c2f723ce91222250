package com.github.tarcv.u4jgrep.cli;

import com.github.tarcv.u4jgrep.RegexParseException;
import com.github.tarcv.u4jgrep.RegexPattern;

import java.io.BufferedOutputStream;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.logging.LogManager;
import java.util.logging.Logger;

import static com.github.tarcv.u4jgrep.cli.SearchDriver.PROGRAM_NAME;

/**
 * Command line entry point: {@code u4j-grep [OPTION]... PATTERN [FILE]...}.
 */
public final class GrepMain {
    private static final Logger LOGGER = Logger.getLogger(GrepMain.class.getName());

    static final String LOGGING_CONFIG_RESOURCE = "/logging.properties";

    private GrepMain() {
    }

    public static void main(final String[] args) {
        PrintStream out = bufferedUtf8(new FileOutputStream(FileDescriptor.out));
        PrintStream err = new PrintStream(new FileOutputStream(FileDescriptor.err), true, StandardCharsets.UTF_8);
        configureLogging(err);
        ExitStatus status = run(args, System.in, out, err);
        out.flush();
        System.exit(status.code());
    }

    /**
     * UTF-8 stream over {@code sink} that writes only when its buffer fills or on flush.
     */
    static PrintStream bufferedUtf8(final OutputStream sink) {
        return new PrintStream(new BufferedOutputStream(sink), false, StandardCharsets.UTF_8);
    }

    /**
     * Runs one invocation against the given streams.
     */
    static ExitStatus run(final String[] args, final InputStream stdin, final PrintStream out, final PrintStream err) {
        GrepOptions options;
        try {
            options = GrepOptions.parse(args);
        } catch (UsageException e) {
            err.println(PROGRAM_NAME + ": " + e.getMessage());
            err.println(GrepOptions.USAGE_LINE);
            return ExitStatus.ERROR;
        }

        if (options.isHelp()) {
            try {
                GrepOptions.printHelpOn(out);
            } catch (IOException e) {
                err.println(PROGRAM_NAME + ": cannot print help: " + e.getMessage());
                return ExitStatus.ERROR;
            }
            out.flush();
            return ExitStatus.MATCH;
        }

        String regex = options.isFixedStrings() ? RegexPattern.quote(options.pattern()) : options.pattern();
        RegexPattern pattern;
        try {
            pattern = RegexPattern.compile(regex);
        } catch (RegexParseException e) {
            err.println(PROGRAM_NAME + ": " + e.getMessage());
            return ExitStatus.ERROR;
        }
        LOGGER.fine(() -> "Pattern '" + regex + "' has " + pattern.groupCount() + " capture groups");

        return new SearchDriver(pattern, options, stdin, out, err).run();
    }

    /**
     * Applies the bundled logging configuration unless one was given with
     * {@code -Djava.util.logging.config.file}.
     */
    static void configureLogging(final PrintStream err) {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = GrepMain.class.getResourceAsStream(LOGGING_CONFIG_RESOURCE)) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            err.println(PROGRAM_NAME + ": cannot load logging configuration: " + e.getMessage());
        }
    }
}
