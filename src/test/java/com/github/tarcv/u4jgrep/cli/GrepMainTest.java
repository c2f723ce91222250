package com.github.tarcv.u4jgrep.cli;

import org.junit.Assert;
import org.junit.Assume;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

public class GrepMainTest {
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    private ExitStatus grep(final String... args) {
        return grepWithInput("", args);
    }

    private ExitStatus grepWithInput(final String stdin, final String... args) {
        InputStream in = new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8));
        PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
        return GrepMain.run(args, in, out, err);
    }

    private String out() {
        return new String(outBytes.toByteArray(), StandardCharsets.UTF_8);
    }

    private String err() {
        return new String(errBytes.toByteArray(), StandardCharsets.UTF_8);
    }

    private String file(final String name, final String content) throws IOException {
        File f = tmp.newFile(name);
        Files.write(f.toPath(), content.getBytes(StandardCharsets.UTF_8));
        return f.getPath();
    }

    @Test
    public void prefixesLinesWithSourceWhenSearchingSeveralFiles() throws IOException {
        String foo = file("foo.txt", "hello world\nbye\n");
        String bar = file("bar.txt", "goodbye\n");

        Assert.assertEquals(ExitStatus.MATCH, grep("o", foo, bar));
        Assert.assertEquals(foo + ":hello world\n" + bar + ":goodbye\n", out());
        Assert.assertEquals("", err());
    }

    @Test
    public void noMatchExitsWithOne() throws IOException {
        String foo = file("foo.txt", "hello world\n");
        String bar = file("bar.txt", "goodbye\n");

        Assert.assertEquals(ExitStatus.NO_MATCH, grep("zzz", foo, bar));
        Assert.assertEquals("", out());
        Assert.assertEquals(1, ExitStatus.NO_MATCH.code());
    }

    @Test
    public void singleFileHasNoPrefix() throws IOException {
        String foo = file("foo.txt", "alpha\nbeta\ngamma\n");

        Assert.assertEquals(ExitStatus.MATCH, grep("^[bg]", foo));
        Assert.assertEquals("beta\ngamma\n", out());
    }

    @Test
    public void filenameOptionsOverrideDefault() throws IOException {
        String foo = file("foo.txt", "x\n");
        String bar = file("bar.txt", "x\n");

        Assert.assertEquals(ExitStatus.MATCH, grep("-H", "x", foo));
        Assert.assertEquals(foo + ":x\n", out());

        outBytes.reset();
        Assert.assertEquals(ExitStatus.MATCH, grep("-h", "x", foo, bar));
        Assert.assertEquals("x\nx\n", out());
    }

    @Test
    public void searchesDirectoriesRecursively() throws IOException {
        File dir = tmp.newFolder("dir");
        File sub = new File(dir, "sub");
        Assert.assertTrue(sub.mkdir());
        Files.write(new File(dir, "a.txt").toPath(), "match here\nnothing\n".getBytes(StandardCharsets.UTF_8));
        Files.write(new File(sub, "b.txt").toPath(), "another match\n".getBytes(StandardCharsets.UTF_8));

        Assert.assertEquals(ExitStatus.MATCH, grep("-r", "match", dir.getPath()));
        String expected = new File(dir, "a.txt").getPath() + ":match here\n"
                + new File(sub, "b.txt").getPath() + ":another match\n";
        Assert.assertEquals(expected, out());
    }

    private static void symlink(final File link, final File target) {
        try {
            Files.createSymbolicLink(link.toPath(), target.toPath());
        } catch (IOException | UnsupportedOperationException e) {
            Assume.assumeNoException("symbolic links not available", e);
        }
    }

    @Test
    public void followsSymlinkedDirectoryGivenOnCommandLine() throws IOException {
        File dir = tmp.newFolder("dir");
        Files.write(new File(dir, "a.txt").toPath(), "match here\n".getBytes(StandardCharsets.UTF_8));
        File link = new File(tmp.getRoot(), "link");
        symlink(link, dir);

        Assert.assertEquals(ExitStatus.MATCH, grep("-r", "match", link.getPath()));
        Assert.assertEquals(new File(link, "a.txt").getPath() + ":match here\n", out());
        Assert.assertEquals("", err());
    }

    @Test
    public void reportsSkippedEntriesDuringRecursion() throws IOException {
        File dir = tmp.newFolder("dir");
        Files.write(new File(dir, "a.txt").toPath(), "match\n".getBytes(StandardCharsets.UTF_8));
        File dangling = new File(dir, "dangling");
        symlink(dangling, new File(tmp.getRoot(), "nowhere"));
        File loop = new File(dir, "loop");
        symlink(loop, dir);

        Assert.assertEquals(ExitStatus.MATCH, grep("-r", "match", dir.getPath()));
        Assert.assertEquals(new File(dir, "a.txt").getPath() + ":match\n", out());
        Assert.assertTrue(err(), err().contains(dangling.getPath() + ": not a regular file, skipped"));
        Assert.assertTrue(err(), err().contains(loop.getPath() + ": recursive directory loop"));
    }

    @Test
    public void directoryWithoutRecursionIsAnError() throws IOException {
        File dir = tmp.newFolder("dir");

        Assert.assertEquals(ExitStatus.ERROR, grep("x", dir.getPath()));
        Assert.assertTrue(err(), err().contains(dir.getPath() + ": Is a directory"));
    }

    @Test
    public void missingFileIsReportedAndSearchContinues() throws IOException {
        String foo = file("foo.txt", "found\n");
        String missing = new File(tmp.getRoot(), "missing.txt").getPath();

        Assert.assertEquals(ExitStatus.MATCH, grep("found", missing, foo));
        Assert.assertEquals(foo + ":found\n", out());
        Assert.assertEquals("u4j-grep: " + missing + ": No such file or directory\n", err().replace("\r\n", "\n"));
    }

    @Test
    public void onlyUnreadableSourcesExitWithTwo() {
        String missing = new File(tmp.getRoot(), "missing.txt").getPath();

        Assert.assertEquals(ExitStatus.ERROR, grep("x", missing));
        Assert.assertEquals("", out());
    }

    @Test
    public void skipsBinaryFiles() throws IOException {
        File bin = tmp.newFile("data.bin");
        Files.write(bin.toPath(), new byte[]{'a', 'b', 'c', 0, 'a', 'b', 'c', '\n'});

        Assert.assertEquals(ExitStatus.NO_MATCH, grep("abc", bin.getPath()));
        Assert.assertEquals("", out());
        Assert.assertTrue(err(), err().contains("binary file skipped"));
    }

    @Test
    public void lineNumbers() throws IOException {
        String foo = file("foo.txt", "one\ntwo\nthree\n");

        Assert.assertEquals(ExitStatus.MATCH, grep("-n", "t", foo));
        Assert.assertEquals("2:two\n3:three\n", out());
    }

    @Test
    public void countOnly() throws IOException {
        String foo = file("foo.txt", "one\ntwo\nthree\n");
        String bar = file("bar.txt", "none\n");

        Assert.assertEquals(ExitStatus.MATCH, grep("-c", "t", foo, bar));
        Assert.assertEquals(foo + ":2\n" + bar + ":0\n", out());
    }

    @Test
    public void onlyMatchingParts() throws IOException {
        String foo = file("foo.txt", "a12b345\nnone\n");

        Assert.assertEquals(ExitStatus.MATCH, grep("-o", "\\d+", foo));
        Assert.assertEquals("12\n345\n", out());
    }

    @Test
    public void invertSelection() throws IOException {
        String foo = file("foo.txt", "keep\ndrop me\nkeep too\n");

        Assert.assertEquals(ExitStatus.MATCH, grep("-v", "drop", foo));
        Assert.assertEquals("keep\nkeep too\n", out());
    }

    @Test
    public void fixedStrings() throws IOException {
        String foo = file("foo.txt", "a.b\naxb\n");

        Assert.assertEquals(ExitStatus.MATCH, grep("-F", "a.b", foo));
        Assert.assertEquals("a.b\n", out());
    }

    @Test
    public void extendedFlagIsAccepted() throws IOException {
        String foo = file("foo.txt", "cat\ndog\n");

        Assert.assertEquals(ExitStatus.MATCH, grep("-E", "c(a|o)t", foo));
        Assert.assertEquals("cat\n", out());
    }

    @Test
    public void readsStandardInputWithoutPaths() {
        Assert.assertEquals(ExitStatus.MATCH, grepWithInput("abc\nxyz\n", "y"));
        Assert.assertEquals("xyz\n", out());
    }

    @Test
    public void dashNamesStandardInput() throws IOException {
        String foo = file("foo.txt", "file line\n");

        Assert.assertEquals(ExitStatus.MATCH, grepWithInput("stdin line\n", "line", "-", foo));
        Assert.assertEquals("(standard input):stdin line\n" + foo + ":file line\n", out());
    }

    @Test
    public void stepLimitSkipsLine() throws IOException {
        String foo = file("foo.txt", "aaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa\nab\n");

        Assert.assertEquals(ExitStatus.MATCH, grep("--max-steps", "1000", "(a|a)*b", foo));
        Assert.assertEquals("ab\n", out());
        Assert.assertTrue(err(), err().contains(foo + ":1: Match step limit of 1000 exceeded"));
    }

    @Test
    public void stepLimitLineIsNotSelectedWhenInverted() throws IOException {
        String foo = file("foo.txt", "aaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa\nxyz\n");

        Assert.assertEquals(ExitStatus.MATCH, grep("-v", "--max-steps", "1000", "(a|a)*b", foo));
        Assert.assertEquals("xyz\n", out());
        Assert.assertTrue(err(), err().contains(foo + ":1: Match step limit of 1000 exceeded"));
    }

    @Test
    public void badPatternExitsWithTwo() {
        Assert.assertEquals(ExitStatus.ERROR, grep("(ab"));
        Assert.assertTrue(err(), err().startsWith("u4j-grep: Unclosed group at position 0"));

        errBytes.reset();
        Assert.assertEquals(ExitStatus.ERROR, grep("(a)\\2"));
        Assert.assertTrue(err(), err().contains("Back-reference \\2"));
    }

    @Test
    public void badUsageExitsWithTwo() {
        Assert.assertEquals(ExitStatus.ERROR, grep("-Q", "x"));
        Assert.assertTrue(err(), err().contains(GrepOptions.USAGE_LINE));

        errBytes.reset();
        Assert.assertEquals(ExitStatus.ERROR, grep());
        Assert.assertTrue(err(), err().contains("missing PATTERN"));
        Assert.assertEquals(2, ExitStatus.ERROR.code());
    }

    @Test
    public void standardOutputIsBuffered() {
        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        PrintStream out = GrepMain.bufferedUtf8(sink);
        out.print("héllo\n");
        Assert.assertEquals(0, sink.size());
        out.flush();
        Assert.assertEquals("héllo\n", new String(sink.toByteArray(), StandardCharsets.UTF_8));
    }

    @Test
    public void help() {
        Assert.assertEquals(ExitStatus.MATCH, grep("--help"));
        Assert.assertTrue(out().startsWith(GrepOptions.USAGE_LINE));
        Assert.assertTrue(out(), out().contains("--max-steps"));
    }
}
