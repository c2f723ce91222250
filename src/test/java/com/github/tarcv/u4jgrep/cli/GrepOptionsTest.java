package com.github.tarcv.u4jgrep.cli;

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

public class GrepOptionsTest {
    @Test
    public void parsesFlagsPatternAndPaths() throws UsageException {
        GrepOptions options = GrepOptions.parse("-r", "-n", "-E", "a+b", "one", "two");
        Assert.assertEquals("a+b", options.pattern());
        Assert.assertEquals(Arrays.asList("one", "two"), options.paths());
        Assert.assertTrue(options.isRecursive());
        Assert.assertTrue(options.isLineNumbers());
        Assert.assertFalse(options.isCountOnly());
        Assert.assertFalse(options.isOnlyMatching());
        Assert.assertFalse(options.isInvert());
        Assert.assertFalse(options.isFixedStrings());
        Assert.assertNull(options.withFilename());
        Assert.assertEquals(0, options.maxSteps());
        Assert.assertFalse(options.isHelp());
    }

    @Test
    public void defaults() throws UsageException {
        GrepOptions options = GrepOptions.parse("x");
        Assert.assertEquals("x", options.pattern());
        Assert.assertEquals(Collections.emptyList(), options.paths());
        Assert.assertFalse(options.isRecursive());
    }

    @Test
    public void filenameSwitches() throws UsageException {
        Assert.assertEquals(Boolean.TRUE, GrepOptions.parse("-H", "x").withFilename());
        Assert.assertEquals(Boolean.FALSE, GrepOptions.parse("-h", "x").withFilename());
    }

    @Test
    public void maxSteps() throws UsageException {
        Assert.assertEquals(500, GrepOptions.parse("--max-steps", "500", "x").maxSteps());
        Assert.assertEquals(7, GrepOptions.parse("--max-steps=7", "x").maxSteps());
    }

    @Test
    public void helpNeedsNoPattern() throws UsageException {
        Assert.assertTrue(GrepOptions.parse("--help").isHelp());
    }

    @Test(expected = UsageException.class)
    public void missingPattern() throws UsageException {
        GrepOptions.parse("-r");
    }

    @Test(expected = UsageException.class)
    public void unknownOption() throws UsageException {
        GrepOptions.parse("-Z", "x");
    }

    @Test(expected = UsageException.class)
    public void negativeMaxSteps() throws UsageException {
        GrepOptions.parse("--max-steps=-1", "x");
    }

    @Test(expected = UsageException.class)
    public void nonNumericMaxSteps() throws UsageException {
        GrepOptions.parse("--max-steps=lots", "x");
    }
}
