package com.github.tarcv.u4jgrep;

import org.junit.Assert;

import java.util.function.Supplier;

public class LambdaAssert {
    public static void assertFalse(final Supplier<String> messageSupplier, final boolean actual) {
        try {
            Assert.assertFalse(actual);
        } catch (AssertionError e) {
            throw withMessage(messageSupplier, e);
        }
    }

    public static void assertTrue(final Supplier<String> messageSupplier, final boolean actual) {
        try {
            Assert.assertTrue(actual);
        } catch (AssertionError e) {
            throw withMessage(messageSupplier, e);
        }
    }

    public static void assertEquals(final Supplier<String> messageSupplier, final Object expected, final Object actual) {
        try {
            Assert.assertEquals(expected, actual);
        } catch (AssertionError e) {
            throw withMessage(messageSupplier, e);
        }
    }

    private static AssertionError withMessage(final Supplier<String> messageSupplier, final AssertionError e) {
        String oldMessage = e.getMessage();
        if (oldMessage == null) {
            return new AssertionError(messageSupplier.get(), e);
        } else {
            return new AssertionError(messageSupplier.get() + ": " + oldMessage, e);
        }
    }
}
