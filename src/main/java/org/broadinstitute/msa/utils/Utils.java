package org.broadinstitute.msa.utils;

import java.util.Arrays;
import java.util.Collection;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Argument checking and small string helpers shared across the code base.
 */
public final class Utils {

    private Utils() {}

    /**
     * Checks that an {@link Object} is not {@code null} and returns the same object or throws an {@link IllegalArgumentException}
     * @param object any Object
     * @param message the text message that would be passed to the exception thrown when {@code o == null}.
     * @return the same object
     * @throws IllegalArgumentException if a {@code o == null}
     */
    public static <T> T nonNull(final T object, final String message) {
        if (object == null) {
            throw new IllegalArgumentException(message);
        }
        return object;
    }

    public static <T> T nonNull(final T object) {
        return nonNull(object, "Null object is not allowed here.");
    }

    /**
     * Checks that a {@link String} is not {@code null} and that it is not empty.
     * @return the original string
     * @throws IllegalArgumentException if string is null or empty
     */
    public static String nonEmpty(final String string, final String message) {
        nonNull(string, "The string is null: " + message);
        if (string.isEmpty()) {
            throw new IllegalArgumentException("The string is empty: " + message);
        }
        return string;
    }

    /**
     * Checks that the collection does not contain a {@code null} value (throws an {@link IllegalArgumentException} if it does).
     */
    public static void containsNoNull(final Collection<?> collection, final String message) {
        nonNull(collection, message);
        //cannot use Collection.contains(null) here because this throws a NullPointerException when used with many Sets
        if (collection.stream().anyMatch(v -> v == null)) {
            throw new IllegalArgumentException(message);
        }
    }

    public static void validateArg(final boolean condition, final String msg) {
        if (!condition) {
            throw new IllegalArgumentException(msg);
        }
    }

    public static void validateArg(final boolean condition, final Supplier<String> msg) {
        if (!condition) {
            throw new IllegalArgumentException(msg.get());
        }
    }

    /**
     * Check a condition that should always be true and throw an {@link IllegalStateException} if false.
     */
    public static void validate(final boolean condition, final Supplier<String> msg) {
        if (!condition) {
            throw new IllegalStateException(msg.get());
        }
    }

    /**
     * Create a new string that's n copies of c
     */
    public static String dupChar(final char c, final int nCopies) {
        final char[] chars = new char[nCopies];
        Arrays.fill(chars, c);
        return new String(chars);
    }

    /**
     * Forces the JVM locale to US English so number formatting in tool output is stable.
     */
    public static void forceJVMLocaleToUSEnglish() {
        Locale.setDefault(Locale.US);
    }
}
