// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.yolean;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Helper methods for handling exceptions
 */
public class Exceptions {

    /**
     * <p>Returns a user friendly error message string which includes information from all nested exceptions.</p>
     *
     * <p>The form of this string is
     * <code>e.getMessage(): e.getCause().getMessage(): e.getCause().getCause().getMessage()...</code>
     * Messages repeated by consecutive causes, and messages which only repeat the class and message of
     * the cause, are left out.</p>
     */
    public static String toMessageString(Throwable t) {
        StringBuilder b = new StringBuilder();
        String previous = null;
        for (; t != null; t = t.getCause()) {
            String message = usefulMessage(t);
            if (message == null || message.equals(previous)) continue;
            if (b.length() > 0)
                b.append(": ");
            b.append(message);
            previous = message;
        }
        return b.toString();
    }

    private static String usefulMessage(Throwable t) {
        String message = t.getMessage();
        Throwable cause = t.getCause();
        if (cause == null)
            return message == null ? t.getClass().getSimpleName() : message;
        if (message == null) return null;
        if (message.equals(cause.getClass().getName() + ": " + cause.getMessage())) return null;
        return message;
    }

    /** Runs the given operation, wrapping any IOException in an UncheckedIOException with a formatted message. */
    public static void uncheck(RunnableThrowingIOException runnable, String format, Object... args) {
        try {
            runnable.run();
        } catch (IOException e) {
            throw new UncheckedIOException(String.format(format, args), e);
        }
    }

    /** Returns the value of the given supplier, wrapping any IOException in an UncheckedIOException. */
    public static <T> T uncheck(SupplierThrowingIOException<T> supplier) {
        try {
            return supplier.get();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Returns the value of the given supplier, wrapping any IOException in an UncheckedIOException
     * with a formatted message.
     */
    public static <T> T uncheck(SupplierThrowingIOException<T> supplier, String format, Object... args) {
        try {
            return supplier.get();
        } catch (IOException e) {
            throw new UncheckedIOException(String.format(format, args), e);
        }
    }

    @FunctionalInterface
    public interface RunnableThrowingIOException {
        void run() throws IOException;
    }

    @FunctionalInterface
    public interface SupplierThrowingIOException<T> {
        T get() throws IOException;
    }

}
