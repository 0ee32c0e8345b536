package org.dandiarchive.archive.core.task;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.concurrent.TimeoutException;

public record TaskError(
        String message,
        String exceptionType,
        String stackTrace,
        boolean retryable
) {
    public static TaskError from(Throwable t) {
        return from(t, new Class<?>[0]);
    }

    /**
     * Captures {@code t}. It is retryable when it is an I/O or timeout failure, or an
     * instance of one of the task type's declared {@code retryOn} types.
     */
    public static TaskError from(Throwable t, Class<?>[] retryOn) {
        var sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));

        boolean retryable = t instanceof IOException || t instanceof TimeoutException;
        for (Class<?> type : retryOn) {
            if (type.isInstance(t)) {
                retryable = true;
                break;
            }
        }

        return new TaskError(
                t.getMessage(),
                t.getClass().getName(),
                sw.toString(),
                retryable
        );
    }
}
