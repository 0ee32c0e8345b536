package org.dandiarchive.archive.core.task;

import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the payload types and execution policy of an {@link ArchiveTask}.
 * <p>
 * The worker deserializes the stored input JSON into {@link #input()} before
 * calling the task. A run that exceeds {@link #softTimeLimitSeconds()} is cancelled
 * and marked {@link TaskStatus#DEAD}; failures matching {@link #retryOn()} are
 * retried with exponential backoff.
 */
@Inherited
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface TaskIO {
    Class<?> input();

    Class<?> output();

    int softTimeLimitSeconds() default 60;

    Class<? extends Throwable>[] retryOn() default {};
}
