package org.dandiarchive.archive.core.sweep;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.dandiarchive.archive.core.config.ArchiveSettings;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * Hands items to an action at a steady rate of {@code archive.validation.dispatch-per-second},
 * pausing after each item, so a large sweep trickles into the task queue instead
 * of flooding it.
 */
@ApplicationScoped
public class ThrottledDispatcher {

    /** Pause between items; replaced in tests. */
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final Duration interval;
    private final Sleeper sleeper;

    @Inject
    public ThrottledDispatcher(ArchiveSettings settings) {
        this(settings, duration -> Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000));
    }

    ThrottledDispatcher(ArchiveSettings settings, Sleeper sleeper) {
        this.interval = Duration.ofNanos((long) (1_000_000_000L / settings.dispatchPerSecond()));
        this.sleeper = sleeper;
    }

    /**
     * Dispatches every item, stopping early if the thread is interrupted.
     *
     * @return number of items handed to {@code action}
     */
    public <T> int dispatch(Iterable<T> items, Consumer<T> action) {
        int count = 0;
        for (T item : items) {
            action.accept(item);
            count++;
            try {
                sleeper.sleep(interval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        return count;
    }

    public Duration interval() {
        return interval;
    }
}
