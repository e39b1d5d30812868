package org.aipomoea.processing;

import org.aipomoea.model.ImageSet;
import org.aipomoea.util.FileUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Blocks until every image of the run is physically present with content, since the UI may still be copying files
 * when a run starts. Polls with exponential backoff: 1s, 2s, 4s, 8s, then 16s per poll.
 */
public class UploadBarrier {

    private static final Logger LOGGER = Logger.getLogger(UploadBarrier.class.getName());

    public static final Duration INITIAL_INTERVAL = Duration.ofSeconds(1);
    public static final Duration MAX_INTERVAL = Duration.ofSeconds(16);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    @FunctionalInterface
    public interface FileCounter {
        int count() throws IOException;
    }

    private final FileCounter counter;
    private final Duration maxWait;
    private final Sleeper sleeper;

    public UploadBarrier(FileCounter counter, Duration maxWait, Sleeper sleeper) {
        this.counter = counter;
        this.maxWait = maxWait;
        this.sleeper = sleeper;
    }

    public static UploadBarrier forImages(ImageSet images, Duration maxWait) {
        return forImages(images, maxWait, d -> Thread.sleep(d.toMillis()));
    }

    /**
     * Counts the paths of {@code images} that exist as non-empty regular files.
     */
    public static UploadBarrier forImages(ImageSet images, Duration maxWait, Sleeper sleeper) {
        final List<Path> paths = images.paths();
        return new UploadBarrier(() -> FileUtils.countPresent(paths), maxWait, sleeper);
    }

    /**
     * Waits until at least {@code expected} files are observed.
     *
     * @return the intervals slept, in order (empty when the files were already there)
     * @throws TimeoutException when the total time slept reaches the configured bound first
     */
    public List<Duration> await(int expected) throws IOException, InterruptedException, TimeoutException {
        final List<Duration> waits = new ArrayList<>();
        Duration interval = INITIAL_INTERVAL;
        Duration waited = Duration.ZERO;

        int observed = counter.count();
        while (observed < expected) {
            if (waited.compareTo(maxWait) >= 0)
                throw new TimeoutException("FPAR2 - Only %d of %d images present after waiting %ds."
                        .formatted(observed, expected, waited.toSeconds()));

            LOGGER.log(Level.INFO, "Waiting for images to be copied... {0} remaining, next check in {1}s.",
                    new Object[]{expected - observed, interval.toSeconds()});
            sleeper.sleep(interval);
            waits.add(interval);
            waited = waited.plus(interval);
            interval = nextInterval(interval);
            observed = counter.count();
        }
        return waits;
    }

    static Duration nextInterval(Duration current) {
        final Duration doubled = current.multipliedBy(2);
        return doubled.compareTo(MAX_INTERVAL) > 0 ? MAX_INTERVAL : doubled;
    }
}
