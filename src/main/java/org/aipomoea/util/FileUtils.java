package org.aipomoea.util;

import org.aipomoea.config.PreloadingConfig;
import org.aipomoea.model.ImageSet;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

public class FileUtils {

    private static final Logger LOGGER = Logger.getLogger(FileUtils.class.getName());

    public static final Set<String> ALLOWED_EXTENSIONS = Set.of("png", "jpg", "jpeg", "gif");

    public static List<Path> listFiles(final Path sourceDir, final String fileFilter) throws IOException {
        if (!Files.isDirectory(sourceDir)) {
            System.err.printf("Warning: Dir not found: %s. Empty list.%n", sourceDir);
            return Collections.emptyList();
        }
        final PathMatcher fileMatcher = (fileFilter != null && !fileFilter.isBlank())
                ? FileSystems.getDefault().getPathMatcher(fileFilter) : path -> true;
        try (var stream = Files.list(sourceDir)) {
            return stream.filter(Files::isRegularFile).filter(p -> fileMatcher.matches(p.getFileName())).toList();
        }
    }

    public static boolean isImage(final Path file) {
        final String name = file.getFileName().toString();
        final int dot = name.lastIndexOf('.');
        return dot >= 0 && ALLOWED_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    /**
     * Lists the images of the upload folder as filename to absolute path, sorted by filename.
     */
    public static ImageSet loadImageSet(final Path uploadDir) throws IOException {
        if (!Files.isDirectory(uploadDir))
            throw new IOException("FLI1 - Images folder not found: " + uploadDir);
        final Map<String, Path> images = new TreeMap<>();
        for (Path file : listFiles(uploadDir, null)) {
            if (isImage(file))
                images.put(file.getFileName().toString(), file.toAbsolutePath().normalize());
        }
        return new ImageSet(images);
    }

    /**
     * Number of {@code files} that exist as regular files with content. A zero-byte file is still being copied.
     */
    public static int countPresent(final Collection<Path> files) throws IOException {
        int present = 0;
        for (Path file : files) {
            if (Files.isRegularFile(file) && Files.size(file) > 0)
                present++;
        }
        return present;
    }

    /**
     * Applies the select-only / exclude-only prefix filter to an image set. Files on disk are left untouched.
     */
    public static ImageSet applyPreloading(final ImageSet images, final PreloadingConfig preloading) {
        final List<String> prefixes = preloading.prefixes();
        if (prefixes.isEmpty())
            return images;

        final boolean selectOnly;
        if (PreloadingConfig.SELECT_ONLY.equals(preloading.selectedOption())) {
            selectOnly = true;
        } else if (PreloadingConfig.EXCLUDE_ONLY.equals(preloading.selectedOption())) {
            selectOnly = false;
        } else {
            LOGGER.log(Level.WARNING, "FPL1 - Unknown preloading option {0}, keeping every image.", preloading.selectedOption());
            return images;
        }

        final Map<String, Path> kept = new LinkedHashMap<>();
        images.asMap().forEach((name, path) -> {
            final boolean matches = prefixes.stream().anyMatch(name::startsWith);
            if (matches == selectOnly)
                kept.put(name, path);
        });
        LOGGER.log(Level.INFO, "Preloading {0} {1}: kept {2} of {3} images.",
                new Object[]{preloading.selectedOption(), prefixes, kept.size(), images.size()});
        return new ImageSet(kept);
    }

    /**
     * Splits {@code items} into contiguous buckets of at most {@code bucketSize} elements, preserving order.
     */
    public static <T> List<List<T>> splitIntoBuckets(final List<T> items, final int bucketSize) {
        if (bucketSize < 1)
            throw new IllegalArgumentException("Bucket size must be at least 1, got " + bucketSize);
        final List<List<T>> buckets = new ArrayList<>();
        final int total = items.size();
        for (int i = 0; i < total; i += bucketSize) {
            int end = Math.min(i + bucketSize, total);
            buckets.add(items.subList(i, end));
        }
        return buckets;
    }
}
