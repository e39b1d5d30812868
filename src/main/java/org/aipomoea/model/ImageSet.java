package org.aipomoea.model;

import org.aipomoea.util.Utils;

import java.nio.file.Path;
import java.util.*;

/**
 * Read-only mapping from image filename to absolute path, built once per run.
 * Iteration order is the order the images were supplied in and defines batch order.
 */
public final class ImageSet {

    private final Map<String, Path> images;
    private final Set<String> stems;

    public ImageSet(Map<String, Path> images) {
        this.images = Collections.unmodifiableMap(new LinkedHashMap<>(images));
        final Set<String> s = new HashSet<>();
        for (String fileName : this.images.keySet())
            s.add(Utils.removeExtension(fileName));
        this.stems = Collections.unmodifiableSet(s);
    }

    public int size() {
        return images.size();
    }

    public boolean isEmpty() {
        return images.isEmpty();
    }

    public Map<String, Path> asMap() {
        return images;
    }

    public List<Path> paths() {
        return List.copyOf(images.values());
    }

    /**
     * Whether an image with the given filename stem (name without extension) is part of the set.
     * Result lines identify images by stem only.
     */
    public boolean containsStem(String stem) {
        return stems.contains(stem);
    }

    @Override
    public String toString() {
        return "ImageSet" + images.keySet();
    }
}
