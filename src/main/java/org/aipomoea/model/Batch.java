package org.aipomoea.model;

import java.nio.file.Path;
import java.util.List;

/**
 * A contiguous slice of the image set handed to one process invocation.
 *
 * @param batchId "3" for the third batch, "3.1" for the first half-size retry of it
 * @param offset  index of the first image inside the full image list
 */
public record Batch(String batchId, int offset, List<Path> images) {

    public Batch {
        if (images.isEmpty())
            throw new IllegalArgumentException("Batch " + batchId + " has no images");
        images = List.copyOf(images);
    }

    public int size() {
        return images.size();
    }

    public String displayName() {
        final String suffix = images.get(0).getFileName()
                              + (images.size() > 1 ? ".." + images.get(images.size() - 1).getFileName() : "");
        return "Batch-%s_%s".formatted(batchId, suffix);
    }
}
