package io.packscan.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A unit of analysis: a filesystem path plus metadata.
 * <p>
 * Locations form a tree through {@link #createChild(Path, boolean)}. A location created with
 * {@code cleanup=true} owns its directory (a temporary extraction directory) and deletes it
 * exactly once, when the last reference is released. Every child holds a reference on its
 * parent until the child itself is released, so an extraction directory outlives all the
 * locations derived from it.
 */
public final class ScanLocation implements ScanItem {

    /**
     * Metadata key of the detected mime type.
     */
    public static final String MIME = "mime";

    /**
     * Metadata key linking the "a" side of a differential scan to its "b" side.
     */
    public static final String PAIRED_LOCATION = "b_scan_location";

    private static final Logger log = LoggerFactory.getLogger(ScanLocation.class);

    private final Path path;
    private final ContentType contentType;
    private final Map<String, Object> metadata;
    private final ScanLocation parent;
    private final boolean cleanup;
    private final int depth;
    private final AtomicInteger references = new AtomicInteger(1);
    private final AtomicBoolean cleanedUp = new AtomicBoolean(false);

    public ScanLocation(Path path,
                        ContentType contentType,
                        Map<String, Object> metadata,
                        ScanLocation parent,
                        boolean cleanup,
                        int depth) {
        this.path = Objects.requireNonNull(path, "path");
        this.contentType = Objects.requireNonNull(contentType, "contentType");
        this.metadata = new LinkedHashMap<>();
        if (metadata != null) {
            this.metadata.putAll(metadata);
        }
        this.metadata.put(MIME, contentType.mimeType());
        this.parent = parent;
        this.cleanup = cleanup;
        this.depth = depth;
    }

    /**
     * Creates a top-level location, detecting its content type.
     */
    public static ScanLocation of(Path path) {
        return new ScanLocation(path, ContentType.detect(path), Map.of(), null, false, 0);
    }

    /**
     * Creates a location derived from this one. The metadata is copied (without any pairing),
     * the content type is detected for the new path, and the parent relation is recorded.
     *
     * @param newPath Path of the child
     * @param cleanup True if the child owns {@code newPath} and must delete it when released;
     *                such children are one archive level deeper than this location
     */
    public ScanLocation createChild(Path newPath, boolean cleanup) {
        if (cleanedUp.get()) {
            throw new IllegalStateException("Location already released: " + path);
        }
        Map<String, Object> childMetadata = new LinkedHashMap<>(metadata);
        childMetadata.remove(PAIRED_LOCATION);
        retain();
        return new ScanLocation(
                newPath,
                ContentType.detect(newPath),
                childMetadata,
                this,
                cleanup,
                cleanup ? depth + 1 : depth
        );
    }

    public Path path() {
        return path;
    }

    public ContentType contentType() {
        return contentType;
    }

    public Map<String, Object> metadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public void putMetadata(String key, Object value) {
        metadata.put(key, value);
    }

    /**
     * Non-owning back reference to the location this one was derived from.
     */
    public Optional<ScanLocation> parent() {
        return Optional.ofNullable(parent);
    }

    public boolean cleanup() {
        return cleanup;
    }

    /**
     * Archive nesting depth; 0 for top-level locations.
     */
    public int depth() {
        return depth;
    }

    /**
     * The "b" side of a differential scan, if this location is the "a" side of a pair.
     */
    public Optional<ScanLocation> pairedLocation() {
        Object paired = metadata.get(PAIRED_LOCATION);
        return paired instanceof ScanLocation location ? Optional.of(location) : Optional.empty();
    }

    /**
     * Adds a reference. Each {@link #retain()} must be balanced by one {@link #release()}.
     */
    public void retain() {
        int previous = references.getAndIncrement();
        if (previous <= 0) {
            references.getAndDecrement();
            throw new IllegalStateException("Cannot retain a released location: " + path);
        }
    }

    /**
     * Drops a reference. When the last reference goes away the owned directory is deleted and
     * the reference this location held on its parent is released.
     */
    public void release() {
        int remaining = references.decrementAndGet();
        if (remaining > 0) {
            return;
        }
        if (remaining < 0) {
            throw new IllegalStateException("Location released more often than retained: " + path);
        }
        if (cleanup && cleanedUp.compareAndSet(false, true)) {
            deleteRecursively(path);
        } else {
            cleanedUp.set(true);
        }
        if (parent != null) {
            parent.release();
        }
    }

    /**
     * True once the last reference has been released.
     */
    public boolean isReleased() {
        return cleanedUp.get();
    }

    private static void deleteRecursively(Path root) {
        if (!Files.exists(root)) {
            return;
        }
        log.debug("Removing extraction directory {}", root);
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.delete(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                    if (exc != null) {
                        throw exc;
                    }
                    Files.delete(dir);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to remove extraction directory " + root, e);
        }
    }

    @Override
    public String toString() {
        return "ScanLocation(" + path + ", " + contentType + (cleanup ? ", owned" : "") + ")";
    }
}
