package io.packscan.archive;

import io.packscan.ScanConfig;
import io.packscan.model.ScanItem;
import io.packscan.model.ScanLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Queue;

/**
 * Lazily unpacks one archive.
 * <p>
 * The first item is the child location of a fresh extraction directory, produced before the
 * archive is even opened. Each further step reads one entry from the container, classifies it
 * and either extracts it or yields the resulting finding. A failure to read the container ends
 * the iteration with a single read error finding.
 * <p>
 * The iterator holds its own reference on the child location while it may still write into
 * the extraction directory. {@link #close()} closes the container and drops that reference;
 * if the child was never handed out, the consumer's reference is dropped as well, which
 * deletes the extraction directory.
 */
public abstract class ArchiveItemIterator implements Iterator<ScanItem>, Closeable {

    private static final Logger log = LoggerFactory.getLogger(ArchiveItemIterator.class);

    static final String TEMP_PREFIX = "pack-scan-sandbox-";

    protected final ScanLocation location;
    protected final EntryClassifier classifier;
    private final ScanConfig config;

    private final Queue<ScanItem> pending = new ArrayDeque<>();
    private Path extractionDir;
    private ScanLocation child;
    private boolean opened;
    private boolean exhausted;
    private boolean closed;

    protected ArchiveItemIterator(ScanLocation location, EntryClassifier classifier, ScanConfig config) {
        this.location = location;
        this.classifier = classifier;
        this.config = config;
    }

    /**
     * Opens the container.
     */
    protected abstract void open() throws IOException;

    /**
     * Reads the next entry in the container's native order, or empty at the end.
     */
    protected abstract Optional<ArchiveEntry> nextEntry() throws IOException;

    /**
     * Writes the content of the entry last returned by {@link #nextEntry()} to {@code target},
     * replacing an existing file.
     */
    protected abstract void write(ArchiveEntry entry, Path target) throws IOException;

    /**
     * Closes the container if it was opened.
     */
    protected abstract void closeArchive() throws IOException;

    @Override
    public boolean hasNext() {
        fill();
        return !pending.isEmpty();
    }

    @Override
    public ScanItem next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return pending.poll();
    }

    private void fill() {
        while (pending.isEmpty() && !exhausted && !closed) {
            if (child == null) {
                createExtractionDir();
                continue;
            }
            try {
                if (!opened) {
                    opened = true;
                    open();
                }
                Optional<ArchiveEntry> entry = nextEntry();
                if (entry.isEmpty()) {
                    exhausted = true;
                    closeArchive();
                    return;
                }
                EntryClassifier.Decision decision = classifier.classify(entry.get());
                switch (decision.verdict()) {
                    case EXTRACT -> extractOrSkip(entry.get());
                    case REJECT -> pending.add(decision.finding());
                    case SKIP -> log.trace("Skipped entry {}", entry.get().path());
                }
            } catch (IOException | RuntimeException e) {
                exhausted = true;
                log.debug("Failed to read archive {}", location.path(), e);
                pending.add(EntryClassifier.readError(config, location, e));
                closeAfterFailure();
            }
        }
    }

    private void createExtractionDir() {
        try {
            extractionDir = Files.createTempDirectory(TEMP_PREFIX);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create extraction directory for " + location.path(), e);
        }
        log.info("Extracting to: '{}' [{}]", extractionDir, location.contentType().mimeType());
        child = location.createChild(extractionDir, true);
        child.retain();
        pending.add(child);
    }

    /**
     * Extracts an approved entry. A filesystem failure while writing it, such as a file entry
     * occupying the name of a later directory, only loses that entry and classification of the
     * remaining entries goes on. Failures to read the container still propagate.
     */
    private void extractOrSkip(ArchiveEntry entry) throws IOException {
        try {
            extract(entry);
        } catch (FileSystemException e) {
            log.warn("Could not extract entry '{}' of {}: {}", entry.path(), location.path(), e.toString());
        }
    }

    private void extract(ArchiveEntry entry) throws IOException {
        Path target = extractionDir.resolve(entry.path()).normalize();
        if (!target.startsWith(extractionDir)) {
            log.warn("Entry '{}' of {} resolves outside the extraction directory, not extracted",
                    entry.path(), location.path());
            return;
        }
        if (entry.type() == ArchiveEntry.Type.DIRECTORY) {
            Files.createDirectories(target);
            return;
        }
        if (target.equals(extractionDir)) {
            log.warn("File entry '{}' of {} has no name, not extracted", entry.path(), location.path());
            return;
        }
        Files.createDirectories(target.getParent());
        write(entry, target);
    }

    private void closeAfterFailure() {
        try {
            closeArchive();
        } catch (IOException e) {
            log.debug("Failed to close archive {} after read error", location.path(), e);
        }
    }

    /**
     * Path of the extraction directory, once created.
     */
    public Optional<Path> extractionDir() {
        return Optional.ofNullable(extractionDir);
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            closeArchive();
        } finally {
            if (child != null) {
                if (pending.remove(child)) {
                    child.release();
                }
                child.release();
            }
            pending.clear();
        }
    }
}
