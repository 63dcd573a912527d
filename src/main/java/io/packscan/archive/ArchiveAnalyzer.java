package io.packscan.archive;

import io.packscan.ScanConfig;
import io.packscan.analyzers.Analyzer;
import io.packscan.model.ContentType;
import io.packscan.model.ScanItem;
import io.packscan.model.ScanLocation;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Looks for suspicious entries in zip and compressed tar archives and unpacks the rest for
 * recursive analysis.
 * <p>
 * The stream first yields a child location for the extraction directory, then one finding per
 * rejected entry in the archive's native order. Approved entries are extracted as the stream
 * is consumed.
 */
public class ArchiveAnalyzer implements Analyzer {

    private final ScanConfig config;

    public ArchiveAnalyzer(ScanConfig config) {
        this.config = config;
    }

    @Override
    public String id() {
        return "archive";
    }

    @Override
    public String description() {
        return "Finds archive entries escaping the extraction directory or exceeding the size limit and unpacks the archive";
    }

    @Override
    public Stream<ScanItem> analyze(ScanLocation location) {
        return analyze(location, null);
    }

    /**
     * @param maxSize Size limit for this call; null applies the configured maximum
     */
    public Stream<ScanItem> analyze(ScanLocation location, Long maxSize) {
        ContentType type = location.contentType();
        if (!type.isArchive()) {
            return Stream.empty();
        }
        String path = location.path().toString();
        ArchiveItemIterator iterator = type == ContentType.ZIP
                ? new ZipItemIterator(location, new EntryClassifier(config, EntryClassifier.Format.ZIP, maxSize, path), config)
                : new TarItemIterator(location, new EntryClassifier(config, EntryClassifier.Format.TAR, maxSize, path), config);

        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
                        false)
                .onClose(() -> {
                    try {
                        iterator.close();
                    } catch (IOException e) {
                        throw new UncheckedIOException("Failed to close archive " + path, e);
                    }
                });
    }
}
