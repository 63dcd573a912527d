package io.packscan.archive;

import io.packscan.ScanConfig;
import io.packscan.model.ContentType;
import io.packscan.model.ScanLocation;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Gzip or bzip2 compressed tar archives, read sequentially in stream order.
 */
class TarItemIterator extends ArchiveItemIterator {

    private TarArchiveInputStream tar;

    TarItemIterator(ScanLocation location, EntryClassifier classifier, ScanConfig config) {
        super(location, classifier, config);
    }

    @Override
    protected void open() throws IOException {
        InputStream raw = new BufferedInputStream(Files.newInputStream(location.path()));
        try {
            InputStream decompressed = location.contentType() == ContentType.BZIP2_TAR
                    ? new BZip2CompressorInputStream(raw)
                    : new GzipCompressorInputStream(raw);
            tar = new TarArchiveInputStream(decompressed);
        } catch (IOException e) {
            raw.close();
            throw e;
        }
    }

    @Override
    protected Optional<ArchiveEntry> nextEntry() throws IOException {
        TarArchiveEntry entry = tar.getNextEntry();
        if (entry == null) {
            return Optional.empty();
        }
        return Optional.of(new ArchiveEntry(entry.getName(), typeOf(entry), entry.getSize()));
    }

    private static ArchiveEntry.Type typeOf(TarArchiveEntry entry) {
        if (entry.isDirectory()) {
            return ArchiveEntry.Type.DIRECTORY;
        }
        if (entry.isSymbolicLink()) {
            return ArchiveEntry.Type.SYMLINK;
        }
        if (entry.isLink()) {
            return ArchiveEntry.Type.HARDLINK;
        }
        if (entry.isFile()) {
            return ArchiveEntry.Type.FILE;
        }
        return ArchiveEntry.Type.OTHER;
    }

    @Override
    protected void write(ArchiveEntry entry, Path target) throws IOException {
        // The tar stream ends at the entry boundary and must stay open for the next entry
        Files.copy(tar, target, StandardCopyOption.REPLACE_EXISTING);
    }

    @Override
    protected void closeArchive() throws IOException {
        if (tar != null) {
            TarArchiveInputStream toClose = tar;
            tar = null;
            toClose.close();
        }
    }
}
