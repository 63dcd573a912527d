package io.packscan.archive;

import io.packscan.ScanConfig;
import io.packscan.model.ScanLocation;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Enumeration;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Zip archives, read through the central directory in its listing order.
 */
class ZipItemIterator extends ArchiveItemIterator {

    private ZipFile zipFile;
    private Enumeration<? extends ZipEntry> entries;
    private ZipEntry current;

    ZipItemIterator(ScanLocation location, EntryClassifier classifier, ScanConfig config) {
        super(location, classifier, config);
    }

    @Override
    protected void open() throws IOException {
        zipFile = new ZipFile(location.path().toFile());
        entries = zipFile.entries();
    }

    @Override
    protected Optional<ArchiveEntry> nextEntry() {
        if (!entries.hasMoreElements()) {
            current = null;
            return Optional.empty();
        }
        current = entries.nextElement();
        ArchiveEntry.Type type = current.isDirectory() ? ArchiveEntry.Type.DIRECTORY : ArchiveEntry.Type.FILE;
        return Optional.of(new ArchiveEntry(current.getName(), type, current.getSize()));
    }

    @Override
    protected void write(ArchiveEntry entry, Path target) throws IOException {
        try (InputStream in = zipFile.getInputStream(current)) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    protected void closeArchive() throws IOException {
        if (zipFile != null) {
            ZipFile toClose = zipFile;
            zipFile = null;
            toClose.close();
        }
    }
}
