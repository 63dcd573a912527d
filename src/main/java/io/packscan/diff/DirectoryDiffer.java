package io.packscan.diff;

import io.packscan.model.ScanLocation;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Pairs the files of two locations by relative path.
 * <p>
 * A directory contributes every regular file below it; a single file contributes itself under
 * its file name. Two single files with different names are compared as a rename. Unchanged
 * files produce no entry.
 */
public class DirectoryDiffer {

    /**
     * Compares two locations.
     *
     * @param prefix Prepended to every entry's display name
     */
    public List<DiffEntry> diff(ScanLocation a, ScanLocation b, String prefix) throws IOException {
        List<DiffEntry> entries = new ArrayList<>();

        if (Files.isRegularFile(a.path()) && Files.isRegularFile(b.path())
                && !a.path().getFileName().equals(b.path().getFileName())) {
            String aMd5 = DiffEntry.md5(a.path());
            String bMd5 = DiffEntry.md5(b.path());
            entries.add(new DiffEntry(DiffOperation.RENAMED,
                    prefix + a.path().getFileName() + " -> " + b.path().getFileName(),
                    a.path(), b.path(), a, b, aMd5, bMd5));
            return entries;
        }

        Map<String, Path> aFiles = files(a.path());
        Map<String, Path> bFiles = files(b.path());
        TreeSet<String> names = new TreeSet<>(aFiles.keySet());
        names.addAll(bFiles.keySet());

        for (String name : names) {
            Path aPath = aFiles.get(name);
            Path bPath = bFiles.get(name);
            if (bPath == null) {
                entries.add(new DiffEntry(DiffOperation.DELETED, prefix + name,
                        aPath, null, a, null, DiffEntry.md5(aPath), null));
            } else if (aPath == null) {
                entries.add(new DiffEntry(DiffOperation.ADDED, prefix + name,
                        null, bPath, null, b, null, DiffEntry.md5(bPath)));
            } else {
                String aMd5 = DiffEntry.md5(aPath);
                String bMd5 = DiffEntry.md5(bPath);
                if (!Objects.equals(aMd5, bMd5)) {
                    entries.add(new DiffEntry(DiffOperation.MODIFIED, prefix + name,
                            aPath, bPath, a, b, aMd5, bMd5));
                }
            }
        }
        return entries;
    }

    /**
     * Regular files by path relative to {@code root}, with {@code /} separators.
     */
    static Map<String, Path> files(Path root) throws IOException {
        Map<String, Path> files = new TreeMap<>();
        if (Files.isRegularFile(root)) {
            files.put(root.getFileName().toString(), root);
            return files;
        }
        if (!Files.isDirectory(root)) {
            return files;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            walk.filter(Files::isRegularFile).forEach(file ->
                    files.put(root.relativize(file).toString().replace('\\', '/'), file));
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        return files;
    }
}
