package io.packscan.diff;

import io.packscan.ScanConfig;
import io.packscan.archive.ArchiveAnalyzer;
import io.packscan.model.Finding;
import io.packscan.model.ScanItem;
import io.packscan.model.ScanLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Differential archive analysis of two versions of the same artifact.
 * <p>
 * For a changed archive both sides run through the archive analyzer. All anomalies of both
 * sides are reported. If either side was unpacked, a location pairing the two sides is
 * produced, preferring the unpacked directory over the raw archive on each side, so the
 * unpacked contents can be compared instead of the archive bytes.
 */
public class ArchiveDiffAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ArchiveDiffAnalyzer.class);

    private final ScanConfig config;
    private final ArchiveAnalyzer archiveAnalyzer;
    private final DirectoryDiffer differ = new DirectoryDiffer();

    public ArchiveDiffAnalyzer(ScanConfig config) {
        this.config = config;
        this.archiveAnalyzer = new ArchiveAnalyzer(config);
    }

    /**
     * Analyzes one diff entry. Only modified or renamed files whose content hash changed are
     * analyzed.
     * <p>
     * A yielded location is the "a" side of a pair and carries the "b" side under
     * {@link ScanLocation#PAIRED_LOCATION}; release both with {@link #releasePair(ScanLocation)}.
     */
    public Stream<ScanItem> analyze(DiffEntry diff) {
        if (diff.operation() != DiffOperation.MODIFIED && diff.operation() != DiffOperation.RENAMED) {
            return Stream.empty();
        }
        if (!diff.contentChanged()) {
            return Stream.empty();
        }

        ScanLocation a = diff.aScan().createChild(diff.aPath(), false);
        ScanLocation b = diff.bScan().createChild(diff.bPath(), false);
        try {
            List<ScanItem> aItems = collect(a);
            List<ScanItem> bItems;
            try {
                bItems = collect(b);
            } catch (RuntimeException e) {
                aItems.stream()
                        .filter(ScanLocation.class::isInstance)
                        .forEach(item -> ((ScanLocation) item).release());
                throw e;
            }

            List<ScanItem> out = new ArrayList<>();
            ScanLocation aUnpacked = findings(aItems, out);
            ScanLocation bUnpacked = findings(bItems, out);

            if (aUnpacked == null && bUnpacked == null) {
                return out.stream();
            }
            ScanLocation newA = aUnpacked != null ? aUnpacked : retained(a);
            ScanLocation newB = bUnpacked != null ? bUnpacked : retained(b);
            newA.putMetadata(ScanLocation.PAIRED_LOCATION, newB);
            out.add(newA);
            return out.stream();
        } finally {
            a.release();
            b.release();
        }
    }

    /**
     * Compares two files or directories, recursing into pairs of changed archives up to the
     * configured nesting depth. Takes over the caller's references to both locations.
     */
    public DiffReport diff(ScanLocation a, ScanLocation b) throws IOException {
        List<String> changes = new ArrayList<>();
        Set<Finding> findings = new LinkedHashSet<>();
        Queue<Pending> queue = new LinkedList<>();
        a.putMetadata(ScanLocation.PAIRED_LOCATION, b);
        queue.add(new Pending(a, ""));

        try {
            while (!queue.isEmpty()) {
                Pending pending = queue.poll();
                try {
                    compare(pending, queue, changes, findings);
                } finally {
                    releasePair(pending.location());
                }
            }
        } finally {
            // Left over only if a comparison failed
            while (!queue.isEmpty()) {
                releasePair(queue.poll().location());
            }
        }
        return new DiffReport(changes, new ArrayList<>(findings));
    }

    private void compare(Pending pending, Queue<Pending> queue, List<String> changes, Set<Finding> findings)
            throws IOException {
        ScanLocation a = pending.location();
        ScanLocation b = a.pairedLocation().orElseThrow();
        for (DiffEntry entry : differ.diff(a, b, pending.prefix())) {
            changes.add(entry.toString());
            try (Stream<ScanItem> items = analyze(entry)) {
                Iterator<ScanItem> iterator = items.iterator();
                while (iterator.hasNext()) {
                    ScanItem item = iterator.next();
                    if (item instanceof Finding finding) {
                        findings.add(finding);
                    } else if (item instanceof ScanLocation paired) {
                        int depth = Math.max(paired.depth(), paired.pairedLocation().orElseThrow().depth());
                        if (depth > config.maxDepth()) {
                            log.warn("Not comparing {}: nesting depth {} exceeds the maximum of {}",
                                    entry.name(), depth, config.maxDepth());
                            releasePair(paired);
                        } else {
                            queue.add(new Pending(paired, entry.name() + "!/"));
                        }
                    }
                }
            }
        }
    }

    /**
     * Releases the "a" side of a pair together with the "b" side it carries.
     */
    public static void releasePair(ScanLocation a) {
        a.pairedLocation().ifPresent(ScanLocation::release);
        a.release();
    }

    private List<ScanItem> collect(ScanLocation location) {
        List<ScanItem> items = new ArrayList<>();
        try (Stream<ScanItem> stream = archiveAnalyzer.analyze(location)) {
            stream.forEach(items::add);
        }
        return items;
    }

    /**
     * Moves the findings to {@code out} and returns the unpacked location, if any.
     */
    private static ScanLocation findings(List<ScanItem> items, List<ScanItem> out) {
        ScanLocation unpacked = null;
        for (ScanItem item : items) {
            if (item instanceof ScanLocation location) {
                unpacked = location;
            } else {
                out.add(item);
            }
        }
        return unpacked;
    }

    private static ScanLocation retained(ScanLocation location) {
        location.retain();
        return location;
    }

    private record Pending(ScanLocation location, String prefix) {
    }
}
