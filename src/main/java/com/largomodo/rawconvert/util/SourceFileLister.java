package com.largomodo.rawconvert.util;

import com.largomodo.rawconvert.core.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Enumerates the raw files of an input directory as work items.
 * <p>
 * Non-recursive: only direct children of the directory are considered. Results are sorted
 * by file name so the submission order of a batch is reproducible.
 */
public class SourceFileLister {

    private static final Logger log = LoggerFactory.getLogger(SourceFileLister.class);

    private SourceFileLister() {
        // Static utility class - prevent instantiation
    }

    /**
     * List raw files directly inside {@code dir}.
     *
     * @param dir input directory
     * @return one work item per raw file, sorted by name
     * @throws IOException if the directory cannot be listed
     */
    public static List<WorkItem> list(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            throw new IOException("Input path is not a directory: " + dir);
        }

        try (Stream<Path> stream = Files.list(dir)) {
            List<WorkItem> items = stream
                    .filter(RawFileMatcher::isRaw)
                    .map(path -> new WorkItem(path.getFileName().toString()))
                    .sorted(Comparator.comparing(WorkItem::fileName))
                    .collect(Collectors.toList());
            log.debug("Listed {} raw files in {}", items.size(), dir);
            return items;
        } catch (UncheckedIOException e) {
            // Directory became unreadable mid-listing
            throw e.getCause();
        }
    }
}
